package ai.convoy.util.auth.kubernetes;

import io.fabric8.kubernetes.api.model.authentication.TokenReview;
import io.fabric8.kubernetes.api.model.authentication.TokenReviewBuilder;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import java.util.Base64;

/**
 * Asks the token's home cluster to verify it with a {@code TokenReview}, authenticating as the token itself.
 */
public class KubernetesTokenReviewer implements TokenReviewer {

    @Override
    public Result review(String clusterUrl, String token, byte[] ca) {
        var config = new ConfigBuilder()
            .withMasterUrl(clusterUrl)
            .withOauthToken(token)
            .withCaCertData(Base64.getEncoder().encodeToString(ca))
            .build();

        try (var client = new KubernetesClientBuilder().withConfig(config).build()) {
            TokenReview review = new TokenReviewBuilder()
                .withNewSpec()
                    .withToken(token)
                .endSpec()
                .build();

            TokenReview result = client.authentication().v1().tokenReviews().create(review);
            var status = result.getStatus();
            if (status == null || !Boolean.TRUE.equals(status.getAuthenticated())) {
                return new Result(false, "");
            }
            var user = status.getUser();
            return new Result(true, user == null ? "" : user.getUsername());
        }
    }
}
