package ai.convoy.util.auth.kubernetes;

import ai.convoy.util.auth.AuthenticateService;
import ai.convoy.util.auth.Principal;
import ai.convoy.util.auth.exceptions.AuthException;
import ai.convoy.util.auth.exceptions.AuthUnauthenticatedException;
import ai.convoy.util.auth.exceptions.AuthUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Authenticates executors by their Kubernetes service-account tokens.
 *
 * <p>Header format: {@code KubernetesAuth <base64url(json{"token": ..., "ca": base64url(ca)})>}.
 * The token's {@code kid} selects a file under the kid-mapping location holding the URL of the cluster
 * that issued it; that cluster then verifies the token with a {@code TokenReview}.
 */
public class KubernetesNativeAuthService implements AuthenticateService {
    private static final Logger LOG = LogManager.getLogger(KubernetesNativeAuthService.class);

    public static final String SCHEME = "KubernetesAuth";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final String kidMappingFileLocation;
    private final TokenCache cache;
    private final TokenReviewer reviewer;
    private final Clock clock;

    public KubernetesNativeAuthService(String kidMappingFileLocation, TokenCache cache, TokenReviewer reviewer,
                                       Clock clock)
    {
        this.kidMappingFileLocation = kidMappingFileLocation;
        this.cache = cache;
        this.reviewer = reviewer;
        this.clock = clock;
    }

    @Override
    public Principal authenticate(String authorizationHeader) throws AuthException {
        var parts = authorizationHeader.split(" ", 2);
        if (parts.length < 2 || !SCHEME.equals(parts[0])) {
            throw new AuthUnauthenticatedException("Missing " + SCHEME + " credentials");
        }

        final Credentials credentials;
        try {
            credentials = parseCredentials(parts[1]);
        } catch (IOException | IllegalArgumentException e) {
            throw new AuthUnauthenticatedException("Malformed " + SCHEME + " credentials", e);
        }

        var expiresAt = parseExpiry(credentials.token());
        var now = clock.instant();
        if (!now.isBefore(expiresAt)) {
            throw new AuthUnauthenticatedException("Token is expired");
        }

        var cached = cache.get(credentials.token());
        if (cached != null) {
            if (cached.kind() == TokenCache.Kind.VALID) {
                return Principal.of(cached.name());
            }
            throw new AuthUnauthenticatedException("Token is invalid");
        }

        var clusterUrl = clusterUrl(credentials.token());

        final TokenReviewer.Result result;
        try {
            result = reviewer.review(clusterUrl, credentials.token(), credentials.ca());
        } catch (Exception e) {
            LOG.error("Token review against {} failed: {}", clusterUrl, e.getMessage());
            throw new AuthUnavailableException("Token review failed", e);
        }

        if (!result.authenticated()) {
            cache.putInvalid(credentials.token());
            throw new AuthUnauthenticatedException("Provided token was rejected by TokenReview");
        }

        cache.putValid(credentials.token(), result.username(), Duration.between(now, expiresAt));
        return Principal.of(result.username());
    }

    private record Credentials(String token, byte[] ca) {}

    private static Credentials parseCredentials(String encoded) throws IOException {
        JsonNode body = MAPPER.readTree(DECODER.decode(encoded));
        var token = body.path("token").asText("");
        if (token.isEmpty()) {
            throw new IllegalArgumentException("token is empty");
        }
        var ca = DECODER.decode(body.path("ca").asText(""));
        return new Credentials(token, ca);
    }

    static Instant parseExpiry(String token) throws AuthException {
        var parts = token.split("\\.");
        if (parts.length != 3) {
            throw new AuthUnauthenticatedException("Provided JWT token should have 3 parts");
        }
        final long exp;
        try {
            exp = MAPPER.readTree(DECODER.decode(parts[1])).path("exp").asLong(0);
        } catch (IOException | IllegalArgumentException e) {
            throw new AuthUnauthenticatedException("Cannot parse JWT payload", e);
        }
        if (exp == 0) {
            throw new AuthUnauthenticatedException("Token expiry time not set");
        }
        return Instant.ofEpochSecond(exp);
    }

    String clusterUrl(String token) throws AuthException {
        final String kid;
        try {
            kid = MAPPER.readTree(DECODER.decode(token.split("\\.")[0])).path("kid").asText("");
        } catch (IOException | IllegalArgumentException e) {
            throw new AuthUnauthenticatedException("Cannot parse JWT header", e);
        }
        validateKid(kid);

        try {
            return Files.readString(Path.of(kidMappingFileLocation + kid), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new AuthUnauthenticatedException("Unknown token kid " + kid, e);
        }
    }

    static void validateKid(String kid) throws AuthException {
        if (kid.isEmpty()) {
            throw new AuthUnauthenticatedException("Kubernetes serviceaccount token KID must not be empty");
        }
        if (kid.contains("../")) {
            throw new AuthUnauthenticatedException("KID contains ../");
        }
    }
}
