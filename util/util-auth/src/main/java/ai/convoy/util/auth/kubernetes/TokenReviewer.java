package ai.convoy.util.auth.kubernetes;

public interface TokenReviewer {

    record Result(
        boolean authenticated,
        String username
    ) {}

    Result review(String clusterUrl, String token, byte[] ca) throws Exception;
}
