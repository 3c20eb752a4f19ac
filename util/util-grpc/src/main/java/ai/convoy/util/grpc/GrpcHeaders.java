package ai.convoy.util.grpc;

import io.grpc.Metadata;
import jakarta.annotation.Nullable;

public final class GrpcHeaders {
    public static final Metadata.Key<String> AUTHORIZATION = createMetadataKey("Authorization");

    private GrpcHeaders() {
    }

    @Nullable
    public static <T> T getHeader(@Nullable Metadata headers, Metadata.Key<T> key) {
        return headers == null ? null : headers.get(key);
    }

    public static Metadata.Key<String> createMetadataKey(String key) {
        return Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER);
    }
}
