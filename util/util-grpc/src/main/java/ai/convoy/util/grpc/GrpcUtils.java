package ai.convoy.util.grpc;

import com.google.common.net.HostAndPort;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.ProtoReflectionService;
import jakarta.annotation.Nullable;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

public final class GrpcUtils {
    public static final ServerInterceptor NO_AUTH = null;

    public static final long KEEP_ALIVE_TIME_MINS_ALLOWED = 1;

    private GrpcUtils() {
    }

    public static NettyServerBuilder addKeepAlive(NettyServerBuilder builder) {
        return builder
            .permitKeepAliveWithoutCalls(true)
            .permitKeepAliveTime(KEEP_ALIVE_TIME_MINS_ALLOWED, TimeUnit.MINUTES);
    }

    public static NettyServerBuilder addReflection(NettyServerBuilder builder) {
        return builder
            .addService(ProtoReflectionService.newInstance());
    }

    public static NettyServerBuilder intercept(NettyServerBuilder builder,
                                               @Nullable ServerInterceptor authInterceptor)
    {
        // interceptors run in reverse order of registration: auth first, then logging
        builder
            .intercept(GrpcExceptionHandlingInterceptor.server())
            .intercept(GrpcLogsInterceptor.server());
        if (authInterceptor != null) {
            builder.intercept(authInterceptor);
        }
        return builder;
    }

    public static NettyServerBuilder newGrpcServer(HostAndPort address, @Nullable ServerInterceptor authInterceptor) {
        return newGrpcServer(address.getHost(), address.getPort(), authInterceptor);
    }

    public static NettyServerBuilder newGrpcServer(String host, int port, @Nullable ServerInterceptor authInterceptor) {
        return intercept(
            addReflection(
                addKeepAlive(
                    NettyServerBuilder.forAddress(new InetSocketAddress(host, port)))),
            authInterceptor);
    }

    public static StatusRuntimeException mapToGrpcException(Throwable e) {
        if (e instanceof StatusRuntimeException statusRuntimeException) {
            return statusRuntimeException;
        }
        if (e instanceof StatusException statusException) {
            return new StatusRuntimeException(statusException.getStatus(), statusException.getTrailers());
        }
        if (e instanceof IllegalArgumentException) {
            return Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException();
        }
        if (e instanceof IllegalStateException) {
            return Status.FAILED_PRECONDITION.withDescription(e.getMessage()).asRuntimeException();
        }
        if (e instanceof UnsupportedOperationException) {
            return Status.UNIMPLEMENTED.withDescription(e.getMessage()).asRuntimeException();
        }
        if (e instanceof RuntimeException) {
            return Status.INTERNAL.withDescription(e.getMessage()).asRuntimeException();
        }
        return Status.UNKNOWN.withDescription(e.getMessage()).asRuntimeException();
    }
}
