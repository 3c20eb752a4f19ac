package ai.convoy.util.auth.grpc;

import ai.convoy.util.auth.AuthenticateService;
import ai.convoy.util.auth.Principal;
import ai.convoy.util.auth.exceptions.AuthException;
import ai.convoy.util.auth.exceptions.AuthUnauthenticatedException;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import static ai.convoy.util.grpc.GrpcHeaders.AUTHORIZATION;

public class AuthServerInterceptor implements ServerInterceptor {
    private static final Logger LOG = LogManager.getLogger(AuthServerInterceptor.class);

    private final AuthenticateService authenticateService;

    public AuthServerInterceptor(AuthenticateService authenticateService) {
        this.authenticateService = authenticateService;
    }

    @Override
    public <T, R> ServerCall.Listener<T> interceptCall(ServerCall<T, R> call, Metadata headers,
                                                       ServerCallHandler<T, R> next)
    {
        final Principal principal;
        try {
            String authorizationHeader = headers.get(AUTHORIZATION);
            if (authorizationHeader == null) {
                throw new AuthUnauthenticatedException("Authorization header is missing");
            }
            principal = authenticateService.authenticate(authorizationHeader);
        } catch (AuthException e) {
            LOG.warn("Refuse {} with {}: {}", call.getMethodDescriptor().getFullMethodName(), e.code(),
                e.getMessage(), e.getCause());
            call.close(e.callStatus(), new Metadata());
            return new ServerCall.Listener<>() {};
        }

        Context context = Context.current().withValue(AuthenticationContext.KEY, new AuthenticationContext(principal));
        return Contexts.interceptCall(context, new PrincipalServerCall<>(call, principal.name()), headers, next);
    }

    private static class PrincipalServerCall<M, R> extends ForwardingServerCall.SimpleForwardingServerCall<M, R> {
        private PrincipalServerCall(ServerCall<M, R> serverCall, String principal) {
            super(serverCall);
            ThreadContext.put("subj", principal);
        }

        @Override
        public void close(Status status, Metadata trailers) {
            super.close(status, trailers);
            ThreadContext.remove("subj");
        }
    }
}
