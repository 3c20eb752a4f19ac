package ai.convoy.util.auth.exceptions;

import io.grpc.Status;

public class AuthUnauthenticatedException extends AuthException {

    public AuthUnauthenticatedException(String reason) {
        super(reason, null);
    }

    public AuthUnauthenticatedException(String reason, Throwable cause) {
        super(reason, cause);
    }

    @Override
    public Status.Code code() {
        return Status.Code.UNAUTHENTICATED;
    }

    @Override
    protected String callerDescription() {
        return "Missing or invalid credentials";
    }
}
