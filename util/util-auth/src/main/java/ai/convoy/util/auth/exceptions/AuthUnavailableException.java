package ai.convoy.util.auth.exceptions;

import io.grpc.Status;

public class AuthUnavailableException extends AuthException {

    public AuthUnavailableException(String reason, Throwable cause) {
        super(reason, cause);
    }

    @Override
    public Status.Code code() {
        return Status.Code.UNAVAILABLE;
    }

    @Override
    protected String callerDescription() {
        return "Credentials cannot be verified, retry later";
    }
}
