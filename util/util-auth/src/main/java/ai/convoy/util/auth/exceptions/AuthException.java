package ai.convoy.util.auth.exceptions;

import io.grpc.Status;

/**
 * Credentials rejected or not verifiable. The message stays in server logs; the caller gets the status
 * code with a fixed description.
 */
public abstract class AuthException extends RuntimeException {

    protected AuthException(String reason, Throwable cause) {
        super(reason, cause, false, false);
    }

    public abstract Status.Code code();

    protected abstract String callerDescription();

    public Status callStatus() {
        return Status.fromCode(code()).withDescription(callerDescription());
    }
}
