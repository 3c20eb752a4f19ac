package ai.convoy.util.auth.grpc;

import ai.convoy.util.auth.Principal;
import io.grpc.Context;
import jakarta.annotation.Nullable;

import java.util.Objects;

public final class AuthenticationContext {
    public static final Context.Key<AuthenticationContext> KEY = Context.key("authentication-context");

    private final Principal principal;

    public AuthenticationContext(Principal principal) {
        this.principal = Objects.requireNonNull(principal, "principal is null");
    }

    @Nullable
    public static AuthenticationContext current() {
        return KEY.get();
    }

    public static boolean isAuthenticated() {
        return current() != null;
    }

    public static Principal currentPrincipal() {
        AuthenticationContext ctx = current();
        if (ctx == null) {
            throw new IllegalStateException("Must be called in AuthenticationContext context!");
        }
        return ctx.principal();
    }

    public Principal principal() {
        return principal;
    }
}
