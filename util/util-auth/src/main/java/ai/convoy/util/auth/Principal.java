package ai.convoy.util.auth;

import java.util.List;

public record Principal(
    String name,
    List<String> groups
) {
    public static Principal of(String name) {
        return new Principal(name, List.of(name));
    }
}
