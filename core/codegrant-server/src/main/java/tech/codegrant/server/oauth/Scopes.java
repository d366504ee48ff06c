package tech.codegrant.server.oauth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Space-delimited scope strings.
 */
public final class Scopes {

    private Scopes() {
    }

    /**
     * Split on whitespace, dropping blanks and duplicates. Order is preserved.
     */
    public static List<String> parse(String scope) {
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String part : scope.trim().split("\\s+")) {
            unique.add(part);
        }
        return new ArrayList<>(unique);
    }

    public static String join(Collection<String> scopes) {
        return String.join(" ", scopes);
    }
}
