package com.exformatter.plugins.elixir.format;

import java.util.Map;
import java.util.Optional;

/**
 * Remote functions that are renamed once the project targets a version
 * matching the entry's requirement. Only functions renamed inside the same
 * module are listed, since pointing a call to another module can break aliases.
 */
final class Deprecations {

    record Deprecation(String replacement, String requirement) {
    }

    private static final Map<String, Deprecation> RENAMES = Map.of(
            "Elixir.Enum.partition/2", new Deprecation("split_with", "~> 1.4"));

    private Deprecations() {
    }

    static Optional<Deprecation> lookup(String module, String fun, int arity) {
        if (module == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(RENAMES.get(module + "." + fun + "/" + arity));
    }
}
