package com.exformatter.plugins.elixir;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

import com.exformatter.util.Version;

/**
 * Options for a single formatting run.
 */
public final class FormatOptions {
    public static final int DEFAULT_LINE_LENGTH = 98;
    public static final String DEFAULT_FILE = "nofile";

    private static final Pattern LOCAL_WITHOUT_PARENS = Pattern.compile("[a-z_][A-Za-z0-9_]*[?!]?/(\\d+|\\*)");

    private final String file;
    private final int line;
    private final int lineLength;
    private final Set<String> localsWithoutParens;
    private final Version renameDeprecatedAt;

    private FormatOptions(Builder builder) {
        this.file = builder.file;
        this.line = builder.line;
        this.lineLength = builder.lineLength;
        this.localsWithoutParens = Set.copyOf(builder.localsWithoutParens);
        this.renameDeprecatedAt = builder.renameDeprecatedAt;
    }

    public static FormatOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder starting from these options. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.file = file;
        builder.line = line;
        builder.lineLength = lineLength;
        builder.localsWithoutParens.addAll(localsWithoutParens);
        builder.renameDeprecatedAt = renameDeprecatedAt;
        return builder;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getLineLength() {
        return lineLength;
    }

    /** Extra {@code name/arity} or {@code name/*} entries, on top of the built-in list. */
    public Set<String> getLocalsWithoutParens() {
        return localsWithoutParens;
    }

    /** The version deprecated calls are renamed for, or null to keep them. */
    public Version getRenameDeprecatedAt() {
        return renameDeprecatedAt;
    }

    public static class Builder {
        private String file = DEFAULT_FILE;
        private int line = 1;
        private int lineLength = DEFAULT_LINE_LENGTH;
        private final Set<String> localsWithoutParens = new LinkedHashSet<>();
        private Version renameDeprecatedAt;

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder lineLength(int lineLength) {
            if (lineLength <= 0) {
                throw new IllegalArgumentException("invalid line length " + lineLength + " given to lineLength");
            }
            this.lineLength = lineLength;
            return this;
        }

        public Builder localsWithoutParens(Collection<String> locals) {
            for (String local : locals) {
                if (!LOCAL_WITHOUT_PARENS.matcher(local).matches()) {
                    throw new IllegalArgumentException(
                            "invalid entry \"" + local + "\" given to localsWithoutParens, expected name/arity or name/*");
                }
                localsWithoutParens.add(local);
            }
            return this;
        }

        /**
         * @param version a version such as {@code 1.6.0}, or null
         * @throws IllegalArgumentException when {@code version} cannot be parsed
         */
        public Builder renameDeprecatedAt(String version) {
            if (version == null) {
                this.renameDeprecatedAt = null;
                return this;
            }
            try {
                this.renameDeprecatedAt = Version.parse(version);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "invalid version \"" + version + "\" given to renameDeprecatedAt", e);
            }
            return this;
        }

        public FormatOptions build() {
            return new FormatOptions(this);
        }
    }
}
