package com.exformatter.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A semantic version, {@code major.minor.patch[-pre][+build]}.
 * <p>
 * Versions are immutable. Build metadata is kept for display and ignored when
 * comparing. A version with a pre-release part sorts before the same version
 * without one.
 */
public final class Version implements Comparable<Version> {
    private static final Pattern VERSION =
            Pattern.compile("(\\d+)\\.(\\d+)\\.(\\d+)(?:-([0-9A-Za-z.-]+))?(?:\\+([0-9A-Za-z.-]+))?");
    private static final Pattern REQUIREMENT_VERSION =
            Pattern.compile("(\\d+)\\.(\\d+)(?:\\.(\\d+))?(?:-([0-9A-Za-z.-]+))?");

    private final int major;
    private final int minor;
    private final int patch;
    private final List<String> pre;
    private final String build;

    public Version(int major, int minor, int patch) {
        this(major, minor, patch, List.of(), null);
    }

    private Version(int major, int minor, int patch, List<String> pre, String build) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Negative component in version " + major + "." + minor + "." + patch);
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.pre = List.copyOf(pre);
        this.build = build;
    }

    /**
     * Parses a full version.
     *
     * @throws IllegalArgumentException if {@code text} is not a version
     */
    public static Version parse(String text) {
        Matcher matcher = VERSION.matcher(text == null ? "" : text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid version '" + text + "'");
        }
        return new Version(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)),
                splitPre(matcher.group(4)),
                matcher.group(5));
    }

    private static List<String> splitPre(String pre) {
        return pre == null ? List.of() : Arrays.asList(pre.split("\\."));
    }

    public int getMajor() { return major; }

    public int getMinor() { return minor; }

    public int getPatch() { return patch; }

    public List<String> getPre() { return pre; }

    public boolean isPreRelease() {
        return !pre.isEmpty();
    }

    /**
     * Checks this version against a requirement such as {@code "~> 1.4"} or
     * {@code ">= 1.2.0 and < 2.0.0"}. Clauses can be combined with {@code and}
     * and {@code or}; {@code and} binds tighter.
     *
     * @throws IllegalArgumentException if the requirement cannot be parsed
     */
    public boolean matches(String requirement) {
        if (requirement == null || requirement.isBlank()) {
            throw new IllegalArgumentException("Empty version requirement");
        }
        for (String alternative : requirement.split("\\s+or\\s+")) {
            boolean all = true;
            for (String clause : alternative.split("\\s+and\\s+")) {
                all &= matchesClause(clause.trim(), requirement);
            }
            if (all) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesClause(String clause, String requirement) {
        String operator = "==";
        String operand = clause;
        for (String candidate : List.of("~>", ">=", "<=", "==", "!=", ">", "<")) {
            if (clause.startsWith(candidate)) {
                operator = candidate;
                operand = clause.substring(candidate.length()).trim();
                break;
            }
        }

        Matcher matcher = REQUIREMENT_VERSION.matcher(operand);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid version requirement '" + requirement + "'");
        }
        int reqMajor = Integer.parseInt(matcher.group(1));
        int reqMinor = Integer.parseInt(matcher.group(2));
        boolean hasPatch = matcher.group(3) != null;
        int reqPatch = hasPatch ? Integer.parseInt(matcher.group(3)) : 0;
        Version bound = new Version(reqMajor, reqMinor, reqPatch, splitPre(matcher.group(4)), null);

        if (!hasPatch && !operator.equals("~>")) {
            throw new IllegalArgumentException("Invalid version requirement '" + requirement + "'");
        }

        int comparison = compareTo(bound);
        return switch (operator) {
            case "~>" -> {
                Version upper = hasPatch
                        ? new Version(reqMajor, reqMinor + 1, 0, List.of("0"), null)
                        : new Version(reqMajor + 1, 0, 0, List.of("0"), null);
                yield comparison >= 0 && compareTo(upper) < 0;
            }
            case ">=" -> comparison >= 0;
            case "<=" -> comparison <= 0;
            case ">" -> comparison > 0;
            case "<" -> comparison < 0;
            case "!=" -> comparison != 0;
            default -> comparison == 0;
        };
    }

    @Override
    public int compareTo(Version other) {
        int result = Integer.compare(major, other.major);
        if (result == 0) {
            result = Integer.compare(minor, other.minor);
        }
        if (result == 0) {
            result = Integer.compare(patch, other.patch);
        }
        if (result == 0) {
            result = comparePre(pre, other.pre);
        }
        return result;
    }

    private static int comparePre(List<String> left, List<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            // a release sorts after its pre-releases
            return Boolean.compare(left.isEmpty(), right.isEmpty());
        }
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            int result = comparePreIdentifier(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int comparePreIdentifier(String left, String right) {
        boolean leftNumeric = left.chars().allMatch(Character::isDigit);
        boolean rightNumeric = right.chars().allMatch(Character::isDigit);
        if (leftNumeric && rightNumeric) {
            return Long.compare(Long.parseLong(left), Long.parseLong(right));
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Version version)) return false;
        return compareTo(version) == 0;
    }

    @Override
    public int hashCode() {
        List<Object> parts = new ArrayList<>(List.of(major, minor, patch));
        parts.addAll(pre);
        return parts.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(major).append('.').append(minor).append('.').append(patch);
        if (!pre.isEmpty()) {
            b.append('-').append(String.join(".", pre));
        }
        if (build != null) {
            b.append('+').append(build);
        }
        return b.toString();
    }
}
