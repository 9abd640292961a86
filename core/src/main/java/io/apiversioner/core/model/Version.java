package io.apiversioner.core.model;

import io.apiversioner.core.error.IncomparableVersionException;
import io.apiversioner.core.error.InvalidVersionException;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable API version value.
 *
 * <p>
 * Equality and ordering use the parsed components only; the {@link #raw()} input string is kept
 * for diagnostics. Ordering is total within one {@link VersionFormat}: major, minor, patch (an
 * absent patch sorts before any present patch), then label (a pre-release sorts before the
 * release it labels). Comparing versions of different formats throws
 * {@link IncomparableVersionException}.
 *
 * <p>
 * {@link #toString()} is the canonical form, and {@code parse(v.toString(), v.format())} always
 * equals {@code v}.
 */
public final class Version implements Comparable<Version> {

    private static final Pattern SEMANTIC = Pattern.compile("(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:-([A-Za-z0-9.]+))?");
    private static final Pattern SIMPLE = Pattern.compile("(\\d+)(?:\\.(\\d+))?");
    private static final Pattern DATE = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");

    private final VersionFormat format;
    private final int major;
    private final int minor;
    private final Integer patch;
    private final String label;
    private final String raw;

    private Version(VersionFormat format, int major, int minor, Integer patch, String label, String raw) {
        this.format = format;
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.label = label;
        this.raw = raw;
    }

    /**
     * Parses a version string in the given format. Surrounding whitespace is ignored.
     *
     * <p>
     * A SEMANTIC pre-release label is dot-separated identifiers of {@code [A-Za-z0-9]}. Empty
     * identifiers are rejected, so {@code 1.0.0-rc..1}, {@code 1.0.0-rc.} and {@code 1.0.0-.rc}
     * do not parse even though their characters are all allowed.
     *
     * @param raw    the version string, e.g. {@code "1.2"} or {@code "2024-01-15"}
     * @param format the grammar to apply
     * @return the parsed version
     * @throws InvalidVersionException if the string is null, blank, or does not match the grammar
     */
    public static Version parse(String raw, VersionFormat format) {
        Objects.requireNonNull(format, "format must not be null");
        if (raw == null || raw.isBlank()) {
            throw new InvalidVersionException(String.valueOf(raw), format);
        }
        String input = raw.trim();
        return switch (format) {
            case SEMANTIC -> parseSemantic(input, raw);
            case SIMPLE -> parseSimple(input, raw);
            case DATE -> parseDate(input, raw);
        };
    }

    /**
     * Three-way comparison of two versions of the same format.
     *
     * @throws IncomparableVersionException if the formats differ
     */
    public static VersionOrdering compare(Version a, Version b) {
        return VersionOrdering.of(a.compareTo(b));
    }

    @Override
    public int compareTo(Version other) {
        if (format != other.format) {
            throw new IncomparableVersionException(this, other);
        }
        int c = Integer.compare(major, other.major);
        if (c != 0) {
            return c;
        }
        c = Integer.compare(minor, other.minor);
        if (c != 0) {
            return c;
        }
        c = comparePatch(patch, other.patch);
        if (c != 0) {
            return c;
        }
        return compareLabels(label, other.label);
    }

    public VersionFormat format() {
        return format;
    }

    public int major() {
        return major;
    }

    public int minor() {
        return minor;
    }

    /** Patch component, or {@code null} when the input had none. */
    public Integer patch() {
        return patch;
    }

    /** Pre-release label (SEMANTIC only), or {@code null}. */
    public String label() {
        return label;
    }

    /** The original input string, untrimmed. */
    public String raw() {
        return raw;
    }

    /** True for SEMANTIC versions carrying a pre-release label. */
    public boolean isPrerelease() {
        return label != null;
    }

    /**
     * The calendar date of a DATE version.
     *
     * @throws IllegalStateException for other formats
     */
    public LocalDate toDate() {
        if (format != VersionFormat.DATE) {
            throw new IllegalStateException("toDate() is only defined for DATE versions, not " + format);
        }
        return LocalDate.of(major, minor, patch);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Version other)) {
            return false;
        }
        return format == other.format
                && major == other.major
                && minor == other.minor
                && Objects.equals(patch, other.patch)
                && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, major, minor, patch, label);
    }

    @Override
    public String toString() {
        if (format == VersionFormat.DATE) {
            return toDate().toString();
        }
        StringBuilder sb = new StringBuilder().append(major).append('.').append(minor);
        if (patch != null) {
            sb.append('.').append(patch);
        }
        if (label != null) {
            sb.append('-').append(label);
        }
        return sb.toString();
    }

    // --- Parsing ---

    private static Version parseSemantic(String input, String raw) {
        Matcher m = SEMANTIC.matcher(input);
        if (!m.matches() || (m.group(4) != null && !validLabel(m.group(4)))) {
            throw new InvalidVersionException(raw, VersionFormat.SEMANTIC);
        }
        return new Version(
                VersionFormat.SEMANTIC,
                number(m.group(1), raw, VersionFormat.SEMANTIC),
                m.group(2) != null ? number(m.group(2), raw, VersionFormat.SEMANTIC) : 0,
                m.group(3) != null ? number(m.group(3), raw, VersionFormat.SEMANTIC) : null,
                m.group(4),
                raw);
    }

    private static Version parseSimple(String input, String raw) {
        Matcher m = SIMPLE.matcher(input);
        if (!m.matches()) {
            throw new InvalidVersionException(raw, VersionFormat.SIMPLE);
        }
        return new Version(
                VersionFormat.SIMPLE,
                number(m.group(1), raw, VersionFormat.SIMPLE),
                m.group(2) != null ? number(m.group(2), raw, VersionFormat.SIMPLE) : 0,
                null,
                null,
                raw);
    }

    private static Version parseDate(String input, String raw) {
        Matcher m = DATE.matcher(input);
        if (!m.matches()) {
            throw new InvalidVersionException(raw, VersionFormat.DATE);
        }
        int year = Integer.parseInt(m.group(1));
        int month = Integer.parseInt(m.group(2));
        int day = Integer.parseInt(m.group(3));
        try {
            LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new InvalidVersionException(raw, VersionFormat.DATE, null, null, e);
        }
        return new Version(VersionFormat.DATE, year, month, day, null, raw);
    }

    private static int number(String digits, String raw, VersionFormat format) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new InvalidVersionException(raw, format, null, null, e);
        }
    }

    /** Labels are dot-separated identifiers; empty identifiers are rejected. */
    private static boolean validLabel(String label) {
        if (label.startsWith(".") || label.endsWith(".")) {
            return false;
        }
        return !label.contains("..");
    }

    // --- Ordering helpers ---

    private static int comparePatch(Integer a, Integer b) {
        if (Objects.equals(a, b)) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        return Integer.compare(a, b);
    }

    private static int compareLabels(String a, String b) {
        if (Objects.equals(a, b)) {
            return 0;
        }
        // the unlabelled release ranks above any of its pre-releases
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        int shared = Math.min(left.length, right.length);
        for (int i = 0; i < shared; i++) {
            int c = compareIdentifier(left[i], right[i]);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.length, right.length);
    }

    private static int compareIdentifier(String a, String b) {
        boolean aNumeric = isNumeric(a);
        boolean bNumeric = isNumeric(b);
        if (aNumeric && bNumeric) {
            int c = new BigInteger(a).compareTo(new BigInteger(b));
            return c != 0 ? c : a.compareTo(b);
        }
        if (aNumeric) {
            return -1;
        }
        if (bNumeric) {
            return 1;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return !s.isEmpty();
    }
}
