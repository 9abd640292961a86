package io.apiversioner.core.strategy;

import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.model.StrategyKind;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the version from the {@code Accept} header, either from a vendor media type
 * ({@code application/vnd.acme.v2+json}) or from a media type parameter
 * ({@code application/json;version=2}).
 *
 * <p>
 * Media ranges are scanned left to right. Within a range the vendor pattern (when configured) is
 * tried before the parameters. A {@code media-type} filter restricts parameter lookup to ranges of
 * that exact type.
 */
public final class AcceptHeaderStrategy implements VersionStrategy {

    public static final String DEFAULT_PARAMETER = "version";

    /** Vendor media type pattern enabled by the {@code vendor} flag. */
    public static final Pattern DEFAULT_VENDOR_PATTERN =
            Pattern.compile("application/vnd\\.[\\w.-]+\\.v(\\d+(?:\\.\\d+)?)\\+\\w+");

    private final int priority;
    private final String parameter;
    private final String mediaType;
    private final Pattern vendorPattern;

    /**
     * @param priority      evaluation order
     * @param parameter     media type parameter carrying the version
     * @param mediaType     only ranges of this type are inspected for the parameter, nullable
     * @param vendorPattern pattern whose group 1 is the token, nullable to disable vendor types
     */
    public AcceptHeaderStrategy(int priority, String parameter, String mediaType, Pattern vendorPattern) {
        this.priority = priority;
        this.parameter = parameter != null ? parameter : DEFAULT_PARAMETER;
        this.mediaType = mediaType;
        this.vendorPattern = vendorPattern;
    }

    @Override
    public String name() {
        return "accept-header";
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.ACCEPT_HEADER;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public Optional<String> extract(RequestView request) {
        String accept = request.accept();
        if (accept == null || accept.isBlank()) {
            return Optional.empty();
        }
        for (String range : accept.split(",")) {
            Optional<String> token = fromRange(range.trim());
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    private Optional<String> fromRange(String range) {
        if (vendorPattern != null) {
            Matcher m = vendorPattern.matcher(range);
            if (m.find() && m.groupCount() >= 1 && m.group(1) != null && !m.group(1).isBlank()) {
                return Optional.of(m.group(1).trim());
            }
        }
        String[] parts = range.split(";");
        if (mediaType != null && !parts[0].trim().equalsIgnoreCase(mediaType)) {
            return Optional.empty();
        }
        for (int i = 1; i < parts.length; i++) {
            int eq = parts[i].indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = parts[i].substring(0, eq).trim();
            if (key.equalsIgnoreCase(parameter)) {
                String value = unquote(parts[i].substring(eq + 1).trim());
                return value.isBlank() ? Optional.empty() : Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }
}
