package io.apiversioner.core.strategy;

import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.model.StrategyKind;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the version from a leading path segment such as {@code /v2/users} or
 * {@code /api/v2.1/users}. The token is the remainder of the segment after the prefix and must
 * start with a digit.
 */
public final class UrlPathStrategy implements VersionStrategy {

    public static final String DEFAULT_PREFIX = "v";

    private final int priority;
    private final String prefix;
    private final String apiPrefix;
    private final Pattern pattern;

    /**
     * @param priority  evaluation order
     * @param prefix    literal preceding the token inside the segment, e.g. {@code v}
     * @param apiPrefix optional leading path, e.g. {@code /api}; may be absent from a request
     */
    public UrlPathStrategy(int priority, String prefix, String apiPrefix) {
        this.priority = priority;
        this.prefix = prefix != null ? prefix : DEFAULT_PREFIX;
        this.apiPrefix = normalizeApiPrefix(apiPrefix);
        String apiGroup = this.apiPrefix.isEmpty() ? "()" : "(" + Pattern.quote(this.apiPrefix) + ")?";
        this.pattern = Pattern.compile("^" + apiGroup + "/" + Pattern.quote(this.prefix) + "(\\d[^/]*)(?=/|$)");
    }

    @Override
    public String name() {
        return "url-path";
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.URL_PATH;
    }

    @Override
    public int priority() {
        return priority;
    }

    public String prefix() {
        return prefix;
    }

    public String apiPrefix() {
        return apiPrefix;
    }

    @Override
    public Optional<String> extract(RequestView request) {
        Matcher m = pattern.matcher(request.path());
        return m.find() ? Optional.of(m.group(2)) : Optional.empty();
    }

    @Override
    public String routePath(String path) {
        Matcher m = pattern.matcher(path);
        if (!m.find()) {
            return path;
        }
        String lead = m.group(1) != null ? m.group(1) : "";
        String stripped = lead + path.substring(m.end());
        return stripped.isEmpty() ? "/" : stripped;
    }

    private static String normalizeApiPrefix(String apiPrefix) {
        if (apiPrefix == null || apiPrefix.isBlank() || apiPrefix.equals("/")) {
            return "";
        }
        String p = apiPrefix.trim();
        if (!p.startsWith("/")) {
            p = "/" + p;
        }
        return p.endsWith("/") ? p.substring(0, p.length() - 1) : p;
    }
}
