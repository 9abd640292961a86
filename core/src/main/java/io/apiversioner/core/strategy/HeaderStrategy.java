package io.apiversioner.core.strategy;

import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.model.StrategyKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the version from a request header. The primary header is checked first, then each
 * alternative in order; the first present, non-blank value wins. With a {@code pattern}, group 1
 * of the first match is the token and a value that does not match counts as absent.
 */
public final class HeaderStrategy implements VersionStrategy {

    public static final String DEFAULT_HEADER = "X-API-Version";

    private final int priority;
    private final List<String> headerNames;
    private final Pattern pattern;

    public HeaderStrategy(int priority, String headerName, List<String> alternatives, Pattern pattern) {
        this.priority = priority;
        List<String> names = new ArrayList<>();
        names.add(headerName != null ? headerName : DEFAULT_HEADER);
        if (alternatives != null) {
            for (String alt : alternatives) {
                if (names.stream().noneMatch(alt::equalsIgnoreCase)) {
                    names.add(alt);
                }
            }
        }
        this.headerNames = List.copyOf(names);
        this.pattern = pattern;
    }

    @Override
    public String name() {
        return "header";
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.HEADER;
    }

    @Override
    public int priority() {
        return priority;
    }

    /** Header names in lookup order, primary first. */
    public List<String> headerNames() {
        return headerNames;
    }

    @Override
    public Optional<String> extract(RequestView request) {
        for (String header : headerNames) {
            String value = request.headers().first(header);
            if (value == null || value.isBlank()) {
                continue;
            }
            Optional<String> token = applyPattern(value.trim());
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    private Optional<String> applyPattern(String value) {
        if (pattern == null) {
            return Optional.of(value);
        }
        Matcher m = pattern.matcher(value);
        if (!m.find() || m.groupCount() < 1 || m.group(1) == null || m.group(1).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(m.group(1).trim());
    }
}
