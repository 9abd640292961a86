package io.apiversioner.core.engine;

/**
 * Matches request paths against route templates.
 *
 * <p>
 * Template segments:
 * <ul>
 * <li>literal: must equal the path segment</li>
 * <li>{@code {name}}: any single segment</li>
 * <li>{@code *}: any single segment</li>
 * <li>{@code **}: zero or more segments</li>
 * </ul>
 * When several templates match, the one with the most literal segments wins; see
 * {@link #specificity(String)}.
 *
 * <p>
 * Thread-safe and stateless.
 */
final class RoutePathMatcher {

    private RoutePathMatcher() {}

    static boolean matches(String template, String path) {
        if (template.equals(path)) {
            return true;
        }
        return matchSegments(splitPath(template), splitPath(path), 0, 0);
    }

    /** Number of literal segments; higher is more specific. */
    static int specificity(String template) {
        int score = 0;
        for (String segment : splitPath(template)) {
            if (!isWildcard(segment)) {
                score++;
            }
        }
        return score;
    }

    /** Number of {@code **} segments; used to break specificity ties (fewer wins). */
    static int multiSegmentWildcards(String template) {
        int count = 0;
        for (String segment : splitPath(template)) {
            if (segment.equals("**")) {
                count++;
            }
        }
        return count;
    }

    /** Strips a trailing slash and collapses the empty path to {@code /}. */
    static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String p = path.startsWith("/") ? path : "/" + path;
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private static boolean matchSegments(String[] template, String[] path, int ti, int si) {
        if (ti == template.length && si == path.length) {
            return true;
        }
        if (ti == template.length) {
            return false;
        }

        // ** matches zero or more segments
        if (template[ti].equals("**")) {
            for (int i = si; i <= path.length; i++) {
                if (matchSegments(template, path, ti + 1, i)) {
                    return true;
                }
            }
            return false;
        }

        if (si == path.length) {
            return false;
        }
        if (isSingleSegmentWildcard(template[ti]) || template[ti].equals(path[si])) {
            return matchSegments(template, path, ti + 1, si + 1);
        }
        return false;
    }

    private static boolean isWildcard(String segment) {
        return segment.equals("**") || isSingleSegmentWildcard(segment);
    }

    private static boolean isSingleSegmentWildcard(String segment) {
        return segment.equals("*") || (segment.length() > 2 && segment.startsWith("{") && segment.endsWith("}"));
    }

    private static String[] splitPath(String path) {
        if (path == null || path.isEmpty() || path.equals("/")) {
            return new String[0];
        }
        String normalized = path.startsWith("/") ? path.substring(1) : path;
        return normalized.split("/");
    }
}
