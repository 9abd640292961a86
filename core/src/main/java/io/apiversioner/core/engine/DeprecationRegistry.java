package io.apiversioner.core.engine;

import io.apiversioner.core.error.RouteRegistrationException;
import io.apiversioner.core.model.DeprecationHeaderNames;
import io.apiversioner.core.model.DeprecationInfo;
import io.apiversioner.core.model.DeprecationOutcome;
import io.apiversioner.core.model.DeprecationPolicy;
import io.apiversioner.core.model.DeprecationStatus;
import io.apiversioner.core.model.VersionSpec;
import io.apiversioner.core.model.WarningLevel;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates the deprecation lifecycle of endpoint versions and builds the response headers that
 * signal it.
 *
 * <p>
 * Status rules at instant {@code now}:
 * <ul>
 * <li>no {@link DeprecationInfo}: ACTIVE, no headers</li>
 * <li>sunset date present and {@code now >= sunset}: SUNSET</li>
 * <li>otherwise: DEPRECATED</li>
 * </ul>
 * Both deprecated states emit {@code Deprecation: true}, {@code Sunset} (IMF-fixdate) when dated,
 * and a {@code Link} with {@code rel="successor-version"} and/or {@code rel="deprecation"}.
 * Only DEPRECATED adds a {@code Warning}: code 199 for CRITICAL, 299 otherwise.
 *
 * <p>
 * Nothing is cached; evaluation is a pure function of the spec and the instant. Thread-safe.
 */
public final class DeprecationRegistry {

    /** IMF-fixdate as defined by RFC 9110 §5.6.7, e.g. {@code Sun, 06 Nov 1994 08:49:37 GMT}. */
    static final DateTimeFormatter IMF_FIXDATE =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    private final DeprecationHeaderNames headerNames;
    private final DeprecationPolicy policy;
    private final Clock clock;

    public DeprecationRegistry(DeprecationHeaderNames headerNames, DeprecationPolicy policy, Clock clock) {
        this.headerNames = Objects.requireNonNull(headerNames, "headerNames must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Registry with default header names, a lenient policy and the system UTC clock. */
    public static DeprecationRegistry withDefaults() {
        return new DeprecationRegistry(DeprecationHeaderNames.DEFAULTS, DeprecationPolicy.LENIENT, Clock.systemUTC());
    }

    /** Evaluates {@code spec} at the registry clock's current instant. */
    public DeprecationOutcome evaluate(VersionSpec spec) {
        return evaluate(spec, clock.instant());
    }

    /** Evaluates {@code spec} at {@code now}. */
    public DeprecationOutcome evaluate(VersionSpec spec, Instant now) {
        DeprecationInfo info = spec.deprecation();
        if (info == null) {
            return DeprecationOutcome.active();
        }
        DeprecationStatus status = statusOf(info, now);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(headerNames.deprecation(), "true");
        if (info.sunsetDate() != null) {
            headers.put(headerNames.sunset(), IMF_FIXDATE.format(info.sunsetDate()));
        }
        String link = linkValue(info);
        if (link != null) {
            headers.put(headerNames.link(), link);
        }
        if (status == DeprecationStatus.DEPRECATED) {
            headers.put(headerNames.warning(), warningValue(info, now));
        }
        return new DeprecationOutcome(status, headers);
    }

    /** Lifecycle status of {@code info} at {@code now}, without building headers. */
    public static DeprecationStatus statusOf(DeprecationInfo info, Instant now) {
        if (info == null) {
            return DeprecationStatus.ACTIVE;
        }
        if (info.sunsetDate() != null && !now.isBefore(info.sunsetDate())) {
            return DeprecationStatus.SUNSET;
        }
        return DeprecationStatus.DEPRECATED;
    }

    /**
     * Checks {@code spec} against the configured policy.
     *
     * @throws RouteRegistrationException if a deprecated spec lacks a required field
     */
    public void validate(VersionSpec spec) {
        DeprecationInfo info = spec.deprecation();
        if (info == null) {
            return;
        }
        if (policy.requireReplacement() && isBlank(info.replacement())) {
            throw new RouteRegistrationException(
                    "Deprecated route " + describe(spec) + " must declare a replacement");
        }
        if (policy.requireMigrationGuide() && isBlank(info.migrationGuide())) {
            throw new RouteRegistrationException(
                    "Deprecated route " + describe(spec) + " must declare a migration guide");
        }
    }

    /**
     * The human-readable deprecation text: the custom message when set, otherwise a generated
     * sentence naming the time to sunset, the replacement and the reason.
     */
    public static String warningText(DeprecationInfo info, Instant now) {
        if (!isBlank(info.message())) {
            return info.message();
        }
        List<String> parts = new ArrayList<>();
        parts.add("This endpoint is deprecated");
        if (info.sunsetDate() != null) {
            parts.add(sunsetPhrase(info.sunsetDate(), now));
        }
        String text = String.join(" ", parts);
        if (!isBlank(info.replacement())) {
            text += ". Please use " + info.replacement() + " instead";
        }
        if (!isBlank(info.reason())) {
            text += ". Reason: " + info.reason();
        }
        return text + ".";
    }

    public DeprecationHeaderNames headerNames() {
        return headerNames;
    }

    public DeprecationPolicy policy() {
        return policy;
    }

    public Clock clock() {
        return clock;
    }

    // --- Private helpers ---

    private static String sunsetPhrase(Instant sunset, Instant now) {
        if (!now.isBefore(sunset)) {
            return "and has reached its sunset date";
        }
        long days = Duration.between(now, sunset).toDays();
        if (days == 0) {
            return "and will be sunset today";
        }
        if (days == 1) {
            return "and will be sunset tomorrow";
        }
        return "and will be sunset in " + days + " days";
    }

    private static String warningValue(DeprecationInfo info, Instant now) {
        int code = info.warningLevel() == WarningLevel.CRITICAL ? 199 : 299;
        String text = warningText(info, now).replace("\\", "\\\\").replace("\"", "\\\"");
        return code + " - \"" + text + "\"";
    }

    private static String linkValue(DeprecationInfo info) {
        List<String> links = new ArrayList<>();
        if (!isBlank(info.replacement())) {
            links.add("<" + info.replacement() + ">; rel=\"successor-version\"");
        }
        if (!isBlank(info.migrationGuide())) {
            links.add("<" + info.migrationGuide() + ">; rel=\"deprecation\"");
        }
        return links.isEmpty() ? null : String.join(", ", links);
    }

    private static String describe(VersionSpec spec) {
        return spec.method() + " " + spec.pathTemplate() + " @ " + spec.version();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
