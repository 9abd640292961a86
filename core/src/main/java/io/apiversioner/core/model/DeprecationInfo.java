package io.apiversioner.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Lifecycle metadata attached to a deprecated endpoint version. Evaluated fresh per request by
 * {@code DeprecationRegistry}; nothing here is time-dependent.
 *
 * @param sunsetDate     instant from which the version counts as sunset, nullable
 * @param warningLevel   severity of the generated warning
 * @param replacement    URI of the successor endpoint, nullable
 * @param reason         free-text deprecation reason, nullable
 * @param migrationGuide URI of a migration guide, nullable
 * @param message        custom warning text replacing the generated one, nullable
 */
public record DeprecationInfo(
        Instant sunsetDate,
        WarningLevel warningLevel,
        String replacement,
        String reason,
        String migrationGuide,
        String message) {

    public DeprecationInfo {
        Objects.requireNonNull(warningLevel, "warningLevel must not be null");
    }

    /** Creates a builder with {@link WarningLevel#WARNING} as the default level. */
    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder for {@link DeprecationInfo}. */
    public static final class Builder {
        private Instant sunsetDate;
        private WarningLevel warningLevel = WarningLevel.WARNING;
        private String replacement;
        private String reason;
        private String migrationGuide;
        private String message;

        private Builder() {}

        public Builder sunsetDate(Instant sunsetDate) {
            this.sunsetDate = sunsetDate;
            return this;
        }

        public Builder warningLevel(WarningLevel warningLevel) {
            this.warningLevel = warningLevel;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder migrationGuide(String migrationGuide) {
            this.migrationGuide = migrationGuide;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public DeprecationInfo build() {
            return new DeprecationInfo(sunsetDate, warningLevel, replacement, reason, migrationGuide, message);
        }
    }
}
