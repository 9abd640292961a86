package io.apiversioner.core.model;

/**
 * Registration-time rules for deprecation metadata. A deprecated version that violates an enabled
 * rule is rejected when the route table is built.
 *
 * @param requireReplacement    every deprecated version must name a replacement
 * @param requireMigrationGuide every deprecated version must link a migration guide
 */
public record DeprecationPolicy(boolean requireReplacement, boolean requireMigrationGuide) {

    public static final DeprecationPolicy LENIENT = new DeprecationPolicy(false, false);
}
