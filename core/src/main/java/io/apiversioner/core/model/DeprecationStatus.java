package io.apiversioner.core.model;

/** Lifecycle state of a (route, version) pair at evaluation time. */
public enum DeprecationStatus {
    /** No deprecation metadata. */
    ACTIVE,
    /** Deprecated, sunset not yet reached (or undated). */
    DEPRECATED,
    /** The sunset instant has passed. */
    SUNSET
}
