package io.quyaml.core.config;

/**
 * Process-wide parse-leniency configuration. Holds the single piece of shared
 * mutable state in the compiler: whether legacy document versions (and
 * documents without a {@code version} field) are accepted.
 *
 * <p>
 * Meant to be set once at startup via {@link #setAllowLegacyVersions(boolean)}
 * and treated as read-only afterwards. Every compile reads the flag exactly
 * once, at its start, so a compile never observes two different values.
 * Changing the flag while other threads are compiling is a configuration race:
 * in-flight compiles keep the value they started with, later ones see the new
 * value.
 */
public final class CompatibilitySettings {

    private static volatile boolean allowLegacyVersions = true;

    private CompatibilitySettings() {}

    /**
     * Enables or disables acceptance of legacy versions ({@code 0.2}, {@code 0.3})
     * and of documents that omit {@code version}. Default: enabled.
     */
    public static void setAllowLegacyVersions(boolean allow) {
        allowLegacyVersions = allow;
    }

    /** Returns the current legacy-version setting. */
    public static boolean allowLegacyVersions() {
        return allowLegacyVersions;
    }
}
