package io.quyaml.core.config;

import io.quyaml.core.engine.CompilerOptions;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of loading a configuration file: per-compiler options plus the
 * process-wide legacy-version setting, if the file or environment set one.
 *
 * @param options             options for {@link io.quyaml.core.engine.QuyamlCompiler}
 * @param allowLegacyVersions legacy-version setting, {@code null} if not
 *                            configured
 */
public record CompilerConfiguration(CompilerOptions options, Boolean allowLegacyVersions) {

    public CompilerConfiguration {
        Objects.requireNonNull(options, "options must not be null");
    }

    public Optional<Boolean> legacyVersions() {
        return Optional.ofNullable(allowLegacyVersions);
    }

    /**
     * Pushes the legacy-version setting into {@link CompatibilitySettings}.
     * Does nothing when it was not configured. Call once at startup.
     */
    public void applyCompatibilitySettings() {
        if (allowLegacyVersions != null) {
            CompatibilitySettings.setAllowLegacyVersions(allowLegacyVersions);
        }
    }
}
