package io.quyaml.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import io.quyaml.core.error.SchemaViolationException;
import java.util.List;

/**
 * Resolves the document {@code version} against the supported set.
 *
 * <p>
 * {@code version} may be written as a string ({@code "0.4"}) or as a YAML
 * number ({@code 0.4}); both are compared by their text form.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class VersionNegotiator {

    /** The version this compiler emits and prefers. */
    public static final String CURRENT_VERSION = "0.4";

    /** Versions accepted only while legacy support is enabled. */
    public static final List<String> LEGACY_VERSIONS = List.of("0.2", "0.3");

    /** Version assumed for documents without a {@code version} field. */
    static final String IMPLICIT_LEGACY_VERSION = "0.3";

    /**
     * Returns the effective version of the document.
     *
     * @param root                the document root
     * @param allowLegacyVersions the legacy setting captured at the start of the
     *                            compile
     * @return the resolved version string
     * @throws SchemaViolationException if the version is missing (legacy
     *                                  disabled) or not supported
     */
    public String negotiate(JsonNode root, boolean allowLegacyVersions) {
        JsonNode versionNode = root.get("version");
        if (versionNode == null || versionNode.isNull()) {
            if (!allowLegacyVersions) {
                throw new SchemaViolationException(
                        "Missing required 'version' field (expected '" + CURRENT_VERSION + "')", "version");
            }
            return IMPLICIT_LEGACY_VERSION;
        }
        if (!versionNode.isValueNode()) {
            throw new SchemaViolationException(
                    "'version' must be a string or number, got: " + versionNode.getNodeType(), "version");
        }

        String version = versionNode.asText().trim();
        if (CURRENT_VERSION.equals(version)) {
            return version;
        }
        if (allowLegacyVersions && LEGACY_VERSIONS.contains(version)) {
            return version;
        }
        String supported = allowLegacyVersions
                ? CURRENT_VERSION + ", " + String.join(", ", LEGACY_VERSIONS) + " (legacy)"
                : CURRENT_VERSION;
        throw new SchemaViolationException(
                "Unsupported QuYAML version '" + version + "'. Supported: " + supported, "version");
    }
}
