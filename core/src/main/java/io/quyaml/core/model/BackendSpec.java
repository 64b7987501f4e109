package io.quyaml.core.model;

import java.util.Objects;

/**
 * Backend request carried to the execution collaborator. Either a backend
 * name, or a filter the collaborator uses to choose one.
 */
public sealed interface BackendSpec {

    record Named(String name) implements BackendSpec {
        public Named {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("backend name must not be blank");
            }
        }
    }

    /**
     * @param minQubits smallest acceptable device size (default: 1)
     * @param simulator whether simulators are acceptable (default: false)
     * @param strategy  selection strategy name (default: {@code least_busy})
     */
    record Filter(int minQubits, boolean simulator, String strategy) implements BackendSpec {

        public static final int DEFAULT_MIN_QUBITS = 1;
        public static final String DEFAULT_STRATEGY = "least_busy";

        public Filter {
            Objects.requireNonNull(strategy, "strategy must not be null");
            if (minQubits < 1) {
                throw new IllegalArgumentException("minQubits must be at least 1, got: " + minQubits);
            }
        }
    }
}
