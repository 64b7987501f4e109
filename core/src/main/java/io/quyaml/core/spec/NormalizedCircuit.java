package io.quyaml.core.spec;

import io.quyaml.core.expr.ParamValue;
import io.quyaml.core.model.Instruction;
import io.quyaml.core.model.Register;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Circuit part of a document after alias resolution and instruction parsing,
 * ready for lowering.
 *
 * @param shape             whether the document was a plain circuit or a job
 *                          manifest
 * @param name              circuit name
 * @param quantumRegister   declared quantum register
 * @param classicalRegister declared classical register, width zero if absent
 * @param parameters        parameter table, symbolic sweep placeholders
 *                          included
 * @param instructions      parsed instructions in document order
 */
public record NormalizedCircuit(
        Shape shape,
        String name,
        Register quantumRegister,
        Register classicalRegister,
        Map<String, ParamValue> parameters,
        List<Instruction> instructions) {

    /** Document layout. */
    public enum Shape {
        /** The whole document is the circuit body. */
        SIMPLE,
        /** {@code circuit} is a mapping nested in a job manifest. */
        MANIFEST
    }

    public NormalizedCircuit {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(quantumRegister, "quantumRegister must not be null");
        Objects.requireNonNull(classicalRegister, "classicalRegister must not be null");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        instructions = List.copyOf(instructions);
    }
}
