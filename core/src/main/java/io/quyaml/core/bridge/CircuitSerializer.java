package io.quyaml.core.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.quyaml.core.expr.ParamValue;
import io.quyaml.core.model.CircuitSpec;
import io.quyaml.core.model.ConditionExpr;
import io.quyaml.core.model.Operation;
import io.quyaml.core.spec.VersionNegotiator;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes a compiled circuit back out as a v0.4 QuYAML document.
 *
 * <p>
 * Gates become gate-call strings ({@code cx 0 1}, {@code ry(1.0) 0}),
 * measurements and resets become structured {@code measure}/{@code reset}
 * blocks, and control-flow blocks map to {@code if}, {@code while} and
 * {@code for}. Angles are written with {@link Double#toString(double)}, which
 * reads back to the same {@code double}, so recompiling the output yields a
 * structurally identical circuit.
 *
 * <p>
 * Only bound circuits can be written. Nested control flow inside a body (as
 * produced for composite conditions) has no surface form and is rejected.
 */
public final class CircuitSerializer {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Serializes to a document tree.
     *
     * @throws IllegalArgumentException if the circuit has free parameters or
     *                                  nested control flow
     */
    public ObjectNode toTree(CircuitSpec circuit) {
        Objects.requireNonNull(circuit, "circuit must not be null");
        if (!circuit.isBound()) {
            throw new IllegalArgumentException(
                    "Cannot serialize circuit '" + circuit.name() + "' with free parameters "
                            + circuit.freeParameters() + "; bind them first");
        }
        ObjectNode root = NODES.objectNode();
        root.put("version", VersionNegotiator.CURRENT_VERSION);
        root.put("circuit", circuit.name());
        root.put("qubits", circuit.quantumRegister().declaration());
        if (circuit.numClbits() > 0) {
            root.put("bits", circuit.classicalRegister().declaration());
        }
        ObjectNode params = NODES.objectNode();
        circuit.parameters().forEach((name, value) -> {
            // Unused sweep placeholders have no value to write
            if (value instanceof ParamValue.Numeric numeric) {
                params.put(name, numeric.value());
            }
        });
        if (!params.isEmpty()) {
            root.set("params", params);
        }
        ArrayNode ops = root.putArray("ops");
        for (Operation op : circuit.operations()) {
            ops.add(topLevel(op));
        }
        return root;
    }

    /** Serializes to YAML text. */
    public String toYaml(CircuitSpec circuit) {
        try {
            return YAML_MAPPER.writeValueAsString(toTree(circuit));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write circuit '" + circuit.name() + "' as YAML", e);
        }
    }

    private ObjectNode block(String kind, ObjectNode body) {
        ObjectNode node = NODES.objectNode();
        node.set(kind, body);
        return node;
    }

    private JsonNode topLevel(Operation op) {
        if (op instanceof Operation.IfElse ifElse) {
            ObjectNode body = NODES.objectNode();
            body.put("cond", condition(ifElse.test()));
            body.set("then", bodyList(ifElse.trueBody()));
            if (!ifElse.falseBody().isEmpty()) {
                body.set("else", bodyList(ifElse.falseBody()));
            }
            return block("if", body);
        }
        if (op instanceof Operation.WhileLoop loop) {
            ObjectNode body = NODES.objectNode();
            body.put("cond", condition(loop.test()));
            body.set("body", bodyList(loop.body()));
            body.put("max_iter", loop.maxIter());
            return block("while", body);
        }
        if (op instanceof Operation.ForLoop loop) {
            ObjectNode body = NODES.objectNode();
            body.putArray("range").add(loop.start()).add(loop.end());
            body.set("body", bodyList(loop.body()));
            return block("for", body);
        }
        return primitive(op);
    }

    private ArrayNode bodyList(List<Operation> ops) {
        ArrayNode list = NODES.arrayNode();
        for (Operation op : ops) {
            list.add(primitive(op));
        }
        return list;
    }

    private JsonNode primitive(Operation op) {
        if (op instanceof Operation.Gate gate) {
            StringBuilder text = new StringBuilder(gate.kind().mnemonic());
            if (gate.angle() != null) {
                text.append('(').append(((ParamValue.Numeric) gate.angle()).value()).append(')');
            }
            text.append(' ')
                    .append(gate.qubits().stream().map(String::valueOf).collect(Collectors.joining(" ")));
            return NODES.textNode(text.toString());
        }
        if (op instanceof Operation.Barrier) {
            return NODES.textNode("barrier");
        }
        if (op instanceof Operation.MeasureAll) {
            return NODES.textNode("measure");
        }
        if (op instanceof Operation.Measure measure) {
            ObjectNode spec = NODES.objectNode();
            spec.put("q", measure.qubit());
            spec.put("c", measure.clbit());
            return block("measure", spec);
        }
        if (op instanceof Operation.Reset reset) {
            ObjectNode spec = NODES.objectNode();
            spec.put("q", reset.qubit());
            return block("reset", spec);
        }
        throw new IllegalArgumentException(
                "Nested control flow has no QuYAML surface form and cannot be serialized: " + op);
    }

    private static String condition(ConditionExpr.Atom atom) {
        return atom.register() + " == " + atom.value();
    }
}
