package io.quyaml.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.quyaml.core.config.CompatibilitySettings;
import io.quyaml.core.error.QuyamlException;
import io.quyaml.core.guard.GuardrailScanner;
import io.quyaml.core.model.CircuitSpec;
import io.quyaml.core.model.ExecutionOptions;
import io.quyaml.core.model.Job;
import io.quyaml.core.spec.DocumentLoader;
import io.quyaml.core.spec.ExecutionParser;
import io.quyaml.core.spec.NormalizedCircuit;
import io.quyaml.core.spec.SpecNormalizer;
import io.quyaml.core.spec.VersionNegotiator;
import io.quyaml.core.spi.CompileListener;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: compiles QuYAML document text into a {@link CircuitSpec} or a
 * {@link Job}.
 *
 * <p>
 * Pipeline: guardrail scan, YAML load, version negotiation, normalization
 * (aliases, registers, parameters, instructions), control-flow lowering and,
 * for jobs, assembly with sweep expansion. Each compile is a pure function of
 * the text, the options fixed at construction, and the legacy-version flag
 * from {@link CompatibilitySettings}, which is read exactly once per compile.
 *
 * <p>
 * Errors are never recovered here: the first {@link QuyamlException} raised by
 * any stage propagates unchanged, after the listener has been told.
 *
 * <p>
 * Thread-safe: all collaborators are stateless or immutable.
 */
public final class QuyamlCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(QuyamlCompiler.class);

    private final CompilerOptions options;
    private final GuardrailScanner scanner;
    private final DocumentLoader loader = new DocumentLoader();
    private final VersionNegotiator versionNegotiator = new VersionNegotiator();
    private final SpecNormalizer normalizer;
    private final ExecutionParser executionParser = new ExecutionParser();
    private final ControlFlowLowering lowering;
    private final JobAssembler assembler = new JobAssembler();
    private final CompileListener listener;

    /** Creates a compiler with {@link CompilerOptions#DEFAULT} and no listener. */
    public QuyamlCompiler() {
        this(CompilerOptions.DEFAULT, null);
    }

    public QuyamlCompiler(CompilerOptions options) {
        this(options, null);
    }

    /**
     * @param options  guardrail limits (text, register width, unrolling) and
     *                 control-flow mode
     * @param listener optional compile listener, may be {@code null}
     */
    public QuyamlCompiler(CompilerOptions options, CompileListener listener) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.scanner = new GuardrailScanner(options.limits());
        this.normalizer = new SpecNormalizer(options.limits());
        this.lowering = new ControlFlowLowering(options.controlFlowMode(), options.limits().maxUnrolledCopies());
        this.listener = listener;
    }

    public CompilerOptions options() {
        return options;
    }

    /**
     * Compiles the circuit part of a document. {@code metadata},
     * {@code execution} and {@code post_processing} are accepted but not
     * interpreted.
     *
     * @param text document text
     * @return the compiled circuit
     * @throws QuyamlException on the first error found
     */
    public CircuitSpec compileCircuit(String text) {
        Objects.requireNonNull(text, "text must not be null");
        long start = System.nanoTime();
        try {
            JsonNode root = prepare(text);
            String version = versionNegotiator.negotiate(root, CompatibilitySettings.allowLegacyVersions());
            CircuitSpec circuit = lowering.lower(normalizer.normalize(root, List.of()));
            notifyCompiled(circuit, version, 1, start);
            return circuit;
        } catch (QuyamlException e) {
            notifyRejected(e);
            throw e;
        }
    }

    /**
     * Compiles a whole document into a job. Sweep parameters named in
     * {@code execution.parameter_sweep} become symbolic in the circuit and are
     * bound per variant.
     *
     * @param text document text, plain circuit or job manifest
     * @return the compiled job
     * @throws QuyamlException on the first error found
     */
    public Job compileJob(String text) {
        Objects.requireNonNull(text, "text must not be null");
        long start = System.nanoTime();
        try {
            JsonNode root = prepare(text);
            String version = versionNegotiator.negotiate(root, CompatibilitySettings.allowLegacyVersions());
            ExecutionOptions execution = executionParser.parse(root.get("execution"));
            List<String> symbolic =
                    execution.sweepConfig().map(sweep -> List.of(sweep.parameter())).orElse(List.of());
            NormalizedCircuit normalized = normalizer.normalize(root, symbolic);
            CircuitSpec circuit = lowering.lower(normalized);
            Job job = assembler.assemble(circuit, root.get("metadata"), execution, root.get("post_processing"));
            notifyCompiled(circuit, version, job.circuitVariants().size(), start);
            return job;
        } catch (QuyamlException e) {
            notifyRejected(e);
            throw e;
        }
    }

    private JsonNode prepare(String text) {
        scanner.scan(text);
        return loader.load(text);
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never affect the compile.

    private void notifyCompiled(CircuitSpec circuit, String version, int variants, long startNanos) {
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info(
                "circuit.compiled name={} version={} qubits={} clbits={} ops={} variants={} mode={} duration_ms={}",
                circuit.name(),
                version,
                circuit.numQubits(),
                circuit.numClbits(),
                circuit.operations().size(),
                variants,
                options.controlFlowMode(),
                durationMs);
        if (listener == null) return;
        try {
            listener.onCircuitCompiled(new CompileListener.CircuitCompiledEvent(
                    circuit.name(),
                    version,
                    circuit.numQubits(),
                    circuit.numClbits(),
                    circuit.operations().size(),
                    variants,
                    durationMs));
        } catch (Exception e) {
            LOG.warn("CompileListener.onCircuitCompiled failed", e);
        }
    }

    private void notifyRejected(QuyamlException cause) {
        LOG.debug(
                "document.rejected category={} location={} detail={}",
                cause.category(),
                cause.location(),
                cause.getMessage());
        if (listener == null) return;
        try {
            listener.onDocumentRejected(new CompileListener.DocumentRejectedEvent(
                    cause.category(), cause.location(), cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("CompileListener.onDocumentRejected failed", e);
        }
    }
}
