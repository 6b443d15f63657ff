package io.formulagen.core.engine;

import io.formulagen.core.compress.CompressionResult;
import io.formulagen.core.compress.FormulaCompressor;
import io.formulagen.core.compress.ReferenceFormat;
import io.formulagen.core.graph.ComputationGraph;
import io.formulagen.core.graph.DependencyGraph;
import io.formulagen.core.graph.DependencyGraphBuilder;
import io.formulagen.core.graph.DepthCalculator;
import io.formulagen.core.model.Diagnostic;
import io.formulagen.core.model.Diagnostic.Kind;
import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.GeneratorOptions;
import io.formulagen.core.model.Schema;
import io.formulagen.core.parse.FormulaParser;
import io.formulagen.core.schema.ResolvedFormula;
import io.formulagen.core.schema.SchemaResolver;
import io.formulagen.core.spi.CodeGenBackend;
import io.formulagen.core.spi.CompilationListener;
import io.formulagen.core.spi.GenerationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the formula compiler. Each call is an independent run; instances hold only the
 * backend registry and listeners and are safe to share between threads.
 *
 * <pre>
 * FormulaCompiler compiler = new FormulaCompiler();
 * Schema schema = new SchemaParser().parse(Path.of("schema.json"));
 * GenerationResult result = compiler.generate(schema, GeneratorOptions.builder().target("javascript").build());
 * </pre>
 */
public final class FormulaCompiler {

    private final BackendRegistry registry;
    private final List<CompilationListener> listeners;
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();
    private final DepthCalculator depthCalculator = new DepthCalculator();
    private final Transpiler transpiler = new Transpiler();

    /** Compiler with the bundled backends and no listeners. */
    public FormulaCompiler() {
        this(BackendRegistry.withDefaults(), List.of());
    }

    public FormulaCompiler(BackendRegistry registry) {
        this(registry, List.of());
    }

    public FormulaCompiler(BackendRegistry registry, List<CompilationListener> listeners) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.listeners = List.copyOf(listeners);
    }

    public BackendRegistry registry() {
        return registry;
    }

    /**
     * Parses formula text.
     *
     * @throws io.formulagen.core.error.FormulaSyntaxException if the text does not lex or parse
     */
    public FormulaNode parse(String formulaText) {
        return FormulaParser.parse(formulaText);
    }

    public DependencyGraph buildGraph(Schema schema) {
        return graphBuilder.build(schema);
    }

    /** Depth order of a graph; cycles are reported on the result, not thrown. */
    public ComputationGraph computeOrder(DependencyGraph graph) {
        return depthCalculator.compute(graph);
    }

    /**
     * Transpiles a single formula without a schema. References keep their text as the field
     * name.
     *
     * @throws IllegalArgumentException if {@code target} is not a registered backend
     */
    public TranspileResult transpile(String formulaText, String target) {
        CodeGenBackend backend = registry.require(target).configure(GenerationContext.standalone());
        return transpiler.transpile(parse(formulaText), backend);
    }

    /**
     * Transpiles a formula of {@code tableId} against a schema. Unresolved references are added
     * to the result as warnings.
     */
    public TranspileResult transpile(String formulaText, Schema schema, String tableId, GeneratorOptions options) {
        ResolvedFormula resolved = new SchemaResolver(schema).resolve(parse(formulaText), tableId);
        CodeGenBackend backend = registry.bind(new GenerationContext(schema, options));
        TranspileResult result = transpiler.transpile(resolved.root(), backend);
        if (resolved.isFullyResolved()) {
            return result;
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String reference : resolved.unresolvedReferences()) {
            diagnostics.add(Diagnostic.warning(
                    Kind.UNRESOLVED_FIELD_REFERENCE, null, "Reference to unknown field {" + reference + "}"));
        }
        diagnostics.addAll(result.diagnostics());
        return new TranspileResult(result.code(), result.unsupportedFunctions(), diagnostics);
    }

    /**
     * Runs the whole pipeline: dependency graph, depth order and module assembly with the backend
     * named by {@link GeneratorOptions#target()}.
     *
     * @throws IllegalArgumentException if the target is not a registered backend
     */
    public GenerationResult generate(Schema schema, GeneratorOptions options) {
        CodeGenBackend backend = registry.require(options.target());
        ComputationGraph order = computeOrder(buildGraph(schema));
        return new ModuleAssembler(listeners).assemble(order, backend, options);
    }

    /** File name to source text of the generated module. */
    public Map<String, String> generateModule(Schema schema, GeneratorOptions options) {
        return generate(schema, options).files();
    }

    /**
     * Inlines referenced formula fields into {@code formulaText}.
     *
     * @param maxDepth levels of inlining; 0 returns the text unchanged
     * @param visited  ids of fields that must not be inlined
     */
    public CompressionResult compress(String formulaText, Schema schema, int maxDepth, Set<String> visited) {
        return new FormulaCompressor(schema).compress(formulaText, maxDepth, visited, ReferenceFormat.FIELD_IDS);
    }
}
