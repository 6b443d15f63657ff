package io.formulagen.core.engine;

import io.formulagen.core.error.CyclicDependencyException;
import io.formulagen.core.error.FieldConfigurationException;
import io.formulagen.core.error.FormulaSyntaxException;
import io.formulagen.core.error.FunctionArityException;
import io.formulagen.core.graph.ComputationGraph;
import io.formulagen.core.graph.DependencyGraph;
import io.formulagen.core.model.Diagnostic;
import io.formulagen.core.model.Diagnostic.Kind;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.GeneratorOptions;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import io.formulagen.core.spi.CodeGenBackend;
import io.formulagen.core.spi.CompilationListener;
import io.formulagen.core.spi.GenerationContext;
import io.formulagen.core.spi.LinkedFieldSpec;
import io.formulagen.core.spi.ModuleTemplate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles one source module from a {@link ComputationGraph} and a configured backend.
 *
 * <p>
 * Getters are emitted per table in depth order, optionally grouped under depth comments. Fields
 * that cannot be ordered because of a cycle follow as stubs. Every field is generated in
 * isolation: whatever goes wrong for one field turns into a stub getter plus a diagnostic and the
 * rest of the module is still produced.
 */
public final class ModuleAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleAssembler.class);

    private final Transpiler transpiler = new Transpiler();
    private final List<CompilationListener> listeners;

    public ModuleAssembler() {
        this(List.of());
    }

    public ModuleAssembler(List<CompilationListener> listeners) {
        this.listeners = List.copyOf(Objects.requireNonNull(listeners, "listeners must not be null"));
    }

    /**
     * Generates the module.
     *
     * @param order   depth order of the schema's fields
     * @param backend backend to generate with; configured here with the schema and options
     * @param options generation options
     */
    public GenerationResult assemble(ComputationGraph order, CodeGenBackend backend, GeneratorOptions options) {
        DependencyGraph graph = order.graph();
        Schema schema = graph.schema();
        CodeGenBackend configured = backend.configure(new GenerationContext(schema, options));
        ModuleTemplate template = configured.moduleTemplate();
        LookupRollupGenerator linked = new LookupRollupGenerator(schema);
        boolean depthComments = options.depthComments();

        Run run = new Run(graph, order, configured, template, linked);
        run.diagnostics.addAll(graph.diagnostics());
        for (Map.Entry<String, CyclicDependencyException> failure : order.failures().entrySet()) {
            run.diagnostics.add(Diagnostic.error(Kind.CYCLIC_DEPENDENCY, failure.getKey(), failure.getValue().getMessage()));
        }
        for (Field field : schema.fields()) {
            if (field.type() == FieldType.LOOKUP || field.type() == FieldType.ROLLUP || field.type() == FieldType.COUNT) {
                try {
                    run.specs.put(field.id(), linked.describe(field));
                } catch (FieldConfigurationException e) {
                    run.invalid.put(field.id(), e);
                }
            }
        }

        StringBuilder out = new StringBuilder();
        out.append(template.header(schema))
                .append(template.helpers())
                .append(template.dataAccessDeclaration(linked.accessors(run.specs.values())));

        List<Field> computationOrder = new ArrayList<>();
        for (Table table : schema.tables()) {
            List<Field> fields = tableOrder(table, order);
            if (fields.isEmpty()) {
                continue;
            }
            out.append(template.beginTable(table));
            int currentDepth = -1;
            for (Field field : fields) {
                OptionalInt depth = order.depthOf(field.id());
                if (depthComments && depth.isPresent() && depth.getAsInt() != currentDepth) {
                    currentDepth = depth.getAsInt();
                    out.append(template.depthComment(currentDepth));
                }
                out.append(run.emit(field, depth));
            }
            out.append(template.computeAll(table, fields)).append(template.endTable(table));
            computationOrder.addAll(fields);
        }
        computationOrder.sort((a, b) -> Integer.compare(rank(order, a), rank(order, b)));
        out.append(template.footer(computationOrder));

        String fileName = template.fileName();
        GenerationResult result = new GenerationResult(Map.of(fileName, out.toString()), run.diagnostics);
        LOG.info(
                "Module generated: target={}, file={}, fields={}, stubs={}, diagnostics={}",
                configured.id(),
                fileName,
                computationOrder.size(),
                run.stubs,
                result.diagnostics().size());
        notifyModuleGenerated(configured.id(), fileName, computationOrder.size(), result.diagnostics());
        return result;
    }

    /** Computed fields of a table: ordered ones by depth, then the ones blocked by a cycle. */
    private static List<Field> tableOrder(Table table, ComputationGraph order) {
        List<Field> ordered = new ArrayList<>();
        for (String fieldId : order.orderedFieldIds()) {
            table.field(fieldId).filter(Field::isComputed).ifPresent(ordered::add);
        }
        for (String fieldId : order.failures().keySet()) {
            table.field(fieldId).filter(Field::isComputed).ifPresent(ordered::add);
        }
        return ordered;
    }

    private static int rank(ComputationGraph order, Field field) {
        return order.depthOf(field.id()).orElse(Integer.MAX_VALUE);
    }

    /** Generated getter source, or the reason a stub has to be emitted instead. */
    private record Getter(String code, String stubReason) {

        static Getter of(String code) {
            return new Getter(code, null);
        }

        static Getter stub(String reason) {
            return new Getter(null, reason);
        }
    }

    /** State of one assembly. */
    private final class Run {

        private final DependencyGraph graph;
        private final ComputationGraph order;
        private final CodeGenBackend backend;
        private final ModuleTemplate template;
        private final LookupRollupGenerator linked;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Map<String, LinkedFieldSpec> specs = new LinkedHashMap<>();
        private final Map<String, FieldConfigurationException> invalid = new LinkedHashMap<>();
        private int stubs;

        Run(
                DependencyGraph graph,
                ComputationGraph order,
                CodeGenBackend backend,
                ModuleTemplate template,
                LookupRollupGenerator linked) {
            this.graph = graph;
            this.order = order;
            this.backend = backend;
            this.template = template;
            this.linked = linked;
        }

        String emit(Field field, OptionalInt depth) {
            CyclicDependencyException cycle = order.failures().get(field.id());
            if (cycle != null) {
                return stub(field, cycle.getMessage());
            }
            Getter getter;
            try {
                getter = field.type() == FieldType.FORMULA ? formula(field) : linkedField(field);
            } catch (FunctionArityException e) {
                diagnostics.add(Diagnostic.error(Kind.INVALID_FUNCTION_CALL, field.id(), e.getMessage()));
                return stub(field, e.getMessage());
            } catch (RuntimeException e) {
                LOG.warn("Getter generation failed: field_id={}", field.id(), e);
                String reason = "Generation failed: " + e.getMessage();
                diagnostics.add(Diagnostic.error(Kind.GENERATION_FAILURE, field.id(), reason));
                return stub(field, reason);
            }
            if (getter.stubReason() != null) {
                return stub(field, getter.stubReason());
            }
            LOG.debug("Getter generated: field_id={}, depth={}", field.id(), depth.orElse(-1));
            notifyFieldGenerated(field, depth.orElse(-1));
            return getter.code();
        }

        private Getter formula(Field field) {
            Optional<FormulaSyntaxException> syntaxError = graph.syntaxError(field.id());
            if (syntaxError.isPresent()) {
                return Getter.stub("Formula did not parse: " + syntaxError.get().getMessage());
            }
            Optional<FormulaNode> root = graph.formula(field.id());
            if (root.isEmpty()) {
                return Getter.stub("Formula field has no formula");
            }
            TranspileResult result = transpiler.transpile(field.id(), root.get(), backend);
            diagnostics.addAll(result.diagnostics());
            if (result.hasUnsupportedFunctions()) {
                return Getter.stub("Unsupported function(s): " + String.join(", ", result.unsupportedFunctions()));
            }
            return Getter.of(template.formulaGetter(field, result.code()));
        }

        private Getter linkedField(Field field) {
            FieldConfigurationException problem = invalid.get(field.id());
            if (problem != null) {
                if (!alreadyReported(field.id())) {
                    diagnostics.add(Diagnostic.error(Kind.INVALID_FIELD_CONFIGURATION, field.id(), problem.getMessage()));
                }
                return Getter.stub(problem.getMessage());
            }
            return Getter.of(linked.generate(specs.get(field.id()), template));
        }

        private boolean alreadyReported(String fieldId) {
            return diagnostics.stream()
                    .anyMatch(d -> d.kind() == Kind.INVALID_FIELD_CONFIGURATION && fieldId.equals(d.fieldId()));
        }

        private String stub(Field field, String reason) {
            stubs++;
            LOG.debug("Stub getter emitted: field_id={}, reason={}", field.id(), reason);
            notifyFieldFailed(field, reason);
            return template.stubGetter(field, reason);
        }
    }

    // --- Listener notifications ---
    // Listener exceptions are caught and logged; they never affect the generated module.

    private void notifyFieldGenerated(Field field, int depth) {
        for (CompilationListener listener : listeners) {
            try {
                listener.onFieldGenerated(new CompilationListener.FieldGeneratedEvent(field.id(), field.name(), depth));
            } catch (Exception e) {
                LOG.warn("CompilationListener.onFieldGenerated failed", e);
            }
        }
    }

    private void notifyFieldFailed(Field field, String reason) {
        for (CompilationListener listener : listeners) {
            try {
                listener.onFieldFailed(new CompilationListener.FieldFailedEvent(field.id(), field.name(), reason));
            } catch (Exception e) {
                LOG.warn("CompilationListener.onFieldFailed failed", e);
            }
        }
    }

    private void notifyModuleGenerated(String target, String fileName, int fieldCount, List<Diagnostic> diagnostics) {
        for (CompilationListener listener : listeners) {
            try {
                listener.onModuleGenerated(
                        new CompilationListener.ModuleGeneratedEvent(target, fileName, fieldCount, diagnostics));
            } catch (Exception e) {
                LOG.warn("CompilationListener.onModuleGenerated failed", e);
            }
        }
    }
}
