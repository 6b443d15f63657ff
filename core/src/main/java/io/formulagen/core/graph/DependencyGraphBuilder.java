package io.formulagen.core.graph;

import io.formulagen.core.error.FormulaSyntaxException;
import io.formulagen.core.error.LexException;
import io.formulagen.core.model.Diagnostic;
import io.formulagen.core.model.Diagnostic.Kind;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import io.formulagen.core.parse.FormulaParser;
import io.formulagen.core.schema.ResolvedFormula;
import io.formulagen.core.schema.SchemaResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link DependencyGraph} of a schema.
 *
 * <p>
 * Edges added per field type:
 * <ul>
 * <li>formula: {@code formula-ref} to every field referenced anywhere in its AST</li>
 * <li>lookup / rollup: {@code lookup-via} / {@code rollup-via} to the link field and
 * {@code lookup} / {@code rollup} to the target field in the linked table</li>
 * <li>count: {@code count} to the link field</li>
 * <li>link: {@code record-link} in both directions when an inverse link is declared</li>
 * </ul>
 * A formula that fails to lex or parse falls back to the field's {@code referencedFieldIds}
 * option for its edges, and the syntax error is kept on the graph.
 */
public final class DependencyGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public DependencyGraph build(Schema schema) {
        DependencyGraph.Builder builder = DependencyGraph.builder(schema);
        for (Table table : schema.tables()) {
            builder.node(new GraphNode(table.id(), GraphNode.Kind.TABLE, table.name(), null, null));
            for (Field field : table.fields()) {
                builder.node(new GraphNode(field.id(), GraphNode.Kind.FIELD, field.name(), table.id(), field.type()));
            }
        }

        SchemaResolver resolver = new SchemaResolver(schema);
        for (Field field : schema.fields()) {
            switch (field.type()) {
                case FORMULA -> addFormulaEdges(builder, resolver, field);
                case LOOKUP -> addLinkedEdges(builder, schema, field, EdgeKind.LOOKUP_VIA, EdgeKind.LOOKUP);
                case ROLLUP -> addLinkedEdges(builder, schema, field, EdgeKind.ROLLUP_VIA, EdgeKind.ROLLUP);
                case COUNT -> addCountEdge(builder, schema, field);
                case LINK -> addRecordLinkEdges(builder, field);
                default -> {
                    // stored data: no outgoing edges
                }
            }
        }

        DependencyGraph graph = builder.build();
        LOG.info(
                "Dependency graph built: tables={}, fields={}, edges={}, diagnostics={}",
                schema.tables().size(),
                schema.fieldCount(),
                graph.edgeCount(),
                graph.diagnostics().size());
        return graph;
    }

    private void addFormulaEdges(DependencyGraph.Builder builder, SchemaResolver resolver, Field field) {
        if (field.formula() == null || field.formula().isBlank()) {
            builder.diagnostic(Diagnostic.error(
                    Kind.INVALID_FIELD_CONFIGURATION, field.id(), "Formula field '" + field.name() + "' has no formula"));
            addFallbackEdges(builder, field);
            return;
        }
        ResolvedFormula resolved;
        try {
            FormulaNode parsed = FormulaParser.parse(field.formula());
            resolved = resolver.resolve(parsed, field.tableId());
        } catch (FormulaSyntaxException e) {
            FormulaSyntaxException error = e.inField(field.id(), field.formula());
            LOG.warn("Formula did not parse: location={}, error={}", error.location(), error.getMessage());
            builder.syntaxError(field.id(), error);
            builder.diagnostic(Diagnostic.error(
                    error instanceof LexException ? Kind.LEX_ERROR : Kind.PARSE_ERROR,
                    field.id(),
                    "Formula of '" + field.name() + "' did not parse: " + e.getMessage()));
            addFallbackEdges(builder, field);
            return;
        }

        builder.formula(field.id(), resolved.root());
        for (FieldRef ref : FormulaNode.fieldRefs(resolved.root())) {
            if (ref.isResolved()) {
                builder.edge(field.id(), ref.fieldId(), EdgeKind.FORMULA_REF);
            }
        }
        for (String unresolved : resolved.unresolvedReferences()) {
            LOG.warn("Unresolved field reference: field_id={}, reference={}", field.id(), unresolved);
            builder.diagnostic(Diagnostic.warning(
                    Kind.UNRESOLVED_FIELD_REFERENCE,
                    field.id(),
                    "Formula of '" + field.name() + "' references unknown field {" + unresolved + "}"));
        }
    }

    private void addFallbackEdges(DependencyGraph.Builder builder, Field field) {
        for (String referenced : field.referencedFieldIds()) {
            if (builder.hasNode(referenced)) {
                builder.edge(field.id(), referenced, EdgeKind.FORMULA_REF);
            }
        }
    }

    private void addLinkedEdges(
            DependencyGraph.Builder builder, Schema schema, Field field, EdgeKind viaKind, EdgeKind targetKind) {
        boolean linkKnown = requireLinkField(builder, schema, field);
        if (linkKnown) {
            builder.edge(field.id(), field.linkFieldId(), viaKind);
        }
        if (field.targetFieldId() != null && builder.hasNode(field.targetFieldId())) {
            builder.edge(field.id(), field.targetFieldId(), targetKind);
        } else {
            builder.diagnostic(Diagnostic.error(
                    Kind.INVALID_FIELD_CONFIGURATION,
                    field.id(),
                    "Field '" + field.name() + "' has no valid target field in the linked table"));
        }
    }

    private void addCountEdge(DependencyGraph.Builder builder, Schema schema, Field field) {
        if (requireLinkField(builder, schema, field)) {
            builder.edge(field.id(), field.linkFieldId(), EdgeKind.COUNT);
        }
    }

    private boolean requireLinkField(DependencyGraph.Builder builder, Schema schema, Field field) {
        boolean valid = field.linkFieldId() != null
                && schema.field(field.linkFieldId())
                        .map(link -> link.type() == FieldType.LINK)
                        .orElse(false);
        if (!valid) {
            builder.diagnostic(Diagnostic.error(
                    Kind.INVALID_FIELD_CONFIGURATION,
                    field.id(),
                    "Field '" + field.name() + "' does not name a valid link field"));
        }
        return valid;
    }

    private void addRecordLinkEdges(DependencyGraph.Builder builder, Field field) {
        String inverse = field.inverseLinkFieldId();
        if (inverse != null && builder.hasNode(inverse)) {
            builder.edge(field.id(), inverse, EdgeKind.RECORD_LINK);
            builder.edge(inverse, field.id(), EdgeKind.RECORD_LINK);
        }
    }
}
