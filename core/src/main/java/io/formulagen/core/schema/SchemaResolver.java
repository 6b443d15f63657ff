package io.formulagen.core.schema;

import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.FormulaNode.BinaryOp;
import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.model.FormulaNode.FunctionCall;
import io.formulagen.core.model.FormulaNode.Literal;
import io.formulagen.core.model.FormulaNode.UnaryOp;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches schema identities to the {@link FieldRef} nodes of a parsed formula.
 *
 * <p>
 * A reference is matched by field id first, then by field name within the owning table, then by
 * field name anywhere in the schema. A matched reference is rewritten to carry the field's real
 * id, name and type. An unmatched reference keeps its raw text as id and gets
 * {@link FieldType#UNKNOWN}; that is reported, not thrown.
 */
public final class SchemaResolver {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaResolver.class);

    private final Schema schema;

    public SchemaResolver(Schema schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /** Resolves references without an owning table; name matches search the whole schema. */
    public ResolvedFormula resolve(FormulaNode root) {
        return resolve(root, null);
    }

    /**
     * Resolves every reference in the tree.
     *
     * @param root         parsed formula
     * @param ownerTableId table whose fields take precedence for name matches, or {@code null}
     */
    public ResolvedFormula resolve(FormulaNode root, String ownerTableId) {
        List<String> unresolved = new ArrayList<>();
        FormulaNode resolved = root.accept(new ResolvingVisitor(ownerTableId, unresolved));
        if (!unresolved.isEmpty()) {
            LOG.debug("Unresolved field references: owner_table={}, refs={}", ownerTableId, unresolved);
        }
        return new ResolvedFormula(resolved, unresolved);
    }

    /** Looks up a reference as written between braces. */
    public Optional<Field> lookup(String reference, String ownerTableId) {
        Optional<Field> byId = schema.field(reference);
        if (byId.isPresent()) {
            return byId;
        }
        if (ownerTableId != null) {
            Optional<Field> local = schema.table(ownerTableId).flatMap(t -> t.fieldByName(reference));
            if (local.isPresent()) {
                return local;
            }
        }
        for (Table table : schema.tables()) {
            Optional<Field> match = table.fieldByName(reference);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private final class ResolvingVisitor implements FormulaNode.Visitor<FormulaNode> {

        private final String ownerTableId;
        private final List<String> unresolved;

        ResolvingVisitor(String ownerTableId, List<String> unresolved) {
            this.ownerTableId = ownerTableId;
            this.unresolved = unresolved;
        }

        @Override
        public FormulaNode visitLiteral(Literal literal) {
            return literal;
        }

        @Override
        public FormulaNode visitFieldRef(FieldRef fieldRef) {
            Optional<Field> field = lookup(fieldRef.fieldId(), ownerTableId);
            if (field.isEmpty()) {
                unresolved.add(fieldRef.fieldId());
                return new FieldRef(fieldRef.fieldId(), fieldRef.fieldName(), FieldType.UNKNOWN);
            }
            Field f = field.get();
            return new FieldRef(f.id(), f.name(), f.type());
        }

        @Override
        public FormulaNode visitFunctionCall(FunctionCall call) {
            List<FormulaNode> args = new ArrayList<>(call.args().size());
            for (FormulaNode arg : call.args()) {
                args.add(arg.accept(this));
            }
            return new FunctionCall(call.name(), args);
        }

        @Override
        public FormulaNode visitBinaryOp(BinaryOp binaryOp) {
            return new BinaryOp(binaryOp.operator(), binaryOp.left().accept(this), binaryOp.right().accept(this));
        }

        @Override
        public FormulaNode visitUnaryOp(UnaryOp unaryOp) {
            return new UnaryOp(unaryOp.operator(), unaryOp.operand().accept(this));
        }
    }
}
