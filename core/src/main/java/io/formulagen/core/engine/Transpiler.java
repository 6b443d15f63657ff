package io.formulagen.core.engine;

import io.formulagen.core.error.FunctionArityException;
import io.formulagen.core.model.Diagnostic;
import io.formulagen.core.model.Diagnostic.Kind;
import io.formulagen.core.model.FormulaNode;
import io.formulagen.core.model.FormulaNode.BinaryOp;
import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.model.FormulaNode.FunctionCall;
import io.formulagen.core.model.FormulaNode.Literal;
import io.formulagen.core.model.FormulaNode.UnaryOp;
import io.formulagen.core.spi.CodeGenBackend;
import io.formulagen.core.spi.Fragment;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a formula AST post-order and asks a {@link CodeGenBackend} to translate each node from
 * its already translated children. Holds no state between calls.
 *
 * <p>
 * A call the backend does not support is replaced by the backend's placeholder and reported as
 * an {@link Kind#UNSUPPORTED_FUNCTION} warning; the walk continues. A supported call with the
 * wrong number of arguments aborts the formula with a {@link FunctionArityException}.
 */
public final class Transpiler {

    private static final Logger LOG = LoggerFactory.getLogger(Transpiler.class);

    public TranspileResult transpile(FormulaNode root, CodeGenBackend backend) {
        return transpile(null, root, backend);
    }

    /**
     * Transpiles the formula of one field.
     *
     * @param fieldId field the formula belongs to, used in diagnostics; may be {@code null}
     * @throws FunctionArityException if a supported builtin gets an invalid number of arguments
     */
    public TranspileResult transpile(String fieldId, FormulaNode root, CodeGenBackend backend) {
        Walk walk = new Walk(fieldId, backend);
        Fragment fragment = root.accept(walk);
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String name : walk.unsupported) {
            LOG.warn("Unsupported function: field_id={}, function={}, target={}", fieldId, name, backend.id());
            diagnostics.add(Diagnostic.warning(
                    Kind.UNSUPPORTED_FUNCTION,
                    fieldId,
                    "Function " + name + " is not supported by the " + backend.id() + " backend"));
        }
        return new TranspileResult(fragment.code(), List.copyOf(walk.unsupported), diagnostics);
    }

    private static final class Walk implements FormulaNode.Visitor<Fragment> {

        private final String fieldId;
        private final CodeGenBackend backend;
        private final Set<String> unsupported = new LinkedHashSet<>();

        Walk(String fieldId, CodeGenBackend backend) {
            this.fieldId = fieldId;
            this.backend = backend;
        }

        @Override
        public Fragment visitLiteral(Literal literal) {
            return new Fragment(backend.transpileLiteral(literal), literal);
        }

        @Override
        public Fragment visitFieldRef(FieldRef fieldRef) {
            return new Fragment(backend.transpileFieldRef(fieldRef), fieldRef);
        }

        @Override
        public Fragment visitFunctionCall(FunctionCall call) {
            List<Fragment> args = new ArrayList<>(call.args().size());
            for (FormulaNode arg : call.args()) {
                args.add(arg.accept(this));
            }
            Optional<String> code;
            try {
                code = backend.transpileFunctionCall(call.name(), args);
            } catch (FunctionArityException e) {
                throw fieldId == null ? e : new FunctionArityException(e.getMessage(), e.functionName(), fieldId);
            }
            if (code.isPresent()) {
                return new Fragment(code.get(), call);
            }
            unsupported.add(call.name());
            return new Fragment(backend.unsupportedFunction(call.name(), args), call);
        }

        @Override
        public Fragment visitBinaryOp(BinaryOp binaryOp) {
            Fragment left = binaryOp.left().accept(this);
            Fragment right = binaryOp.right().accept(this);
            return new Fragment(backend.transpileBinaryOp(binaryOp.operator(), left, right), binaryOp);
        }

        @Override
        public Fragment visitUnaryOp(UnaryOp unaryOp) {
            Fragment operand = unaryOp.operand().accept(this);
            return new Fragment(backend.transpileUnaryOp(unaryOp.operator(), operand), unaryOp);
        }
    }
}
