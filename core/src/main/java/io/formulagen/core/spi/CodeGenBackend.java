package io.formulagen.core.spi;

import io.formulagen.core.model.FormulaNode.FieldRef;
import io.formulagen.core.model.FormulaNode.Literal;
import java.util.List;
import java.util.Optional;

/**
 * SPI for a code generation target. The transpiler walks the AST bottom-up and calls one method
 * per node; the backend only turns already-generated child code into code for the parent.
 *
 * <p>
 * Backends must honour these contracts:
 * <ul>
 * <li>concatenation coalesces null operands to the empty string, wrapping only null sources
 * ({@link Fragment#isNullSource()}) and passing string literals and concatenation results
 * through unchanged</li>
 * <li>{@code =} and {@code !=} map to the target's strict equality</li>
 * <li>1-based positions of {@code FIND}, {@code MID} and friends are converted to the target's
 * convention once, at the mapping boundary</li>
 * <li>unsupported functions return empty from {@link #transpileFunctionCall} rather than
 * throwing</li>
 * </ul>
 *
 * <p>
 * Implementations MUST be stateless and thread-safe; {@link #configure} returns a new instance
 * bound to a schema and options instead of mutating the receiver.
 */
public interface CodeGenBackend {

    /** Unique backend identifier, used as {@code GeneratorOptions.target()}. */
    String id();

    /** Returns an instance of this backend bound to the given schema and options. */
    CodeGenBackend configure(GenerationContext context);

    String transpileLiteral(Literal literal);

    String transpileFieldRef(FieldRef fieldRef);

    String transpileBinaryOp(String operator, Fragment left, Fragment right);

    String transpileUnaryOp(String operator, Fragment operand);

    /**
     * Maps a builtin call.
     *
     * @return the generated code, or empty if the function is not supported by this backend
     * @throws io.formulagen.core.error.FunctionArityException if a supported function gets an
     *                                                        invalid number of arguments
     */
    Optional<String> transpileFunctionCall(String name, List<Fragment> args);

    /** Placeholder expression, evaluating to null, for a call this backend cannot translate. */
    String unsupportedFunction(String name, List<Fragment> args);

    /** Module-level layout for this target. */
    ModuleTemplate moduleTemplate();
}
