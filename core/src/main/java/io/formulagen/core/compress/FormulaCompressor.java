package io.formulagen.core.compress;

import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.Schema;
import io.formulagen.core.schema.SchemaResolver;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inlines referenced formula fields into a formula, recursively, up to a depth limit.
 *
 * <p>
 * References are found by a left-to-right scan and replaced right to left, so earlier
 * replacements never shift the positions of matches still to be processed. Every inlined
 * formula is parenthesized. Each branch of the recursion carries its own copy of the visited
 * field set: the same helper field may be inlined in two sibling branches, while a field that
 * references itself along one branch is left as a reference.
 */
public final class FormulaCompressor {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaCompressor.class);

    /** Hard cap on inlining depth, whatever the caller asks for. */
    public static final int MAX_DEPTH = 64;

    private static final Pattern REFERENCE = Pattern.compile("\\{([^{}]+)\\}");

    private final Schema schema;
    private final SchemaResolver resolver;

    public FormulaCompressor(Schema schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.resolver = new SchemaResolver(schema);
    }

    /** Compresses {@code formula} with references kept as written. */
    public CompressionResult compress(String formula, int maxDepth) {
        return compress(formula, maxDepth, Set.of(), ReferenceFormat.FIELD_IDS);
    }

    public CompressionResult compress(String formula, int maxDepth, Set<String> visited) {
        return compress(formula, maxDepth, visited, ReferenceFormat.FIELD_IDS);
    }

    /**
     * Compresses a formula.
     *
     * @param formula  formula text
     * @param maxDepth levels of inlining to perform; 0 returns the text unchanged
     * @param visited  ids of fields that must not be inlined
     * @param format   how references in the result are written
     * @throws IllegalArgumentException if {@code maxDepth} is negative
     */
    public CompressionResult compress(String formula, int maxDepth, Set<String> visited, ReferenceFormat format) {
        return compress(formula, null, maxDepth, visited, format);
    }

    /**
     * Compresses the formula stored in a formula field. The field itself counts as visited.
     *
     * @throws IllegalArgumentException if the field does not exist or is not a formula field
     */
    public CompressionResult compressField(String fieldId, int maxDepth, ReferenceFormat format) {
        Field field = schema.field(fieldId)
                .orElseThrow(() -> new IllegalArgumentException("Field " + fieldId + " not found"));
        if (field.type() != FieldType.FORMULA || field.formula() == null) {
            throw new IllegalArgumentException("Field " + fieldId + " is not a formula field");
        }
        return compress(field.formula(), field.tableId(), maxDepth, Set.of(field.id()), format);
    }

    private CompressionResult compress(
            String formula, String ownerTableId, int maxDepth, Set<String> visited, ReferenceFormat format) {
        Objects.requireNonNull(formula, "formula must not be null");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        int limit = Math.min(maxDepth, MAX_DEPTH);
        CompressionResult result = inline(formula, ownerTableId, limit, 0, Set.copyOf(visited));
        LOG.debug("Formula compressed: max_depth={}, depth_reached={}", limit, result.depthReached());
        if (format == ReferenceFormat.FIELD_NAMES) {
            return new CompressionResult(toFieldNames(result.text(), ownerTableId), result.depthReached());
        }
        return result;
    }

    private CompressionResult inline(String formula, String ownerTableId, int limit, int depth, Set<String> visited) {
        if (depth >= limit) {
            return new CompressionResult(formula, depth);
        }
        List<MatchResult> matches = REFERENCE.matcher(formula).results().toList();
        int deepest = depth;
        StringBuilder result = new StringBuilder(formula);
        for (int i = matches.size() - 1; i >= 0; i--) {
            MatchResult match = matches.get(i);
            Optional<Field> referenced = resolver.lookup(match.group(1).trim(), ownerTableId);
            if (referenced.isEmpty() || !inlinable(referenced.get()) || visited.contains(referenced.get().id())) {
                continue;
            }
            Field field = referenced.get();
            Set<String> branch = new HashSet<>(visited);
            branch.add(field.id());
            CompressionResult inner = inline(field.formula(), field.tableId(), limit, depth + 1, branch);
            deepest = Math.max(deepest, inner.depthReached());
            result.replace(match.start(), match.end(), "(" + inner.text() + ")");
        }
        return new CompressionResult(result.toString(), deepest);
    }

    private static boolean inlinable(Field field) {
        return field.type() == FieldType.FORMULA && field.formula() != null && !field.formula().isBlank();
    }

    /** Rewrites every resolvable reference to {@code {Field Name}}. */
    private String toFieldNames(String formula, String ownerTableId) {
        Matcher matcher = REFERENCE.matcher(formula);
        return matcher.replaceAll(match -> Matcher.quoteReplacement(resolver.lookup(match.group(1).trim(), ownerTableId)
                .map(f -> "{" + f.name() + "}")
                .orElse(match.group())));
    }
}
