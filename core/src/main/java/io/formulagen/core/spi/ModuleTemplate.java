package io.formulagen.core.spi;

import io.formulagen.core.model.Field;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import java.util.List;

/**
 * Module layout of a backend. The module assembler calls these in a fixed order:
 *
 * <pre>
 * header, helpers, dataAccessDeclaration,
 *   for each table: beginTable, (depthComment, getters...)..., computeAll, endTable
 * footer
 * </pre>
 *
 * Every method returns a complete block of source text, terminated by a newline.
 */
public interface ModuleTemplate {

    /** Name of the generated file. */
    String fileName();

    String header(Schema schema);

    /** Shared helper routines, emitted once per module. */
    String helpers();

    /** Declaration of the accessors generated getters call on the caller's data-access object. */
    String dataAccessDeclaration(List<LinkedTableAccess> accessors);

    String beginTable(Table table);

    String depthComment(int depth);

    /** Getter returning {@code expression}, with runtime errors turned into null. */
    String formulaGetter(Field field, String expression);

    String lookupGetter(LinkedFieldSpec spec);

    String rollupGetter(LinkedFieldSpec spec);

    String countGetter(LinkedFieldSpec spec);

    /** Getter that always returns null, carrying {@code reason} as a comment. */
    String stubGetter(Field field, String reason);

    /** Routine evaluating the given getters in order and storing the results. */
    String computeAll(Table table, List<Field> orderedFields);

    String endTable(Table table);

    /** Closing block; receives every emitted field in global depth order. */
    String footer(List<Field> computationOrder);
}
