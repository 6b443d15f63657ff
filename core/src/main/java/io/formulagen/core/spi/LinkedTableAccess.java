package io.formulagen.core.spi;

import io.formulagen.core.model.Table;

/**
 * Accessors a generated module requires from the caller's data-access object for one linked
 * table.
 *
 * @param table  the linked table
 * @param single whether a single-record fetch is used
 * @param batch  whether a batch fetch is used
 */
public record LinkedTableAccess(Table table, boolean single, boolean batch) {

    public LinkedTableAccess merge(boolean needsSingle, boolean needsBatch) {
        return new LinkedTableAccess(table, single || needsSingle, batch || needsBatch);
    }
}
