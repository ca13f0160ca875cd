package ca.carms.residency.exception;

import lombok.Getter;

/**
 * A row references a parent that does not exist in the lookups or the store.
 */
@Getter
public class MissingForeignKeyException extends EtlException {

    private final String table;
    private final String column;
    private final String value;

    public MissingForeignKeyException(String table, String column, Object value, String rowKey) {
        super(String.format("%s row '%s' references missing %s=%s", table, rowKey, column, value));
        this.table = table;
        this.column = column;
        this.value = String.valueOf(value);
    }
}
