package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Collectors;

/**
 * The SQL that differs between supported target databases.
 */
public enum StoreDialect {

    H2("CLOB") {
        @Override
        public String upsertSql(String table, String[] columns, String keyColumn) {
            return "MERGE INTO " + table + " (" + String.join(", ", columns) + ") KEY (" + keyColumn + ") VALUES ("
                + placeholders(columns.length) + ")";
        }
    },
    POSTGRES("TEXT") {
        @Override
        public String upsertSql(String table, String[] columns, String keyColumn) {
            String updates = Arrays.stream(columns)
                .filter(c -> !c.equals(keyColumn))
                .map(c -> c + " = EXCLUDED." + c)
                .collect(Collectors.joining(", "));
            return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders(columns.length)
                + ") ON CONFLICT (" + keyColumn + ") DO UPDATE SET " + updates;
        }
    };

    private final String textType;

    StoreDialect(String textType) {
        this.textType = textType;
    }

    /**
     * Insert-or-replace of one row identified by {@code keyColumn}, with one {@code ?} per column.
     */
    public abstract String upsertSql(String table, String[] columns, String keyColumn);

    public String textType() {
        return textType;
    }

    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
