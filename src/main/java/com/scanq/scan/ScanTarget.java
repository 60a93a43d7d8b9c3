package com.scanq.scan;

import java.util.Locale;

/**
 * Fully qualified table a scan runs against.
 */
public record ScanTarget(String database, String schema, String table) {

    public ScanTarget {
        database = requireName(database, "database");
        schema = requireName(schema, "schema");
        table = requireName(table, "table");
    }

    /**
     * Warehouse identifiers are stored upper-cased.
     */
    public ScanTarget normalized() {
        return new ScanTarget(database.toUpperCase(Locale.ROOT), schema.toUpperCase(Locale.ROOT),
                table.toUpperCase(Locale.ROOT));
    }

    public String qualifiedName() {
        return database + "." + schema + "." + table;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }

    private static String requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
