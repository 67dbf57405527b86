package com.bookcatalog.repository;

import java.util.Arrays;

/** Sortable columns by 1-based table position; a negative position means descending. */
public enum SortColumn {

    ID(1, "id"),
    NAME(2, "name"),
    AUTHOR(3, "author"),
    PUBLISH_DATE(4, "publish_date"),
    DESCRIPTION(5, "description");

    private final int index;
    private final String columnName;

    SortColumn(int index, String columnName) {
        this.index = index;
        this.columnName = columnName;
    }

    public int index() {
        return index;
    }

    public String columnName() {
        return columnName;
    }

    public static SortColumn fromIndex(int orderBy) {
        int position = Math.abs(orderBy);
        return Arrays.stream(values())
            .filter(column -> column.index == position)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unsupported orderBy value " + orderBy + ": expected 1..5 or -5..-1"));
    }

    public static String orderByClause(int orderBy) {
        SortColumn column = fromIndex(orderBy);
        String direction = orderBy < 0 ? "DESC" : "ASC";
        if (column == ID) {
            return "id " + direction;
        }
        return column.columnName + " " + direction + " NULLS LAST, id ASC";
    }
}
