package com.fibrepay.adapter.out.persistence;

import com.fibrepay.domain.exception.DuplicateEntryException;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Row and parameter helpers shared by the JDBC adapters
 */
final class SqlSupport {

    private SqlSupport() {
    }

    /**
     * Flags are stored as SMALLINT 0/1. Drivers hand them back as Boolean or as a Number.
     */
    static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() == 1;
        }
        return false;
    }

    static int flag(boolean value) {
        return value ? 1 : 0;
    }

    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    /**
     * Unique key violations become DuplicateEntryException, anything else fails unchanged.
     * SQLState 23505 is H2, error code 1 is Oracle ORA-00001.
     */
    static <T> Future<T> duplicateAsConflict(Throwable error, String entry) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException) {
                SQLException sqlError = (SQLException) cause;
                if ("23505".equals(sqlError.getSQLState()) || sqlError.getErrorCode() == 1) {
                    return Future.failedFuture(new DuplicateEntryException(entry + " was inserted concurrently"));
                }
            }
        }
        return Future.failedFuture(error);
    }

    static <T> Optional<T> first(RowSet<Row> rows, Function<Row, T> mapper) {
        if (rows.size() == 0) {
            return Optional.empty();
        }
        return Optional.of(mapper.apply(rows.iterator().next()));
    }

    static <T> List<T> all(RowSet<Row> rows, Function<Row, T> mapper) {
        List<T> result = new ArrayList<>(rows.size());
        rows.forEach(row -> result.add(mapper.apply(row)));
        return result;
    }

    /**
     * Builds the SET list of an UPDATE from the non-null fields of a patch.
     * Column names come from adapter constants, never from input.
     */
    static final class ColumnPatch {
        private final List<String> assignments = new ArrayList<>();
        private final Tuple params = Tuple.tuple();

        ColumnPatch set(String column, Object value) {
            if (value != null) {
                assignments.add(column + " = ?");
                params.addValue(value);
            }
            return this;
        }

        boolean isEmpty() {
            return assignments.isEmpty();
        }

        String assignments() {
            return String.join(", ", assignments);
        }

        Tuple params() {
            return params;
        }
    }
}
