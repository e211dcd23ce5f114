package com.appointments.booking.repository;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Recognises SQLite unique-constraint failures. Depending on the path they come through,
 * Spring reports them as {@link DataIntegrityViolationException} or as a generic
 * {@link DataAccessException} wrapping the driver's {@link SQLiteException}.
 */
public final class SqliteConstraints {

    private SqliteConstraints() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean isUniqueViolation(DataAccessException ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLiteException) {
                return isUniqueViolation((SQLiteException) cause);
            }
        }
        return ex instanceof DataIntegrityViolationException;
    }

    private static boolean isUniqueViolation(SQLiteException ex) {
        SQLiteErrorCode code = ex.getResultCode();
        if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE) {
            return true;
        }
        // without extended result codes only the primary code and the message are available
        return code == SQLiteErrorCode.SQLITE_CONSTRAINT
                && ex.getMessage() != null
                && ex.getMessage().contains("UNIQUE");
    }
}
