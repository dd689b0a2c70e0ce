package com.example.reportscheduler.service.ledger;

import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PessimisticLockException;
import org.springframework.dao.PessimisticLockingFailureException;

import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a failed write belongs to the "storage locked" class that is worth retrying.
 */
public final class StorageLockClassifier {

    /**
     * lock_not_available, deadlock_detected, serialization_failure
     */
    private static final Set<String> LOCK_SQL_STATES = Set.of("55P03", "40P01", "40001");

    private StorageLockClassifier() {
    }

    public static boolean isStorageLocked(Throwable error) {
        var current = error;
        var depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof PessimisticLockingFailureException
                    || current instanceof PessimisticLockException
                    || current instanceof LockTimeoutException) {
                return true;
            }
            if (current instanceof SQLException sql && isLockedSqlError(sql)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isLockedSqlError(SQLException e) {
        if (e.getSQLState() != null && LOCK_SQL_STATES.contains(e.getSQLState())) {
            return true;
        }
        var message = e.getMessage();
        if (message == null) {
            return false;
        }
        var lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("locked") || lower.contains("busy");
    }
}
