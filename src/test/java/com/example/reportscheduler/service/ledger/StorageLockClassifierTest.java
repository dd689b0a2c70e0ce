package com.example.reportscheduler.service.ledger;

import jakarta.persistence.LockTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.jpa.JpaSystemException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StorageLockClassifier Tests")
class StorageLockClassifierTest {

    @Test
    @DisplayName("Should classify Spring lock failures as locked")
    void shouldClassifySpringLockFailures() {
        assertThat(StorageLockClassifier.isStorageLocked(new CannotAcquireLockException("could not obtain lock"))).isTrue();
    }

    @Test
    @DisplayName("Should classify JPA lock timeouts as locked")
    void shouldClassifyJpaLockTimeout() {
        assertThat(StorageLockClassifier.isStorageLocked(new LockTimeoutException("timeout"))).isTrue();
    }

    @Test
    @DisplayName("Should find a lock SQL state deep in the cause chain")
    void shouldFindNestedSqlState() {
        var sql = new SQLException("could not serialize access", "40001");
        var wrapped = new JpaSystemException(new RuntimeException("commit failed", sql));

        assertThat(StorageLockClassifier.isStorageLocked(wrapped)).isTrue();
    }

    @Test
    @DisplayName("Should classify 'database is locked' messages as locked")
    void shouldClassifyLockedMessage() {
        assertThat(StorageLockClassifier.isStorageLocked(new SQLException("[SQLITE_BUSY] The database file is locked"))).isTrue();
    }

    @Test
    @DisplayName("Should not classify other failures as locked")
    void shouldNotClassifyOtherFailures() {
        assertThat(StorageLockClassifier.isStorageLocked(new DataIntegrityViolationException("duplicate key"))).isFalse();
        assertThat(StorageLockClassifier.isStorageLocked(new SQLException("syntax error", "42601"))).isFalse();
        assertThat(StorageLockClassifier.isStorageLocked(new IllegalStateException("boom"))).isFalse();
        assertThat(StorageLockClassifier.isStorageLocked(null)).isFalse();
    }
}
