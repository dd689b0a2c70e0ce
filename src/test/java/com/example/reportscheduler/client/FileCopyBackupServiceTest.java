package com.example.reportscheduler.client;

import com.example.reportscheduler.config.ReportingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileCopyBackupService Tests")
class FileCopyBackupServiceTest {

    @TempDir
    Path tempDir;

    private ReportingProperties properties;
    private FileCopyBackupService backupService;

    @BeforeEach
    void setUp() {
        properties = new ReportingProperties();
        properties.setBackupSourceFile(tempDir.resolve("app.db").toString());
        properties.setBackupDir(tempDir.resolve("backups").toString());
        properties.setBackupKeepCount(2);
        backupService = new FileCopyBackupService(properties);
    }

    @Test
    @DisplayName("Should copy the database file into a timestamped backup")
    void shouldCopyDatabaseFile() throws Exception {
        Files.writeString(tempDir.resolve("app.db"), "database-bytes");

        var backup = backupService.snapshot();

        assertThat(backup.getParent()).isEqualTo(tempDir.resolve("backups"));
        assertThat(backup.getFileName().toString()).matches("backup_\\d{8}_\\d{6}_\\d{3}\\.db");
        assertThat(Files.readString(backup)).isEqualTo("database-bytes");
    }

    @Test
    @DisplayName("Should keep only the newest backups")
    void shouldKeepOnlyNewestBackups() throws Exception {
        Files.writeString(tempDir.resolve("app.db"), "database-bytes");
        var backups = Files.createDirectories(tempDir.resolve("backups"));
        Files.writeString(backups.resolve("backup_20250101_020000.db"), "old");
        Files.writeString(backups.resolve("backup_20250102_020000.db"), "older");
        Files.writeString(backups.resolve("notes.txt"), "not a backup");

        var latest = backupService.snapshot();

        assertThat(backupService.listBackups())
                .containsExactly(latest, backups.resolve("backup_20250102_020000.db"));
        assertThat(backups.resolve("backup_20250101_020000.db")).doesNotExist();
        assertThat(backups.resolve("notes.txt")).exists();
    }

    @Test
    @DisplayName("Should not overwrite a backup taken moments earlier")
    void shouldKeepBackToBackSnapshots() throws Exception {
        Files.writeString(tempDir.resolve("app.db"), "first");
        var first = backupService.snapshot();
        Files.writeString(tempDir.resolve("app.db"), "second");
        var second = backupService.snapshot();

        assertThat(second).isNotEqualTo(first);
        assertThat(Files.readString(first)).isEqualTo("first");
        assertThat(Files.readString(second)).isEqualTo("second");
        assertThat(backupService.listBackups()).containsExactly(second, first);
    }

    @Test
    @DisplayName("Should fail when the database file is missing")
    void shouldFailWhenSourceMissing() {
        assertThatThrownBy(() -> backupService.snapshot()).isInstanceOf(NoSuchFileException.class);
        assertThat(tempDir.resolve("backups")).doesNotExist();
    }
}
