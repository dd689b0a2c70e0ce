package com.example.reportscheduler.client;

import com.example.reportscheduler.config.ReportingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Default backup service copying the database file into a timestamped file.
 * Keeps the newest {@code reporting.backup-keep-count} backups.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileCopyBackupService implements BackupService {

    static final String PREFIX = "backup_";
    static final String SUFFIX = ".db";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final ReportingProperties properties;

    @Override
    public Path snapshot() throws IOException {
        var source = Path.of(properties.getBackupSourceFile());
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString(), null, "Database file to back up does not exist");
        }

        var backupDir = Path.of(properties.getBackupDir());
        Files.createDirectories(backupDir);

        var target = uniqueTarget(backupDir, STAMP.format(LocalDateTime.now()));
        Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
        log.info("Backup created: {}", target);

        removeOldBackups();
        return target;
    }

    /**
     * Backups in the backup directory, newest first
     */
    public List<Path> listBackups() throws IOException {
        var backupDir = Path.of(properties.getBackupDir());
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(backupDir)) {
            return files
                    .filter(p -> p.getFileName().toString().startsWith(PREFIX) && p.getFileName().toString().endsWith(SUFFIX))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        }
    }

    /**
     * Never overwrite an earlier backup taken within the same millisecond; a counter suffix sorts after the bare stamp
     */
    private Path uniqueTarget(Path backupDir, String stamp) {
        var target = backupDir.resolve(PREFIX + stamp + SUFFIX);
        for (int n = 1; Files.exists(target); n++) {
            target = backupDir.resolve(PREFIX + stamp + "_" + n + SUFFIX);
        }
        return target;
    }

    private void removeOldBackups() throws IOException {
        var backups = listBackups();
        for (var old : backups.stream().skip(properties.getBackupKeepCount()).toList()) {
            Files.deleteIfExists(old);
            log.debug("Removed old backup {}", old);
        }
    }
}
