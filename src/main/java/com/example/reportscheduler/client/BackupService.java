package com.example.reportscheduler.client;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Takes a snapshot of the application database.
 */
public interface BackupService {

    /**
     * @return the snapshot file
     */
    Path snapshot() throws IOException;
}
