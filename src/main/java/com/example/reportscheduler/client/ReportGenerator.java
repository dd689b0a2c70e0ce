package com.example.reportscheduler.client;

import com.example.reportscheduler.client.ClientModels.ReportRequest;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Produces the report artifact for a date range.
 */
public interface ReportGenerator {

    /**
     * Generate the report and return the file it was written to
     */
    Path generate(ReportRequest request) throws IOException;
}
