package com.example.reportscheduler.client;

import com.example.reportscheduler.client.ClientModels.ReportRequest;
import com.example.reportscheduler.config.ReportingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Default report generator writing a CSV summary file per run.
 * <p>
 * Files land in {@code <output-dir>/<job type>/<yyyy>/<MM>/}. The report body is left to the
 * host application, which replaces this bean with one that renders the real figures.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvReportGenerator implements ReportGenerator {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final ReportingProperties properties;

    @Override
    public Path generate(ReportRequest request) throws IOException {
        var start = request.getStartDate();
        var directory = Path.of(properties.getOutputDir(), request.getJobType().getCode(),
                String.valueOf(start.getYear()), String.format("%02d", start.getMonthValue()));
        Files.createDirectories(directory);

        var fileName = new StringBuilder(request.getJobType().getCode());
        if (request.getEmployeeRef() != null) {
            fileName.append('_').append(request.getEmployeeRef().replaceAll("[^A-Za-z0-9_-]", "_"));
        }
        fileName.append('_').append(FILE_DATE.format(start))
                .append("_to_").append(FILE_DATE.format(request.getEndDate()))
                .append(".csv");

        var file = directory.resolve(fileName.toString());
        Files.write(file, List.of(
                "report,start_date,end_date,employee",
                String.join(",",
                        request.getJobType().getDisplayName(),
                        start.toString(),
                        request.getEndDate().toString(),
                        request.getEmployeeRef() != null ? request.getEmployeeRef() : "")
        ), StandardCharsets.UTF_8);

        log.info("Generated {} for {} to {}: {}", request.getJobType().getDisplayName(), start, request.getEndDate(), file);
        return file;
    }
}
