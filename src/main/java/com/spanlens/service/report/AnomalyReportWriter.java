package com.spanlens.service.report;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.spanlens.model.AnomalySummaryRow;
import com.spanlens.model.AnomalyWindow;
import com.spanlens.model.Observation;
import com.spanlens.model.ObservationTable;
import com.spanlens.model.WindowSummaryRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the annotated observation table and the error windows of a run as CSV,
 * and logs a short report of what was found.
 * @author kiransahoo
 */
@Slf4j
@Service
public class AnomalyReportWriter {

    private static final int REPORT_LIMIT = 10;

    private final CsvMapper csvMapper = new CsvMapper();

    public List<Path> write(ObservationTable table, List<AnomalyWindow> windows, Path outputDir, String stamp) {
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);

            Path anomalies = outputDir.resolve("anomalies_" + stamp + ".csv");
            List<AnomalySummaryRow> rows = table.stream()
                    .map(AnomalySummaryRow::from)
                    .collect(Collectors.toList());
            writeCsv(anomalies, rows, AnomalySummaryRow.class);
            written.add(anomalies);
            log.info("Saved anomaly summary to {}", anomalies);

            if (!windows.isEmpty()) {
                Path windowFile = outputDir.resolve("error_windows_" + stamp + ".csv");
                List<WindowSummaryRow> windowRows = windows.stream()
                        .map(WindowSummaryRow::from)
                        .collect(Collectors.toList());
                writeCsv(windowFile, windowRows, WindowSummaryRow.class);
                written.add(windowFile);
                log.info("Saved error rate windows to {}", windowFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write results to " + outputDir, e);
        }
        return written;
    }

    private <T> void writeCsv(Path file, List<T> rows, Class<T> rowType) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
        csvMapper.writer(schema).writeValue(file.toFile(), rows);
    }

    public void logReport(ObservationTable table, List<AnomalyWindow> windows) {
        if (table.isEmpty()) {
            log.info("No data to report");
            return;
        }

        DoubleSummaryStatistics stats = table.stream()
                .mapToDouble(Observation::getLatency)
                .summaryStatistics();
        log.info(String.format("Latency statistics: Min=%.4fs, Max=%.4fs, Avg=%.4fs",
                stats.getMin(), stats.getMax(), stats.getAverage()));

        List<Observation> latencyAnomalies = table.stream()
                .filter(o -> Boolean.TRUE.equals(o.getLatencyAnomaly()))
                .limit(REPORT_LIMIT)
                .collect(Collectors.toList());
        if (!latencyAnomalies.isEmpty()) {
            log.info("Latency Anomalies:");
            for (Observation o : latencyAnomalies) {
                log.info(String.format("  %s  %.4fs  trace=%s span=%s service=%s error=%s%s",
                        o.getTimestamp(), o.getLatency(), o.getTraceId(), o.getSpanId(), o.getService(),
                        o.isError(), o.getErrorType() != null ? " (" + o.getErrorType() + ")" : ""));
            }
        }

        List<AnomalyWindow> anomalousWindows = windows.stream()
                .filter(AnomalyWindow::isErrorRateAnomaly)
                .limit(REPORT_LIMIT)
                .collect(Collectors.toList());
        if (!anomalousWindows.isEmpty()) {
            log.info("Error Rate Anomalies:");
            for (AnomalyWindow w : anomalousWindows) {
                log.info(String.format("  %s  rate=%.2f (%d/%d)",
                        w.getWindowStart(), w.getWindowErrorRate(), w.getErrorCount(), w.getObservationCount()));
            }
        }
    }
}
