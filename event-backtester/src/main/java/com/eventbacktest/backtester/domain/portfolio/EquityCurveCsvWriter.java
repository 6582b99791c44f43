package com.eventbacktest.backtester.domain.portfolio;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a finalized equity curve as timestamp-indexed CSV records for
 * downstream plotting.
 */
@Slf4j
public final class EquityCurveCsvWriter {

    static final String HEADER = "datetime,equity_curve,returns,drawdown,cash,commission,total";

    private EquityCurveCsvWriter() {
    }

    public static void write(PerformanceReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(report, writer);
        }
        log.info("Wrote {} equity curve rows to {}", report.getEquityCurve().size(), file);
    }

    public static void write(PerformanceReport report, Writer writer) throws IOException {
        writer.write(HEADER);
        writer.write('\n');
        for (EquityCurvePoint point : report.getEquityCurve()) {
            writer.write(String.join(",",
                    String.valueOf(point.getTimestamp()),
                    point.getEquityCurve().toPlainString(),
                    point.getReturns().toPlainString(),
                    point.getDrawdown().toPlainString(),
                    point.getCash().toPlainString(),
                    point.getCommission().toPlainString(),
                    point.getTotal().toPlainString()));
            writer.write('\n');
        }
        writer.flush();
    }
}
