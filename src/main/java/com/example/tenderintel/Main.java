package com.example.tenderintel;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Запуск: tender-intel [--buffer N] [--complexity F] FILE...
 * Для каждого файла в stdout печатается JSON-отчет, логи идут в stderr.
 */
@Slf4j
public class Main {
    private static final String USAGE = "Usage: tender-intel [--buffer N] [--complexity F] FILE...";

    public static void main(String[] args) {
        int exitCode = run(args, Clock.systemDefaultZone(), System.out);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, Clock clock, PrintStream out) {
        int bufferDays = Config.getBufferDays();
        Double complexityFactor = null;
        List<Path> files = new ArrayList<>();

        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--buffer".equals(arg) && i + 1 < args.length) {
                    bufferDays = Integer.parseInt(args[++i]);
                } else if ("--complexity".equals(arg) && i + 1 < args.length) {
                    complexityFactor = Double.parseDouble(args[++i]);
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown or incomplete option: " + arg);
                } else {
                    files.add(Path.of(arg));
                }
            }
            if (files.isEmpty()) {
                throw new IllegalArgumentException("No input files");
            }
            AppContext.init(clock, bufferDays);
        } catch (IllegalArgumentException e) {
            // NumberFormatException тоже сюда
            log.error("Invalid arguments: {}", e.getMessage());
            out.println(USAGE);
            return 2;
        }

        DocumentTextLoader loader = new DocumentTextLoader();
        ReportWriter reportWriter = new ReportWriter();
        TenderIntakeService intakeService = AppContext.getIntakeService();
        int failures = 0;

        for (Path file : files) {
            TenderAssessment assessment;
            try {
                String text = loader.load(file);
                assessment = intakeService.process(file.toString(), text, complexityFactor);
            } catch (IOException e) {
                assessment = intakeService.failed(file.toString(), "Error reading file: " + e.getMessage());
                failures++;
            } catch (IllegalArgumentException e) {
                assessment = intakeService.failed(file.toString(), e.getMessage());
                failures++;
            }

            try {
                out.println(reportWriter.write(assessment));
            } catch (JsonProcessingException e) {
                log.error("Error writing report for {}: {}", file, e.getMessage());
                failures++;
            }
        }

        log.info("Processed {} files, {} failed", files.size(), failures);
        return failures == 0 ? 0 : 1;
    }
}
