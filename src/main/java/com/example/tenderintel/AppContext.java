package com.example.tenderintel;

import java.time.Clock;

public class AppContext {
    private static DocumentAnalyzer documentAnalyzer;
    private static DeadlinePolicy deadlinePolicy;
    private static TenderIntakeService intakeService;

    public static void init(Clock clock, int bufferDays) {
        documentAnalyzer = new DocumentAnalyzer(clock);
        deadlinePolicy = new DeadlinePolicy(clock, bufferDays);
        intakeService = new TenderIntakeService(documentAnalyzer, deadlinePolicy);
    }

    public static DocumentAnalyzer getDocumentAnalyzer() {
        return documentAnalyzer;
    }

    public static DeadlinePolicy getDeadlinePolicy() {
        return deadlinePolicy;
    }

    public static TenderIntakeService getIntakeService() {
        return intakeService;
    }
}
