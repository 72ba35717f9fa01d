package com.researchplatform.orchestrator.report;

/** Report text produced by the synthesis stage. {@code fallback} marks a report assembled without the model. */
public record SynthesizedReport(ReportKind kind, String text, boolean fallback) {

    public static SynthesizedReport refusal() {
        return new SynthesizedReport(ReportKind.REFUSAL, ReportSynthesizer.REFUSAL, false);
    }
}
