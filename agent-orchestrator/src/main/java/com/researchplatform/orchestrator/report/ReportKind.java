package com.researchplatform.orchestrator.report;

public enum ReportKind {
    SINGLE_SYMBOL,
    MARKET_SCAN,
    REFUSAL
}
