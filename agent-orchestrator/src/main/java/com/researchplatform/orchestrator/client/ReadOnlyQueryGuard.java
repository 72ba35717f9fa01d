package com.researchplatform.orchestrator.client;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rejects portfolio questions that read like write operations. The portfolio service translates
 * questions to SQL, so a question is screened for data-changing keywords before it leaves.
 */
public final class ReadOnlyQueryGuard {

    private static final Pattern WRITE_KEYWORDS = Pattern.compile(
        "\\b(insert|update|delete|drop|alter|create|truncate|grant|revoke)\\b");

    private ReadOnlyQueryGuard() {}

    public static boolean isReadOnly(String question) {
        if (question == null || question.isBlank()) return false;
        return !WRITE_KEYWORDS.matcher(question.toLowerCase(Locale.ROOT)).find();
    }
}
