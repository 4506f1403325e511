package com.salesagent.leads.model;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Normalised outcome of one outbound call.
 */
public record CallResult(CallStatus status, List<TranscriptTurn> transcript, String callId, String error) {

    public CallResult {
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
    }

    public static CallResult noAnswer(String callId, String reason) {
        return new CallResult(CallStatus.NO_ANSWER, List.of(), callId, reason);
    }

    public static CallResult error(String reason) {
        return new CallResult(CallStatus.ERROR, List.of(), null, reason);
    }

    /** Transcript as "[ROLE] text" lines, empty string when nobody spoke. */
    public String transcriptText() {
        return transcript.stream()
                .map(t -> "[" + (t.role() == null ? "unknown" : t.role().toUpperCase(Locale.ROOT)) + "] " + t.text())
                .collect(Collectors.joining("\n"));
    }
}
