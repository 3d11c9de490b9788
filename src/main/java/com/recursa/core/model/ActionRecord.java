package com.recursa.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The recorded outcome of one executed action. Appended to both the rendered
 * and the fact history of the frame that executed it.
 *
 * @param sequenceNo  1-based position in the owning frame's fact history
 * @param actionName  the action that was executed
 * @param arguments   arguments the action was executed with
 * @param result      payload on success, null on failure
 * @param error       error message on failure, null on success
 * @param errorReason typed reason on failure, null on success
 * @param timestamp   when the outcome was recorded
 */
public record ActionRecord(
    long sequenceNo,
    String actionName,
    Map<String, Object> arguments,
    String result,
    String error,
    FailureReason errorReason,
    Instant timestamp
) implements Serializable {

    public ActionRecord {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ActionRecord success(long sequenceNo, Action action, String result) {
        return new ActionRecord(sequenceNo, action.name(), action.arguments(), result, null, null, Instant.now());
    }

    public static ActionRecord failure(long sequenceNo, Action action, FailureReason reason, String error) {
        return new ActionRecord(sequenceNo, action.name(), action.arguments(), null, error, reason, Instant.now());
    }

    public boolean failed() {
        return errorReason != null;
    }

    /** Result or error text, whichever applies. */
    public String outcomeText() {
        return failed() ? "[" + errorReason + "] " + (error != null ? error : "") : (result != null ? result : "");
    }
}
