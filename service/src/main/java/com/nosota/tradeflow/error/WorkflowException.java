package com.nosota.tradeflow.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of the domain errors.
 *
 * <p>Unchecked so that Spring rolls back the surrounding transaction. Each error carries the
 * structured details (entity id, current state, attempted action, ...) the caller needs to
 * render a precise message; they are copied into the {@code details} of the error body.
 */
public abstract class WorkflowException extends RuntimeException {

    private final Map<String, Object> details = new LinkedHashMap<>();

    protected WorkflowException(String message) {
        super(message);
    }

    protected WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }

    protected void detail(String key, Object value) {
        if (value != null) {
            details.put(key, value instanceof Enum<?> e ? e.name() : value);
        }
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
