package com.nosota.bankrec.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of business-rule failures raised by the reconciliation engine.
 *
 * <p>Each subclass carries a machine-readable error code and a map of structured
 * details (sums, offending IDs, tolerance) that is returned to the caller unchanged.
 */
public abstract class ReconciliationException extends Exception {

    private final Map<String, Object> details = new LinkedHashMap<>();

    protected ReconciliationException(String message) {
        super(message);
    }

    public abstract String getErrorCode();

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    protected void addDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
    }
}
