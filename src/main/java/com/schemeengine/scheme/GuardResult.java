package com.schemeengine.scheme;

import lombok.Value;

/**
 * Result of a guard evaluation.
 */
@Value
public class GuardResult {
    boolean passed;
    String reason;

    public static GuardResult pass() {
        return new GuardResult(true, null);
    }

    public static GuardResult fail(String reason) {
        return new GuardResult(false, reason);
    }
}
