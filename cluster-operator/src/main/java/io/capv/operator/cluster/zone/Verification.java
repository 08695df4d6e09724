/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.zone;

/**
 * Outcome of a placement or failure domain check
 *
 * @param reason    Condition reason of the failure or null when the check passed
 * @param message   Human readable description of the failure
 */
public record Verification(String reason, String message) {
    private static final Verification PASSED = new Verification(null, null);

    /**
     * @return  A passed check
     */
    public static Verification passed() {
        return PASSED;
    }

    /**
     * @param reason    Condition reason
     * @param format    Message format
     * @param args      Message arguments
     *
     * @return  A failed check
     */
    public static Verification failed(String reason, String format, Object... args) {
        return new Verification(reason, String.format(format, args));
    }

    /**
     * @return  True if the check passed
     */
    public boolean isPassed() {
        return reason == null;
    }
}
