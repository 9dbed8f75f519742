package com.deepansh.trader.solana;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a submission. An accepted transaction is a success even when
 * confirmation timed out: "unconfirmed" must never be read as "did not happen".
 */
@Data
@Builder
public class SubmissionResult {

    public static final String CONFIRMED = "confirmed";
    public static final String UNCONFIRMED = "unconfirmed";

    private final boolean success;
    private final String signature;
    private final String error;
    private final int attempts;

    /** confirmed or unconfirmed, null on failure */
    private final String confirmationStatus;
    private final String warning;
    private final String endpoint;

    public static SubmissionResult failure(String error, int attempts, String endpoint) {
        return SubmissionResult.builder()
                .success(false)
                .error(error)
                .attempts(attempts)
                .endpoint(endpoint)
                .build();
    }

    public boolean isConfirmed() {
        return CONFIRMED.equals(confirmationStatus);
    }
}
