package com.deepansh.trader.solana;

/**
 * One entry of getSignatureStatuses.
 *
 * @param confirmationStatus processed, confirmed or finalized
 * @param err                on-chain error as JSON text, null when the transaction succeeded
 */
public record SignatureStatus(String confirmationStatus, String err) {

    public boolean isConfirmed() {
        return err == null
                && ("confirmed".equals(confirmationStatus) || "finalized".equals(confirmationStatus));
    }
}
