package com.deepansh.trader.solana;

public interface TransactionSigner {

    /** Base58 public key of the signing wallet */
    String publicKey();

    /**
     * Signs a serialized versioned transaction as its fee payer.
     *
     * @param unsignedTxBase64 transaction with an empty signature slot 0, base64
     * @return the same transaction with slot 0 filled, base64
     */
    String sign(String unsignedTxBase64);
}
