package com.deepansh.trader.solana;

import java.util.Optional;

/**
 * Blockchain RPC primitives the agent needs. Every method throws {@link RpcException}
 * on a JSON-RPC error or a transport failure.
 */
public interface SolanaRpcClient {

    long getBalanceLamports(String publicKey);

    /**
     * @param signedTxBase64 fully signed transaction, base64
     * @param rpcMaxRetries  node-side rebroadcast count, null for the node default
     * @return the transaction signature the node reports
     */
    String sendTransaction(String signedTxBase64, boolean skipPreflight, Integer rpcMaxRetries);

    /** Empty while the node has not seen the signature */
    Optional<SignatureStatus> getSignatureStatus(String signature);

    /** True if the transaction landed and executed without error */
    boolean verifyTransaction(String signature);

    /** UI amount summed over all of the owner's token accounts for the mint */
    double getTokenBalance(String owner, String mint);

    String endpoint();
}
