package com.deepansh.trader.solana;

import com.deepansh.trader.config.SolanaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The agent's wallet. Configured only when solana.private-key is set; an invalid
 * key fails startup rather than surfacing on the first live trade.
 */
@Component
@Slf4j
public class SolanaWallet {

    private final TransactionSigner signer;

    public SolanaWallet(SolanaProperties props) {
        if (props.hasWallet()) {
            this.signer = Ed25519TransactionSigner.fromBase58Keypair(props.getPrivateKey());
            String pk = signer.publicKey();
            log.info("Wallet loaded [publicKey={}...{}]", pk.substring(0, 4), pk.substring(pk.length() - 4));
        } else {
            this.signer = null;
            log.warn("No wallet configured: live trading and wallet reads are disabled");
        }
    }

    public boolean isConfigured() {
        return signer != null;
    }

    public Optional<TransactionSigner> getSigner() {
        return Optional.ofNullable(signer);
    }

    public Optional<String> getPublicKey() {
        return getSigner().map(TransactionSigner::publicKey);
    }
}
