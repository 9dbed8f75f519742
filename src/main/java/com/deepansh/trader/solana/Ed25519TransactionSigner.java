package com.deepansh.trader.solana;

import com.deepansh.trader.exception.AgentException;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.EdECPrivateKeySpec;
import java.security.spec.NamedParameterSpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Signs with the JDK's Ed25519 provider from a 64-byte Solana keypair
 * (32-byte seed followed by the 32-byte public key), base58 encoded.
 *
 * Wire layout: shortvec signature count, count x 64-byte signatures, message.
 * The fee payer's signature is slot 0 and covers the message bytes only.
 */
public class Ed25519TransactionSigner implements TransactionSigner {

    private static final int SIGNATURE_LENGTH = 64;

    private final PrivateKey privateKey;
    private final String publicKey;

    private Ed25519TransactionSigner(PrivateKey privateKey, String publicKey) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
    }

    public static Ed25519TransactionSigner fromBase58Keypair(String base58Keypair) {
        byte[] keypair;
        try {
            keypair = Base58.decode(base58Keypair.trim());
        } catch (IllegalArgumentException e) {
            throw new AgentException("Wallet private key is not valid base58", e);
        }
        if (keypair.length != 64) {
            throw new AgentException("Wallet keypair must be 64 bytes, got " + keypair.length);
        }

        try {
            byte[] seed = Arrays.copyOfRange(keypair, 0, 32);
            PrivateKey key = KeyFactory.getInstance("Ed25519")
                    .generatePrivate(new EdECPrivateKeySpec(NamedParameterSpec.ED25519, seed));
            return new Ed25519TransactionSigner(key, Base58.encode(Arrays.copyOfRange(keypair, 32, 64)));
        } catch (GeneralSecurityException e) {
            throw new AgentException("Could not load Ed25519 wallet key", e);
        }
    }

    @Override
    public String publicKey() {
        return publicKey;
    }

    @Override
    public String sign(String unsignedTxBase64) {
        byte[] tx;
        try {
            tx = Base64.getDecoder().decode(unsignedTxBase64);
        } catch (IllegalArgumentException e) {
            throw new AgentException("Transaction is not valid base64", e);
        }

        int[] header = readShortVec(tx);
        int signatureCount = header[0];
        int signaturesStart = header[1];
        int messageStart = signaturesStart + signatureCount * SIGNATURE_LENGTH;
        if (signatureCount < 1 || messageStart >= tx.length) {
            throw new AgentException("Malformed transaction: " + signatureCount + " signature slots");
        }

        byte[] message = Arrays.copyOfRange(tx, messageStart, tx.length);
        try {
            Signature signer = Signature.getInstance("Ed25519");
            signer.initSign(privateKey);
            signer.update(message);
            byte[] signature = signer.sign();
            System.arraycopy(signature, 0, tx, signaturesStart, SIGNATURE_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new AgentException("Transaction signing failed", e);
        }
        return Base64.getEncoder().encodeToString(tx);
    }

    /** Compact-u16: returns {value, bytesConsumed} */
    static int[] readShortVec(byte[] data) {
        int value = 0;
        int size = 0;
        while (true) {
            if (size >= data.length) {
                throw new AgentException("Truncated transaction: shortvec needs more than " + data.length + " bytes");
            }
            int b = data[size] & 0xff;
            value |= (b & 0x7f) << (7 * size);
            size++;
            if ((b & 0x80) == 0) break;
            if (size == 3) throw new AgentException("shortvec length overflow");
        }
        return new int[]{value, size};
    }
}
