package com.deepansh.trader.solana;

import com.deepansh.trader.exception.AgentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.interfaces.EdECPrivateKey;
import java.util.Arrays;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Ed25519TransactionSignerTest {

    private KeyPair keyPair;
    private byte[] rawPublicKey;
    private Ed25519TransactionSigner signer;

    @BeforeEach
    void setUp() throws Exception {
        keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        byte[] seed = ((EdECPrivateKey) keyPair.getPrivate()).getBytes().orElseThrow();
        byte[] encodedPublic = keyPair.getPublic().getEncoded();
        // X.509 SubjectPublicKeyInfo: the raw 32-byte key is the tail
        rawPublicKey = Arrays.copyOfRange(encodedPublic, encodedPublic.length - 32, encodedPublic.length);

        byte[] keypair = new byte[64];
        System.arraycopy(seed, 0, keypair, 0, 32);
        System.arraycopy(rawPublicKey, 0, keypair, 32, 32);
        signer = Ed25519TransactionSigner.fromBase58Keypair(Base58.encode(keypair));
    }

    @Test
    void publicKey_isBase58OfKeypairTail() {
        assertThat(signer.publicKey()).isEqualTo(Base58.encode(rawPublicKey));
    }

    @Test
    void sign_fillsFeePayerSlotWithSignatureOverMessage() throws Exception {
        byte[] message = "versioned-message-bytes".getBytes(StandardCharsets.UTF_8);
        byte[] unsigned = new byte[1 + 64 + message.length];
        unsigned[0] = 1;
        System.arraycopy(message, 0, unsigned, 65, message.length);

        byte[] signed = Base64.getDecoder().decode(signer.sign(Base64.getEncoder().encodeToString(unsigned)));

        assertThat(signed).hasSize(unsigned.length);
        assertThat(Arrays.copyOfRange(signed, 65, signed.length)).containsExactly(message);

        Signature verifier = Signature.getInstance("Ed25519");
        verifier.initVerify(keyPair.getPublic());
        verifier.update(message);
        assertThat(verifier.verify(Arrays.copyOfRange(signed, 1, 65))).isTrue();
    }

    @Test
    void sign_noSignatureSlots_isRejected() {
        String tx = Base64.getEncoder().encodeToString(new byte[]{0, 1, 2, 3});

        assertThatThrownBy(() -> signer.sign(tx)).isInstanceOf(AgentException.class);
    }

    @Test
    void fromBase58Keypair_wrongLength_isRejected() {
        assertThatThrownBy(() -> Ed25519TransactionSigner.fromBase58Keypair(Base58.encode(new byte[]{1, 2, 3})))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("64 bytes");
    }

    @Test
    void readShortVec_multiByteValue() {
        assertThat(Ed25519TransactionSigner.readShortVec(new byte[]{(byte) 0x80, 0x01})).containsExactly(128, 2);
        assertThat(Ed25519TransactionSigner.readShortVec(new byte[]{0x02})).containsExactly(2, 1);
    }

    @Test
    void sign_emptyOrTruncatedTransaction_isRejectedWithAgentException() {
        assertThatThrownBy(() -> signer.sign(""))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("Truncated");
        String truncated = Base64.getEncoder().encodeToString(new byte[]{(byte) 0x80});
        assertThatThrownBy(() -> signer.sign(truncated))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void sign_invalidBase64_isRejectedWithAgentException() {
        assertThatThrownBy(() -> signer.sign("not base64!"))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("base64");
    }

    @Test
    void readShortVec_emptyInput_isRejected() {
        assertThatThrownBy(() -> Ed25519TransactionSigner.readShortVec(new byte[0]))
                .isInstanceOf(AgentException.class);
    }
}
