package com.deepansh.trader.trading;

import com.deepansh.trader.config.SolanaProperties;
import com.deepansh.trader.exception.AgentException;
import com.deepansh.trader.exception.DataSourceException;
import com.deepansh.trader.market.JupiterClient;
import com.deepansh.trader.solana.SolanaWallet;
import com.deepansh.trader.solana.SubmissionResult;
import com.deepansh.trader.solana.TransactionSigner;
import com.deepansh.trader.solana.TransactionSubmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LiveTradeExecutorTest {

    private static final Map<String, Object> QUOTE = Map.of("inAmount", "100000000", "outAmount", "123456");

    @Mock JupiterClient jupiter;
    @Mock SolanaWallet wallet;
    @Mock TransactionSubmitter submitter;
    @Mock TransactionSigner signer;

    private LiveTradeExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new LiveTradeExecutor(jupiter, wallet, submitter, new SolanaProperties());
    }

    private void walletReady() {
        when(wallet.isConfigured()).thenReturn(true);
        when(wallet.getSigner()).thenReturn(Optional.of(signer));
        when(signer.publicKey()).thenReturn("WalletPubKey");
    }

    @Test
    void execute_noWallet_failsWithoutCallingJupiter() {
        when(wallet.isConfigured()).thenReturn(false);

        SubmissionResult result = executor.execute(QUOTE);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("Wallet not configured");
        verifyNoInteractions(jupiter, submitter);
    }

    @Test
    void execute_happyPath_signsAndSubmitsWithConfiguredRetries() {
        walletReady();
        when(jupiter.getSwapTransaction(QUOTE, "WalletPubKey")).thenReturn("unsigned");
        when(signer.sign("unsigned")).thenReturn("signed");
        SubmissionResult ok = SubmissionResult.builder()
                .success(true).signature("sig").attempts(1)
                .confirmationStatus(SubmissionResult.CONFIRMED).build();
        when(submitter.submit("signed", 3, Duration.ofMillis(2000))).thenReturn(ok);

        SubmissionResult result = executor.execute(QUOTE);

        assertThat(result).isSameAs(ok);
        verify(submitter, never()).submitDirect(anyString(), anyInt(), any());
    }

    @Test
    void execute_jupiterFailure_isReportedAsFailedResult() {
        walletReady();
        when(jupiter.getSwapTransaction(QUOTE, "WalletPubKey"))
                .thenThrow(new DataSourceException(JupiterClient.SOURCE, "swap endpoint returned 500"));

        SubmissionResult result = executor.execute(QUOTE);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).startsWith("Failed to get transaction from Jupiter");
        verifyNoInteractions(submitter);
    }

    @Test
    void execute_signingFailure_isReportedAsFailedResult() {
        walletReady();
        when(jupiter.getSwapTransaction(QUOTE, "WalletPubKey")).thenReturn("unsigned");
        when(signer.sign("unsigned")).thenThrow(new AgentException("Malformed transaction: 0 signature slots"));

        SubmissionResult result = executor.execute(QUOTE);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("Failed to sign transaction");
        verifyNoInteractions(submitter);
    }

    @Test
    void execute_primaryFails_fallsBackToDirectSubmission() {
        walletReady();
        when(jupiter.getSwapTransaction(QUOTE, "WalletPubKey")).thenReturn("unsigned");
        when(signer.sign("unsigned")).thenReturn("signed");
        when(submitter.submit("signed", 3, Duration.ofMillis(2000)))
                .thenReturn(SubmissionResult.failure("Blockhash not found", 3, "primary"));
        when(submitter.hasFallback()).thenReturn(true);
        SubmissionResult direct = SubmissionResult.builder()
                .success(true).signature("sig2").attempts(1)
                .confirmationStatus(SubmissionResult.UNCONFIRMED).warning("not confirmed").build();
        when(submitter.submitDirect("signed", 3, Duration.ofMillis(2000))).thenReturn(direct);

        SubmissionResult result = executor.execute(QUOTE);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSignature()).isEqualTo("sig2");
    }

    @Test
    void execute_primaryFailsWithoutFallback_returnsPrimaryFailure() {
        walletReady();
        when(jupiter.getSwapTransaction(QUOTE, "WalletPubKey")).thenReturn("unsigned");
        when(signer.sign("unsigned")).thenReturn("signed");
        when(submitter.submit("signed", 3, Duration.ofMillis(2000)))
                .thenReturn(SubmissionResult.failure("Transaction simulation failed", 1, "primary"));
        when(submitter.hasFallback()).thenReturn(false);

        SubmissionResult result = executor.execute(QUOTE);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Transaction simulation failed");
        verify(submitter, never()).submitDirect(anyString(), anyInt(), any());
    }
}
