package com.deepansh.trader.solana;

import com.deepansh.trader.config.SolanaProperties;
import com.deepansh.trader.core.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * One RPC client per configured endpoint; the fallback exists only when
 * solana.fallback-rpc-url is set.
 */
@Configuration
@Slf4j
public class SolanaClientConfig {

    @Bean
    public SolanaRpcClient solanaRpcClient(SolanaProperties props, RestClient.Builder restClientBuilder) {
        log.info("Solana RPC endpoint: {}", props.getRpcUrl());
        return new HttpSolanaRpcClient(props.getRpcUrl(), props.getCommitment(), restClientBuilder);
    }

    @Bean
    public TransactionSubmitter transactionSubmitter(SolanaRpcClient solanaRpcClient,
                                                     SolanaProperties props,
                                                     RestClient.Builder restClientBuilder,
                                                     Sleeper sleeper) {
        SolanaRpcClient fallback = null;
        if (props.hasFallback()) {
            log.info("Solana fallback RPC endpoint: {}", props.getFallbackRpcUrl());
            fallback = new HttpSolanaRpcClient(props.getFallbackRpcUrl(), props.getCommitment(), restClientBuilder);
        }
        return new TransactionSubmitter(solanaRpcClient, fallback, props.getConfirmation(), sleeper);
    }
}
