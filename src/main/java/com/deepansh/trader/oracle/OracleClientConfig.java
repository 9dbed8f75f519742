package com.deepansh.trader.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw oracle client for the provider selected by oracle.provider.
 * The resilient decorator wraps it and is what the orchestrator gets.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OracleClientConfig {

    private final OracleProperties props;

    @PostConstruct
    public void logActiveProvider() {
        OracleProviderProperties active = props.active();
        log.info("================================================================");
        log.info("  Reasoning oracle : {}", props.getProvider().toUpperCase());
        log.info("  Model            : {}", active.getModel());
        String key = active.getApiKey();
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set oracle.providers.{}.api-key",
                    props.getProvider().toUpperCase(), props.getProvider());
        } else {
            log.info("  Key              : {}...", key.substring(0, Math.min(6, key.length())));
        }
        log.info("================================================================");
    }

    @Bean("rawOracleClient")
    public OracleClient rawOracleClient(ObjectMapper objectMapper, RestClient.Builder builder) {
        return new GenericOracleClient(props.active(), objectMapper, props.getProvider().toLowerCase(), builder);
    }
}
