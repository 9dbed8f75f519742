package com.deepansh.trader.oracle;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bound from application.yml under the "oracle" prefix:
 *
 *   oracle:
 *     provider: groq
 *     providers:
 *       groq:   { api-key: ..., base-url: ..., model: ... }
 *       openai: { ... }
 */
@ConfigurationProperties(prefix = "oracle")
@Data
public class OracleProperties {

    private String provider = "groq";

    private Map<String, OracleProviderProperties> providers = new LinkedHashMap<>();

    public OracleProviderProperties active() {
        OracleProviderProperties p = providers.get(provider.toLowerCase());
        if (p == null) {
            throw new IllegalStateException("No oracle.providers." + provider + " block configured. "
                    + "Known providers: " + providers.keySet());
        }
        return p;
    }
}
