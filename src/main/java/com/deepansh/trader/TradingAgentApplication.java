package com.deepansh.trader;

import com.deepansh.trader.config.AgentProperties;
import com.deepansh.trader.config.DataSourceProperties;
import com.deepansh.trader.config.SolanaProperties;
import com.deepansh.trader.oracle.OracleProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties({
        AgentProperties.class,
        DataSourceProperties.class,
        SolanaProperties.class,
        OracleProperties.class
})
public class TradingAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(TradingAgentApplication.class, args);
    }
}
