package com.deepansh.trader.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate is populated on trading
 * experiences and cycle traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.deepansh.trader.memory",
    "com.deepansh.trader.observability"
})
public class MongoConfig {
}
