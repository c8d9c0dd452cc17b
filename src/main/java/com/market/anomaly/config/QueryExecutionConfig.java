package com.market.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class QueryExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService queryExecutor(QueryConfig queryConfig) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(queryConfig.getPoolSize(), r -> {
            Thread t = new Thread(r, "query-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
