package dev.univer.collector.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CollectorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Credential pipelines and chat traversals; concurrency is bounded by the callers
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService collectorExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "collector-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
