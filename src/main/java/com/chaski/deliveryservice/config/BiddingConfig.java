package com.chaski.deliveryservice.config;

import com.chaski.deliveryservice.exception.BusyException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(BiddingProperties.class)
public class BiddingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded retry for lock contention. Only {@link BusyException} is retried;
     * every other failure reaches the caller on the first attempt.
     */
    @Bean
    public Retry packageLockRetry(BiddingProperties properties) {
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(properties.getBusyRetryAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.getBusyRetryBackoff().toMillis(), 2.0))
                .retryExceptions(BusyException.class)
                .build();

        Retry retry = Retry.of("package-lock", retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> log.debug("Lock busy, retry #{}: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
