package com.grouptab.expense.client;

import com.grouptab.expense.config.RequestLoggingInterceptor;
import feign.RequestInterceptor;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.MDC;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JCircuitBreakerFactory;
import org.springframework.cloud.client.circuitbreaker.Customizer;
import org.springframework.context.annotation.Bean;

import java.time.Duration;

/**
 * Configuration for the member directory Feign client.
 * Propagates the correlation id and sets up the circuit breaker.
 */
public class MemberDirectoryClientConfig {

    @Bean
    public RequestInterceptor memberDirectoryRequestInterceptor() {
        return template -> {
            String traceId = MDC.get(RequestLoggingInterceptor.TRACE_ID);
            if (traceId != null) {
                template.header(RequestLoggingInterceptor.CORRELATION_ID_HEADER, traceId);
            }
            template.header("X-Service-Name", "expense-service");
        };
    }

    @Bean
    public Customizer<Resilience4JCircuitBreakerFactory> memberDirectoryCircuitBreakerCustomizer() {
        return factory -> factory.configure(builder -> builder
                .circuitBreakerConfig(CircuitBreakerConfig.custom()
                        .slidingWindowSize(20)
                        .minimumNumberOfCalls(10)
                        .failureRateThreshold(50)
                        .waitDurationInOpenState(Duration.ofSeconds(30))
                        .permittedNumberOfCallsInHalfOpenState(5)
                        .automaticTransitionFromOpenToHalfOpenEnabled(true)
                        .build())
                .timeLimiterConfig(TimeLimiterConfig.custom()
                        .timeoutDuration(Duration.ofSeconds(3))
                        .build())
                .build(), "member-directory");
    }
}
