package com.github.salilvnair.chatflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "chatflow.delivery")
@Getter
@Setter
public class ChatFlowDeliveryConfig {

    private boolean autoStart = true;
    private int workerThreads = 2;
    private int queueCapacity = 10_000;
    private Duration drainTimeout = Duration.ofSeconds(5);
    private Retry retry = new Retry();
    private RateLimit rateLimit = new RateLimit();
    private DeadLetter deadLetter = new DeadLetter();

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int recipientPerMinute = 30;
        private int recipientPerDay = 1000;
        private int globalPerSecond = 4;
    }

    @Getter
    @Setter
    public static class DeadLetter {
        private Duration retention = Duration.ofDays(30);
        private long purgeIntervalMs = 3_600_000L;
    }
}
