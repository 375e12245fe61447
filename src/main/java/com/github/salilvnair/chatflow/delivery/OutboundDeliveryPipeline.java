package com.github.salilvnair.chatflow.delivery;

import com.github.salilvnair.chatflow.config.ChatFlowDeliveryConfig;
import com.github.salilvnair.chatflow.delivery.dead.DeadLetterEntry;
import com.github.salilvnair.chatflow.delivery.dead.DeadLetterStore;
import com.github.salilvnair.chatflow.delivery.dead.FailureReason;
import com.github.salilvnair.chatflow.delivery.gateway.MessagingGateway;
import com.github.salilvnair.chatflow.delivery.gateway.SendOutcome;
import com.github.salilvnair.chatflow.delivery.queue.DeliveryQueue;
import com.github.salilvnair.chatflow.delivery.ratelimit.DeliveryRateLimiter;
import com.github.salilvnair.chatflow.delivery.ratelimit.RateDecision;
import com.github.salilvnair.chatflow.delivery.retry.RetryPolicy;
import com.github.salilvnair.chatflow.engine.exception.PermanentDeliveryException;
import com.github.salilvnair.chatflow.engine.exception.TransientDeliveryException;
import com.github.salilvnair.chatflow.util.DaemonThreadFactory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves replies from the engine to the messaging platform. Every enqueued message ends
 * either delivered or in the dead-letter store.
 * <p>
 * A message that is rate limited goes back to its lane head with the limiter's retry
 * instant and keeps its attempt count. A transient failure increments the attempt count
 * and is retried with backoff until {@code retry.max-attempts} sends have failed.
 */
@Slf4j
@Component
public class OutboundDeliveryPipeline implements AutoCloseable {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(200);

    private final MessagingGateway gateway;
    private final RetryPolicy retryPolicy;
    private final DeadLetterStore deadLetterStore;
    private final DeliveryRateLimiter rateLimiter;
    private final ChatFlowDeliveryConfig config;
    private final Clock clock;
    private final DeliveryQueue queue;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    private volatile boolean running;
    private volatile boolean closed;
    private volatile ExecutorService workers;

    public OutboundDeliveryPipeline(MessagingGateway gateway,
                                    RetryPolicy retryPolicy,
                                    DeadLetterStore deadLetterStore,
                                    DeliveryRateLimiter rateLimiter,
                                    ChatFlowDeliveryConfig config,
                                    Clock clock) {
        this.gateway = gateway;
        this.retryPolicy = retryPolicy;
        this.deadLetterStore = deadLetterStore;
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.clock = clock;
        this.queue = new DeliveryQueue(Math.max(1, config.getQueueCapacity()));
    }

    @PostConstruct
    void init() {
        if (config.isAutoStart()) {
            start();
        }
    }

    public synchronized void start() {
        if (running || closed) {
            return;
        }
        int threads = Math.max(1, config.getWorkerThreads());
        running = true;
        workers = Executors.newFixedThreadPool(threads, new DaemonThreadFactory("chatflow-delivery-"));
        for (int i = 0; i < threads; i++) {
            workers.execute(this::workerLoop);
        }
        log.info("ChatFlow delivery started workers={} capacity={}", threads, queue.capacity());
    }

    /**
     * Accepts a message for delivery. When the queue is full (or the pipeline is closed)
     * the message goes straight to the dead-letter store.
     *
     * @return true if the message was queued
     */
    public boolean enqueue(OutboundMessage message) {
        if (closed) {
            deadLetter(message, FailureReason.SHUTDOWN, clock.instant());
            return false;
        }
        message.setStatus(MessageStatus.QUEUED);
        if (queue.offer(message)) {
            log.debug("Outbound queued id={} recipient={}", message.getId(), message.getRecipient());
            return true;
        }
        if (closed) {
            deadLetter(message, FailureReason.SHUTDOWN, clock.instant());
            return false;
        }
        log.warn("Outbound queue full capacity={} id={} recipient={}", queue.capacity(), message.getId(), message.getRecipient());
        message.setLastError("delivery queue full");
        deadLetter(message, FailureReason.QUEUE_FULL, clock.instant());
        return false;
    }

    /**
     * Processes every message due at the current clock instant on the calling thread.
     * Used when workers are not started.
     *
     * @return number of messages taken off the queue
     */
    public int processDue() {
        int processed = 0;
        OutboundMessage message;
        while ((message = queue.pollDue(clock.instant())) != null) {
            process(message, clock.instant());
            processed++;
        }
        return processed;
    }

    void process(OutboundMessage message, Instant now) {
        if (message.getStatus() == MessageStatus.RETRY_SCHEDULED) {
            message.setStatus(MessageStatus.QUEUED);
        }
        RateDecision decision = rateLimiter.tryAcquire(message.getRecipient(), now);
        if (!decision.granted()) {
            rateLimited.incrementAndGet();
            log.debug("Outbound rate limited id={} recipient={} limit={} retryAt={}",
                    message.getId(), message.getRecipient(), decision.limitedBy(), decision.retryAt());
            requeue(message, decision.retryAt());
            return;
        }
        message.setStatus(MessageStatus.SENDING);
        SendOutcome outcome = send(message);
        if (outcome instanceof SendOutcome.Delivered ok) {
            message.setStatus(MessageStatus.DELIVERED);
            queue.complete(message);
            delivered.incrementAndGet();
            log.debug("Outbound delivered id={} recipient={} providerId={}", message.getId(), message.getRecipient(), ok.providerMessageId());
        }
        else if (outcome instanceof SendOutcome.TransientFailure failure) {
            onTransientFailure(message, failure, now);
        }
        else {
            SendOutcome.PermanentFailure failure = (SendOutcome.PermanentFailure) outcome;
            message.setAttempt(message.getAttempt() + 1);
            message.setLastError(failure.reason());
            queue.complete(message);
            deadLetter(message, FailureReason.PERMANENT_FAILURE, now);
        }
    }

    private SendOutcome send(OutboundMessage message) {
        try {
            SendOutcome outcome = gateway.send(message.getRecipient(), message.getPayload());
            return outcome == null ? new SendOutcome.TransientFailure("gateway returned no outcome", null) : outcome;
        }
        catch (PermanentDeliveryException e) {
            return new SendOutcome.PermanentFailure(e.getMessage());
        }
        catch (TransientDeliveryException e) {
            return new SendOutcome.TransientFailure(e.getMessage(), e.getRetryAfter());
        }
        catch (RuntimeException e) {
            return new SendOutcome.TransientFailure(e.getClass().getSimpleName() + ": " + e.getMessage(), null);
        }
    }

    private void onTransientFailure(OutboundMessage message, SendOutcome.TransientFailure failure, Instant now) {
        int attempt = message.getAttempt() + 1;
        message.setAttempt(attempt);
        message.setLastError(failure.reason());
        if (attempt >= config.getRetry().getMaxAttempts()) {
            queue.complete(message);
            deadLetter(message, FailureReason.MAX_RETRIES_EXCEEDED, now);
            return;
        }
        Duration delay = retryPolicy.computeDelay(attempt);
        if (failure.retryAfter() != null && failure.retryAfter().compareTo(delay) > 0) {
            delay = failure.retryAfter();
        }
        message.setStatus(MessageStatus.RETRY_SCHEDULED);
        retried.incrementAndGet();
        log.warn("Outbound send failed id={} recipient={} attempt={} retryIn={} reason={}",
                message.getId(), message.getRecipient(), attempt, delay, failure.reason());
        requeue(message, now.plus(delay));
    }

    private void requeue(OutboundMessage message, Instant at) {
        if (!queue.reschedule(message, at)) {
            deadLetter(message, FailureReason.SHUTDOWN, clock.instant());
        }
    }

    private void deadLetter(OutboundMessage message, FailureReason reason, Instant now) {
        message.setStatus(MessageStatus.DEAD_LETTERED);
        deadLettered.incrementAndGet();
        DeadLetterEntry entry = DeadLetterEntry.of(message, reason, now);
        log.error("Outbound dead-lettered id={} recipient={} reason={} retries={} lastError={}",
                message.getId(), message.getRecipient(), reason, message.getAttempt(), message.getLastError());
        try {
            deadLetterStore.save(entry);
        }
        catch (RuntimeException e) {
            log.error("Failed to persist dead letter id={} recipient={} payload={}",
                    entry.id(), entry.recipient(), entry.payload().summary(), e);
        }
    }

    private void workerLoop() {
        while (running) {
            try {
                OutboundMessage message = queue.awaitDue(clock, POLL_INTERVAL);
                if (message != null) {
                    process(message, clock.instant());
                }
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            catch (RuntimeException e) {
                log.error("ChatFlow delivery worker error", e);
            }
        }
    }

    @Scheduled(fixedDelayString = "${chatflow.delivery.rate-limit.evict-interval-ms:600000}")
    public void evictIdleRateBuckets() {
        int evicted = rateLimiter.evictIdle(clock.instant());
        if (evicted > 0) {
            log.debug("Evicted idle rate buckets count={}", evicted);
        }
    }

    /**
     * Stops accepting messages and lets the workers keep delivering until the queue is
     * empty or {@code drain-timeout} elapses. Whatever is still pending then is
     * dead-lettered with reason SHUTDOWN.
     */
    @PreDestroy
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        ExecutorService executor = workers;
        if (executor != null) {
            long deadline = System.nanoTime() + config.getDrainTimeout().toNanos();
            try {
                if (!queue.awaitEmpty(config.getDrainTimeout())) {
                    log.warn("ChatFlow delivery drain timed out pending={}", queue.size());
                }
                running = false;
                executor.shutdown();
                if (!executor.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                    executor.shutdownNow();
                }
            }
            catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        running = false;
        List<OutboundMessage> remaining = queue.close();
        Instant now = clock.instant();
        for (OutboundMessage message : remaining) {
            deadLetter(message, FailureReason.SHUTDOWN, now);
        }
        log.info("ChatFlow delivery stopped delivered={} deadLettered={} parkedOnShutdown={}",
                delivered.get(), deadLettered.get(), remaining.size());
    }

    public int queuedCount() {
        return queue.size();
    }

    public List<OutboundMessage> pending(String recipient) {
        return queue.pending(recipient);
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long retriedCount() {
        return retried.get();
    }

    public long rateLimitedCount() {
        return rateLimited.get();
    }

    public long deadLetteredCount() {
        return deadLettered.get();
    }

    public boolean isRunning() {
        return running;
    }
}
