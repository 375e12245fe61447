package com.github.salilvnair.chatflow.delivery.queue;

import com.github.salilvnair.chatflow.delivery.OutboundMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded queue with one FIFO lane per recipient. Only the head of a lane is ever handed
 * out, and never while another worker holds a message for the same recipient, so a
 * recipient's messages leave in enqueue order even across retries.
 * <p>
 * A message stays at its lane head until {@link #complete} is called; {@link #reschedule}
 * puts it back with a later due time. After {@link #close} nothing is handed out or
 * accepted, and a rescheduled message is released instead of requeued.
 */
public class DeliveryQueue {

    private static final Comparator<OutboundMessage> DUE_ORDER = Comparator
            .comparing(OutboundMessage::getNextAttemptAt)
            .thenComparingLong(OutboundMessage::getSequence);

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, ArrayDeque<OutboundMessage>> lanes = new HashMap<>();
    private final TreeSet<OutboundMessage> ready = new TreeSet<>(DUE_ORDER);
    private final Set<String> inFlight = new HashSet<>();
    private long nextSequence;
    private int size;
    private boolean closed;

    public DeliveryQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /** @return false when the queue is at capacity or closed */
    public boolean offer(OutboundMessage message) {
        lock.lock();
        try {
            if (closed || size >= capacity) {
                return false;
            }
            message.setSequence(nextSequence++);
            ArrayDeque<OutboundMessage> lane = lanes.computeIfAbsent(message.getRecipient(), r -> new ArrayDeque<>());
            lane.addLast(message);
            size++;
            if (lane.size() == 1 && !inFlight.contains(message.getRecipient())) {
                ready.add(message);
            }
            changed.signalAll();
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /** Hands out the earliest due lane head, or {@code null} if nothing is due at {@code now}. */
    public OutboundMessage pollDue(Instant now) {
        lock.lock();
        try {
            return takeDue(now);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #pollDue} but waits up to {@code maxWait} for something to become due or
     * for the queue to change. Returns {@code null} on timeout.
     */
    public OutboundMessage awaitDue(Clock clock, Duration maxWait) throws InterruptedException {
        lock.lock();
        try {
            OutboundMessage message = takeDue(clock.instant());
            if (message != null) {
                return message;
            }
            long waitMs = maxWait.toMillis();
            if (!ready.isEmpty()) {
                long untilDue = Duration.between(clock.instant(), ready.first().getNextAttemptAt()).toMillis();
                waitMs = Math.max(1, Math.min(waitMs, untilDue));
            }
            changed.await(waitMs, TimeUnit.MILLISECONDS);
            return takeDue(clock.instant());
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Puts a handed-out message back at its lane head, due at {@code at}.
     *
     * @return false if the queue was closed meanwhile; the message is then removed and
     * the caller owns it
     */
    public boolean reschedule(OutboundMessage message, Instant at) {
        lock.lock();
        try {
            if (closed) {
                release(message);
                return false;
            }
            message.setNextAttemptAt(at);
            inFlight.remove(message.getRecipient());
            ready.add(message);
            changed.signalAll();
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /** Removes a message that reached a terminal state and releases its lane. */
    public void complete(OutboundMessage message) {
        lock.lock();
        try {
            release(message);
            ArrayDeque<OutboundMessage> lane = lanes.get(message.getRecipient());
            if (lane != null && !closed) {
                ready.add(lane.peekFirst());
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Waits until every accepted message has been completed.
     *
     * @return false if messages are still pending when {@code timeout} elapses
     */
    public boolean awaitEmpty(Duration timeout) throws InterruptedException {
        long remainingNs = timeout.toNanos();
        lock.lock();
        try {
            while (size > 0) {
                if (remainingNs <= 0) {
                    return false;
                }
                remainingNs = changed.awaitNanos(remainingNs);
            }
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue and removes every message that no worker holds, in lane order.
     * Heads currently handed out stay until their worker completes or reschedules them.
     */
    public List<OutboundMessage> close() {
        lock.lock();
        try {
            closed = true;
            List<OutboundMessage> removed = new ArrayList<>(size);
            for (Iterator<Map.Entry<String, ArrayDeque<OutboundMessage>>> it = lanes.entrySet().iterator(); it.hasNext(); ) {
                Map.Entry<String, ArrayDeque<OutboundMessage>> entry = it.next();
                ArrayDeque<OutboundMessage> lane = entry.getValue();
                OutboundMessage held = inFlight.contains(entry.getKey()) ? lane.pollFirst() : null;
                removed.addAll(lane);
                lane.clear();
                if (held == null) {
                    it.remove();
                }
                else {
                    lane.addFirst(held);
                }
            }
            ready.clear();
            size -= removed.size();
            changed.signalAll();
            return removed;
        }
        finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        }
        finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        }
        finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public List<OutboundMessage> pending(String recipient) {
        lock.lock();
        try {
            ArrayDeque<OutboundMessage> lane = lanes.get(recipient);
            return lane == null ? List.of() : List.copyOf(lane);
        }
        finally {
            lock.unlock();
        }
    }

    private void release(OutboundMessage message) {
        String recipient = message.getRecipient();
        ArrayDeque<OutboundMessage> lane = lanes.get(recipient);
        if (lane == null || lane.peekFirst() != message) {
            throw new IllegalStateException("Message is not the head of its lane: " + message);
        }
        lane.pollFirst();
        size--;
        inFlight.remove(recipient);
        if (lane.isEmpty()) {
            lanes.remove(recipient);
        }
        changed.signalAll();
    }

    private OutboundMessage takeDue(Instant now) {
        if (closed || ready.isEmpty() || ready.first().getNextAttemptAt().isAfter(now)) {
            return null;
        }
        OutboundMessage head = ready.pollFirst();
        inFlight.add(head.getRecipient());
        return head;
    }
}
