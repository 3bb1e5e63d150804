package com.lumen.query.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration failureWindow;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final FailureClassifier classifier;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> failures = new ArrayDeque<>();

    private CircuitState state = CircuitState.CLOSED;
    private Instant openedAt;
    private boolean trialInFlight;
    private long totalRejected;
    private long totalOpened;
    private long totalClosed;
    private long stateChanges;

    public CircuitBreaker(String name, int failureThreshold, Duration failureWindow, Duration recoveryTimeout) {
        this(name, failureThreshold, failureWindow, recoveryTimeout, Clock.systemUTC(), new FailureClassifier());
    }

    public CircuitBreaker(
        String name,
        int failureThreshold,
        Duration failureWindow,
        Duration recoveryTimeout,
        Clock clock,
        FailureClassifier classifier
    ) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.failureWindow = failureWindow;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
        this.classifier = classifier;
    }

    public <T> T call(Callable<T> fn) {
        boolean trial = acquire();
        T result;
        try {
            result = fn.call();
        } catch (Exception e) {
            onFailure(trial, classifier.classify(e));
            throw FailureClassifier.propagate(e);
        } catch (Error e) {
            releaseTrial(trial);
            throw e;
        }
        onSuccess(trial);
        return result;
    }

    public CircuitState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            pruneFailures(clock.instant());
            return new CircuitBreakerSnapshot(
                name, state, failures.size(), totalRejected, totalOpened, totalClosed, stateChanges
            );
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        CircuitState before;
        lock.lock();
        try {
            before = state;
            if (state != CircuitState.CLOSED) {
                transition(CircuitState.CLOSED);
            }
            failures.clear();
            openedAt = null;
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
        logTransition(before, CircuitState.CLOSED);
    }

    public String getName() {
        return name;
    }

    private boolean acquire() {
        Instant now = clock.instant();
        CircuitState before;
        CircuitState after;
        lock.lock();
        try {
            before = state;
            switch (state) {
                case CLOSED:
                    return false;
                case OPEN:
                    if (now.isBefore(openedAt.plus(recoveryTimeout))) {
                        totalRejected++;
                        throw new CircuitOpenException(name);
                    }
                    transition(CircuitState.HALF_OPEN);
                    trialInFlight = true;
                    break;
                case HALF_OPEN:
                default:
                    if (trialInFlight) {
                        totalRejected++;
                        throw new CircuitOpenException(name);
                    }
                    trialInFlight = true;
                    break;
            }
            after = state;
        } finally {
            lock.unlock();
        }
        logTransition(before, after);
        return true;
    }

    private void onSuccess(boolean trial) {
        if (!trial) {
            return;
        }
        CircuitState before;
        CircuitState after;
        lock.lock();
        try {
            before = state;
            trialInFlight = false;
            failures.clear();
            if (state == CircuitState.HALF_OPEN) {
                transition(CircuitState.CLOSED);
                totalClosed++;
            }
            after = state;
        } finally {
            lock.unlock();
        }
        logTransition(before, after);
    }

    private void onFailure(boolean trial, FailureKind kind) {
        if (kind != FailureKind.TRANSIENT) {
            releaseTrial(trial);
            return;
        }
        Instant now = clock.instant();
        CircuitState before;
        CircuitState after;
        lock.lock();
        try {
            before = state;
            if (trial) {
                trialInFlight = false;
                if (state == CircuitState.HALF_OPEN) {
                    open(now);
                }
            } else if (state == CircuitState.CLOSED) {
                failures.addLast(now);
                pruneFailures(now);
                if (failures.size() >= failureThreshold) {
                    open(now);
                }
            }
            after = state;
        } finally {
            lock.unlock();
        }
        logTransition(before, after);
    }

    private void releaseTrial(boolean trial) {
        if (!trial) {
            return;
        }
        lock.lock();
        try {
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    private void open(Instant now) {
        transition(CircuitState.OPEN);
        openedAt = now;
        totalOpened++;
        failures.clear();
    }

    private void transition(CircuitState next) {
        state = next;
        stateChanges++;
    }

    private void logTransition(CircuitState before, CircuitState after) {
        if (before != after) {
            log.info("circuit_breaker_transition name={} from={} to={}", name, before, after);
        }
    }

    private void pruneFailures(Instant now) {
        Instant cutoff = now.minus(failureWindow);
        while (!failures.isEmpty() && failures.peekFirst().isBefore(cutoff)) {
            failures.pollFirst();
        }
    }
}
