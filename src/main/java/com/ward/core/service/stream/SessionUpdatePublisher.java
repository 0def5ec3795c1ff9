package com.ward.core.service.stream;

import com.ward.core.issue.DetectedIssue;
import com.ward.core.service.config.MetricsConfig;
import com.ward.core.service.config.WardConfig;
import com.ward.core.service.engine.IssueDetectionAdapter;
import com.ward.core.service.runtime.SessionTracker;
import com.ward.core.session.PageSession;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Coalesces bursts of writes into single session snapshots for subscribers.
 *
 * Every write calls {@link #requestPublish()}, which restarts the debounce window. When the
 * window passes without another request, one {@link SessionUpdate} is built and handed to
 * every subscriber. A subscriber that throws is removed; the others still receive the update.
 */
@Slf4j
@Component
public class SessionUpdatePublisher {

    private final SessionTracker sessionTracker;
    private final IssueDetectionAdapter issueDetection;
    private final TaskScheduler scheduler;
    private final MetricsConfig metricsConfig;
    private final long debounceMs;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object scheduleLock = new Object();
    private ScheduledFuture<?> pending;

    public SessionUpdatePublisher(SessionTracker sessionTracker,
                                  IssueDetectionAdapter issueDetection,
                                  @Qualifier("publishScheduler") TaskScheduler scheduler,
                                  MetricsConfig metricsConfig,
                                  WardConfig wardConfig) {
        this.sessionTracker = sessionTracker;
        this.issueDetection = issueDetection;
        this.scheduler = scheduler;
        this.metricsConfig = metricsConfig;
        this.debounceMs = wardConfig.getStream().getDebounceMs();
        log.info("SessionUpdatePublisher initialized, debounce: {}ms", debounceMs);
    }

    // ==================== Subscriptions ====================

    /**
     * Registers a listener for future updates.
     *
     * @param listener receives each published update on the publish thread
     * @return handle used to stop receiving updates
     */
    public Subscription subscribe(Consumer<SessionUpdate> listener) {
        Subscription subscription = new Subscription(listener);
        subscriptions.add(subscription);
        log.debug("Subscriber added, total: {}", subscriptions.size());
        return subscription;
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    // ==================== Publishing ====================

    /**
     * Schedules a publish after the debounce window, replacing any publish still pending.
     */
    public void requestPublish() {
        synchronized (scheduleLock) {
            if (pending != null) {
                pending.cancel(false);
            }
            pending = scheduler.schedule(this::publishNow, Instant.now().plusMillis(debounceMs));
        }
    }

    /**
     * Builds a snapshot and delivers it immediately.
     *
     * @return the published update
     */
    public SessionUpdate publishNow() {
        List<PageSession> sessions = sessionTracker.getSessions();
        Map<String, List<DetectedIssue>> issues = new LinkedHashMap<>();
        for (PageSession session : sessions) {
            issues.put(session.id(), issueDetection.detect(session));
        }

        SessionUpdate update = new SessionUpdate(sequence.incrementAndGet(), sessions, issues, Instant.now());
        deliver(update);
        metricsConfig.getUpdatesPublished().increment();
        log.debug("Published update #{}: {} sessions to {} subscribers",
                update.sequence(), sessions.size(), subscriptions.size());
        return update;
    }

    private void deliver(SessionUpdate update) {
        for (Subscription subscription : subscriptions) {
            try {
                subscription.listener.accept(update);
            } catch (RuntimeException e) {
                log.warn("Dropping subscriber after delivery failure: {}", e.getMessage());
                subscription.cancel();
            }
        }
    }

    @PreDestroy
    void stop() {
        synchronized (scheduleLock) {
            if (pending != null) {
                pending.cancel(false);
            }
        }
        subscriptions.clear();
    }

    /**
     * Handle for one registered listener.
     */
    public final class Subscription {

        private final Consumer<SessionUpdate> listener;

        private Subscription(Consumer<SessionUpdate> listener) {
            this.listener = listener;
        }

        public void cancel() {
            if (subscriptions.remove(this)) {
                log.debug("Subscriber removed, total: {}", subscriptions.size());
            }
        }
    }
}
