package com.phillippitts.speaktomany.service.buffer;

import com.phillippitts.speaktomany.config.properties.TranslationBufferProperties;
import com.phillippitts.speaktomany.domain.SegmentSnapshot;
import com.phillippitts.speaktomany.domain.SegmentUpdate;
import com.phillippitts.speaktomany.service.metrics.TranslationMetricsPublisher;
import com.phillippitts.speaktomany.util.LogSanitizer;
import com.phillippitts.speaktomany.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latency-bounded translation buffer for one session.
 *
 * <p><b>Dispatch model:</b>
 * <ul>
 *   <li><b>Fast path:</b> a submit that leaves the segment final, or above the high-confidence
 *       threshold, queues it for immediate dispatch.</li>
 *   <li><b>Max-delay path:</b> every poll interval the drain thread sweeps for pending segments
 *       older than {@code max-delay-ms} and dispatches them with whatever text they have.</li>
 *   <li><b>Cleanup:</b> finished segments are dropped after {@code cleanup-grace-ms}.</li>
 * </ul>
 *
 * <p><b>Thread Model:</b> one daemon drain thread per buffer. Listener callbacks run on the
 * dispatch executor, one task per listener, so a slow or failing listener never delays the
 * sweep or the other listeners. When the executor rejects a callback, that listener counts as
 * failed for the segment. A segment is COMPLETED when at least one listener returned
 * normally (or none was registered) and FAILED when every listener raised.
 *
 * <p>Ids are logged through the Log4j2 ThreadContext ({@code sessionId}, {@code segmentId});
 * transcript text is only ever logged as a truncated preview.
 */
public final class RealtimeTranslationBuffer implements TranslationBuffer {

    private static final Logger LOG = LogManager.getLogger(RealtimeTranslationBuffer.class);

    private record Dispatch(String segmentId, DispatchReason reason) {
    }

    private final String sessionId;
    private final TranslationBufferProperties props;
    private final Executor dispatchExecutor;
    private final ApplicationEventPublisher publisher;
    private final TranslationMetricsPublisher metrics;

    private final ConcurrentMap<String, Segment> segments = new ConcurrentHashMap<>();
    private final BlockingQueue<Dispatch> readyQueue = new LinkedBlockingQueue<>();
    private final Map<String, SegmentListener> listeners = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread drainThread;

    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong forced = new AtomicLong();
    private final AtomicLong totalDispatchLatencyMs = new AtomicLong();
    private final AtomicLong maxDispatchLatencyMs = new AtomicLong();

    public RealtimeTranslationBuffer(String sessionId,
                                     TranslationBufferProperties props,
                                     Executor dispatchExecutor,
                                     ApplicationEventPublisher publisher,
                                     TranslationMetricsPublisher metrics) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.props = Objects.requireNonNull(props, "props");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? TranslationMetricsPublisher.NOOP : metrics;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::drainLoop, "translation-buffer-" + sessionId);
        t.setDaemon(true);
        drainThread = t;
        t.start();
        LOG.info("Translation buffer started: session={}, maxDelayMs={}, highConfidence={}",
                sessionId, props.getMaxDelayMs(), props.getHighConfidenceThreshold());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread t = drainThread;
        drainThread = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(Math.max(100, props.getMaxDelayMs()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        long abandoned = segments.values().stream().filter(Segment::isPending).count();
        readyQueue.clear();
        LOG.info("Translation buffer stopped: session={}, abandonedPending={}", sessionId, abandoned);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void registerListener(String listenerId, SegmentListener listener) {
        Objects.requireNonNull(listenerId, "listenerId");
        Objects.requireNonNull(listener, "listener");
        if (listeners.put(listenerId, listener) != null) {
            LOG.debug("Replaced dispatch listener {}", listenerId);
        } else {
            LOG.debug("Registered dispatch listener {}", listenerId);
        }
    }

    @Override
    public void unregisterListener(String listenerId) {
        if (listeners.remove(listenerId) != null) {
            LOG.debug("Unregistered dispatch listener {}", listenerId);
        }
    }

    @Override
    public boolean submit(SegmentUpdate update) {
        Objects.requireNonNull(update, "update");
        if (!running.get()) {
            LOG.debug("Ignoring segment {}: buffer not running", update.segmentId());
            return false;
        }
        if (update.text().isBlank()) {
            return false;
        }

        Segment[] created = new Segment[1];
        Segment segment = segments.computeIfAbsent(update.segmentId(),
                id -> created[0] = new Segment(update, System.nanoTime()));

        if (segment != created[0]) {
            if (!segment.speakerId().equals(update.speakerId())) {
                LOG.warn("Ignoring update for segment {}: speaker {} does not own it",
                        update.segmentId(), update.speakerId());
                return false;
            }
            if (!segment.merge(update)) {
                LOG.debug("Ignoring update for segment {}: no longer pending", update.segmentId());
                return false;
            }
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("Segment {} {}: final={}, confidence={}, text='{}'", update.segmentId(),
                    created[0] != null ? "added" : "updated", update.isFinal(), update.confidence(),
                    LogSanitizer.preview(update.text()));
        }

        if (segment.isReadyForImmediateDispatch(props.getHighConfidenceThreshold())) {
            DispatchReason reason = update.isFinal() ? DispatchReason.FINAL : DispatchReason.HIGH_CONFIDENCE;
            readyQueue.offer(new Dispatch(update.segmentId(), reason));
        }
        return true;
    }

    @Override
    public BufferStats stats() {
        long count = dispatched.get();
        double avg = count == 0 ? 0.0 : (double) totalDispatchLatencyMs.get() / count;
        int pending = (int) segments.values().stream().filter(Segment::isPending).count();
        return new BufferStats(count, completed.get(), failed.get(), forced.get(), avg,
                maxDispatchLatencyMs.get(), pending, readyQueue.size(), props.getMaxDelayMs(),
                listeners.size());
    }

    @Override
    public Optional<SegmentSnapshot> segmentInfo(String segmentId) {
        Segment segment = segments.get(segmentId);
        return segment == null ? Optional.empty() : Optional.of(segment.snapshot());
    }

    private void drainLoop() {
        ThreadContext.put("sessionId", sessionId);
        long pollNanos = TimeUnit.MILLISECONDS.toNanos(props.getPollIntervalMs());
        long nextSweep = System.nanoTime() + pollNanos;
        try {
            while (running.get()) {
                try {
                    long waitNanos = Math.max(0, nextSweep - System.nanoTime());
                    Dispatch next = readyQueue.poll(waitNanos, TimeUnit.NANOSECONDS);
                    if (next != null) {
                        dispatch(next.segmentId(), next.reason());
                    }
                    // Sweep even when the queue stays busy so forced dispatch is never starved
                    if (System.nanoTime() - nextSweep >= 0) {
                        sweep();
                        nextSweep = System.nanoTime() + pollNanos;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    LOG.error("Error in segment drain loop", e);
                }
            }
        } finally {
            ThreadContext.clearAll();
        }
    }

    /** Force-dispatches overdue segments and drops finished ones past the grace period. */
    void sweep() {
        long now = System.nanoTime();
        for (Segment segment : segments.values()) {
            if (segment.isOverdue(now, props.getMaxDelayMs())) {
                dispatch(segment.segmentId(), DispatchReason.MAX_DELAY);
            } else if (segment.isExpired(now, props.getCleanupGraceMs())) {
                segments.remove(segment.segmentId(), segment);
            }
        }
    }

    private void dispatch(String segmentId, DispatchReason reason) {
        Segment segment = segments.get(segmentId);
        if (segment == null) {
            return;
        }
        long now = System.nanoTime();
        if (!segment.beginTranslation(now)) {
            LOG.debug("Segment {} already dispatched; skipping {}", segmentId, reason);
            return;
        }

        long waitedMs = TimeUtils.millisBetween(segment.createdAtNanos(), now);
        dispatched.incrementAndGet();
        totalDispatchLatencyMs.addAndGet(waitedMs);
        maxDispatchLatencyMs.accumulateAndGet(waitedMs, Math::max);
        if (reason == DispatchReason.MAX_DELAY) {
            forced.incrementAndGet();
        }
        metrics.recordDispatch(reason.tag());

        SegmentSnapshot snapshot = segment.snapshot();
        List<Map.Entry<String, SegmentListener>> targets = new ArrayList<>(listeners.entrySet());
        LOG.debug("Dispatching segment {} ({}, waited {} ms) to {} listener(s)",
                segmentId, reason.tag(), waitedMs, targets.size());

        if (targets.isEmpty()) {
            finish(segment, true, 0);
            return;
        }

        ThreadContext.put("segmentId", segmentId);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(targets.size());
            for (Map.Entry<String, SegmentListener> target : targets) {
                futures.add(submitListener(target.getKey(), target.getValue(), snapshot));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .whenComplete((ignored, error) -> {
                        int failures = (int) futures.stream().filter(CompletableFuture::isCompletedExceptionally).count();
                        finish(segment, failures < futures.size(), failures);
                    });
        } finally {
            ThreadContext.remove("segmentId");
        }
    }

    /** Listener work never runs on the drain thread; a rejected task counts as a failed listener. */
    private CompletableFuture<Void> submitListener(String listenerId, SegmentListener listener,
                                                   SegmentSnapshot snapshot) {
        try {
            return CompletableFuture.runAsync(() -> invoke(listenerId, listener, snapshot), dispatchExecutor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Dispatch pool saturated; listener {} skipped for segment {}", listenerId, snapshot.segmentId());
            return CompletableFuture.failedFuture(e);
        }
    }

    private static void invoke(String listenerId, SegmentListener listener, SegmentSnapshot snapshot) {
        try {
            listener.onSegmentReady(snapshot);
        } catch (RuntimeException e) {
            LOG.warn("Listener {} failed for segment {}: {}", listenerId, snapshot.segmentId(), e.toString());
            throw e;
        }
    }

    private void finish(Segment segment, boolean success, int failedListeners) {
        segment.finish(success, System.nanoTime());
        if (success) {
            completed.incrementAndGet();
            return;
        }
        failed.incrementAndGet();
        LOG.warn("Segment {} failed for all {} listener(s); discarding", segment.segmentId(), failedListeners);
        publisher.publishEvent(new SegmentFailedEvent(sessionId, segment.segmentId(), segment.speakerId(),
                failedListeners, Instant.now()));
    }
}
