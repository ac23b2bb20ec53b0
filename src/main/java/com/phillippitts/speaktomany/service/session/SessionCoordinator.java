package com.phillippitts.speaktomany.service.session;

import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.SegmentSnapshot;
import com.phillippitts.speaktomany.domain.TranslationResult;
import com.phillippitts.speaktomany.exception.TranslationException;
import com.phillippitts.speaktomany.exception.TranslationExceptionBuilder;
import com.phillippitts.speaktomany.service.buffer.SegmentListener;
import com.phillippitts.speaktomany.service.metrics.TranslationMetricsPublisher;
import com.phillippitts.speaktomany.service.translation.TranslationService;
import com.phillippitts.speaktomany.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one speaker's segment out to every agent in the session that needs a translation.
 *
 * <p><b>Parallel Execution:</b> one translation request per listener whose language differs from
 * the segment's, all running concurrently on the translation executor. Each request carries its
 * own timeout, so one slow listener cannot extend another's wait.
 *
 * <p><b>Partial Failure:</b> a request that fails or times out is left out of the result map,
 * as is one the saturated executor rejected; the remaining listeners still get their results.
 * No lock is shared across listeners.
 *
 * <p>As the session buffer's dispatch listener, each result is delivered to its agent as soon as
 * that listener's translation completes. The callback raises only if translations were needed
 * and none succeeded, which marks the segment FAILED.
 */
public final class SessionCoordinator implements SegmentListener {

    private static final Logger LOG = LogManager.getLogger(SessionCoordinator.class);

    /** Extra wait on top of the per-request timeout before collection gives up. */
    private static final long COLLECTION_MARGIN_MS = 50;

    private record FanOut(int requested, Map<String, TranslationResult> results) {
    }

    private final String sessionId;
    private final TranslationService translationService;
    private final Executor executor;
    private final TranslationMetricsPublisher metrics;
    private final long requestTimeoutMs;

    private final Map<String, SessionParticipant> participants = new ConcurrentHashMap<>();

    public SessionCoordinator(String sessionId,
                              TranslationService translationService,
                              Executor executor,
                              TranslationMetricsPublisher metrics,
                              long requestTimeoutMs) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.translationService = Objects.requireNonNull(translationService, "translationService");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = metrics == null ? TranslationMetricsPublisher.NOOP : metrics;
        this.requestTimeoutMs = requestTimeoutMs > 0 ? requestTimeoutMs : 2000;
    }

    public void register(SessionParticipant participant) {
        participants.put(participant.participantId(), participant);
    }

    public void unregister(String participantId) {
        participants.remove(participantId);
    }

    public Collection<SessionParticipant> participants() {
        return Collections.unmodifiableCollection(participants.values());
    }

    /**
     * Translates {@code segment} for every other participant whose language differs from the
     * segment's source language.
     *
     * @param speakerId participant who spoke the segment
     * @param segment   dispatched segment
     * @return results keyed by listener id; listeners whose request failed are absent
     */
    public Map<String, TranslationResult> coordinate(String speakerId, SegmentSnapshot segment) {
        return fanOut(speakerId, segment, false).results();
    }

    @Override
    public void onSegmentReady(SegmentSnapshot segment) {
        FanOut fanOut = fanOut(segment.speakerId(), segment, true);
        if (fanOut.requested() > 0 && fanOut.results().isEmpty()) {
            throw TranslationExceptionBuilder.create("All translations failed for segment")
                    .provider(translationService.providerName())
                    .metadata("segmentId", segment.segmentId())
                    .metadata("listeners", fanOut.requested())
                    .build();
        }
    }

    private FanOut fanOut(String speakerId, SegmentSnapshot segment, boolean deliver) {
        Objects.requireNonNull(speakerId, "speakerId");
        Objects.requireNonNull(segment, "segment");

        List<SessionParticipant> targets = new ArrayList<>();
        for (SessionParticipant p : participants.values()) {
            if (!p.participantId().equals(speakerId) && p.language() != segment.sourceLanguage()) {
                targets.add(p);
            }
        }
        if (targets.isEmpty()) {
            LOG.debug("Segment {} needs no translation in session {}", segment.segmentId(), sessionId);
            return new FanOut(0, Map.of());
        }

        Map<String, CompletableFuture<TranslationResult>> futures = new LinkedHashMap<>();
        for (SessionParticipant target : targets) {
            CompletableFuture<TranslationResult> future;
            try {
                future = CompletableFuture
                        .supplyAsync(() -> translateFor(target, speakerId, segment), executor)
                        .orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                LOG.warn("Translation pool saturated; listener {} skipped for segment {}",
                        target.participantId(), segment.segmentId());
                metrics.recordFailure(segment.sourceLanguage(), target.language(), "rejected");
                continue;
            }
            if (deliver) {
                future.thenAcceptAsync(this::deliverResult, executor);
            }
            futures.put(target.participantId(), future);
        }
        if (futures.isEmpty()) {
            return new FanOut(targets.size(), Map.of());
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                    .get(requestTimeoutMs + COLLECTION_MARGIN_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Translation fan-out for segment {} timed out after {} ms", segment.segmentId(), requestTimeoutMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException ee) {
            LOG.debug("Fan-out for segment {} completed with failures: {}", segment.segmentId(), ee.getCause().toString());
        }

        Map<String, TranslationResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<TranslationResult>> entry : futures.entrySet()) {
            TranslationResult result = resultOrNull(entry.getValue());
            if (result != null) {
                results.put(entry.getKey(), result);
            } else if (entry.getValue().isCompletedExceptionally() || !entry.getValue().isDone()) {
                SessionParticipant target = participants.get(entry.getKey());
                if (target != null) {
                    metrics.recordFailure(segment.sourceLanguage(), target.language(), "timeout");
                }
                LOG.warn("Translation for listener {} on segment {} timed out", entry.getKey(), segment.segmentId());
            }
        }
        LOG.debug("Segment {}: {}/{} translations succeeded", segment.segmentId(), results.size(), targets.size());
        return new FanOut(targets.size(), Collections.unmodifiableMap(results));
    }

    private TranslationResult translateFor(SessionParticipant target, String speakerId, SegmentSnapshot segment) {
        Language source = segment.sourceLanguage();
        Language targetLanguage = target.language();
        long t0 = System.nanoTime();
        try {
            String translated = translationService.translate(segment.text(), source, targetLanguage,
                    target.preferences());
            long translationMs = TimeUtils.elapsedMillis(t0);
            long totalMs = TimeUtils.elapsedMillis(segment.createdAtNanos());
            metrics.recordSuccess(source, targetLanguage, translationMs, totalMs);
            return new TranslationResult(segment.segmentId(), speakerId, target.participantId(), segment.text(),
                    translated, source, targetLanguage, translationMs, totalMs);
        } catch (TranslationException te) {
            LOG.warn("Translation {}->{} for listener {} failed: {}", source, targetLanguage,
                    target.participantId(), te.getMessage());
            metrics.recordFailure(source, targetLanguage, "provider_error");
            return null;
        } catch (RuntimeException re) {
            LOG.error("Unexpected translation error for listener {}", target.participantId(), re);
            metrics.recordFailure(source, targetLanguage, "unexpected_error");
            return null;
        }
    }

    private void deliverResult(TranslationResult result) {
        if (result == null) {
            return;
        }
        SessionParticipant target = participants.get(result.listenerId());
        if (target == null) {
            LOG.debug("Listener {} left; discarding result for segment {}", result.listenerId(), result.segmentId());
            return;
        }
        try {
            target.deliver(result);
        } catch (RuntimeException e) {
            LOG.warn("Delivery to {} failed for segment {}: {}", result.listenerId(), result.segmentId(), e.toString());
        }
    }

    private static TranslationResult resultOrNull(CompletableFuture<TranslationResult> f) {
        if (!f.isDone() || f.isCompletedExceptionally() || f.isCancelled()) {
            return null;
        }
        return f.getNow(null);
    }
}
