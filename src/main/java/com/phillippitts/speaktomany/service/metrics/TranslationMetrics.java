package com.phillippitts.speaktomany.service.metrics;

import com.phillippitts.speaktomany.domain.Language;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for translation coordination.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Translation call latency per language pair</li>
 *   <li>End-to-end latency from first transcript to translated result</li>
 *   <li>Success/failure rates per language pair</li>
 *   <li>Segment dispatch counts by trigger (final, high confidence, max delay)</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TranslationMetrics {

    private static final String METRIC_PREFIX = "speaktomany.translation";

    private final MeterRegistry registry;

    public TranslationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one translation provider call.
     *
     * @param source source language
     * @param target target language
     * @param durationMs call duration in milliseconds
     */
    public void recordTranslationLatency(Language source, Language target, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by the translation provider")
                .tag("source", source.code())
                .tag("target", target.code())
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Records latency from first submission of a segment to a finished translation.
     *
     * @param durationMs end-to-end latency in milliseconds
     */
    public void recordTotalLatency(long durationMs) {
        Timer.builder(METRIC_PREFIX + ".total.latency")
                .description("Time from first transcript to translated result")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementSuccess(Language source, Language target) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful translations")
                .tag("source", source.code())
                .tag("target", target.code())
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for a language pair.
     *
     * @param reason failure category (timeout, provider_error, unexpected_error)
     */
    public void incrementFailure(Language source, Language target, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed translations")
                .tag("source", source.code())
                .tag("target", target.code())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts segment dispatches by what triggered them.
     *
     * @param reason dispatch trigger name (final, high_confidence, max_delay)
     */
    public void incrementDispatch(String reason) {
        Counter.builder(METRIC_PREFIX + ".dispatch")
                .description("Number of segments dispatched for translation")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
