package com.phillippitts.speaktomany.service.metrics;

import com.phillippitts.speaktomany.domain.Language;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link TranslationMetrics} used by the buffer and coordinator.
 *
 * <p>All methods handle a missing {@link TranslationMetrics} gracefully, so components can run
 * without a meter registry in unit tests.
 *
 * @see TranslationMetrics
 */
@Component
public final class TranslationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(TranslationMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and components built outside Spring.
     */
    public static final TranslationMetricsPublisher NOOP = new TranslationMetricsPublisher(null);

    private final TranslationMetrics metrics;

    /**
     * Constructs a metrics publisher with optional metrics support.
     *
     * @param metrics metrics tracking service (nullable for test mode)
     */
    @Autowired
    public TranslationMetricsPublisher(TranslationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("TranslationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(Language source, Language target, long translationMs, long totalMs) {
        if (metrics == null) {
            return;
        }
        metrics.recordTranslationLatency(source, target, translationMs);
        metrics.recordTotalLatency(totalMs);
        metrics.incrementSuccess(source, target);
    }

    public void recordFailure(Language source, Language target, String errorCategory) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(source, target, errorCategory);
    }

    public void recordDispatch(String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementDispatch(reason);
    }

    /**
     * @return true if metrics are available, false if running in test mode
     */
    public boolean isEnabled() {
        return metrics != null;
    }
}
