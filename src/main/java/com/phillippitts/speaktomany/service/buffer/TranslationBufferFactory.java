package com.phillippitts.speaktomany.service.buffer;

import com.phillippitts.speaktomany.config.properties.TranslationBufferProperties;
import com.phillippitts.speaktomany.service.metrics.TranslationMetricsPublisher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Creates one {@link TranslationBuffer} per session with the shared dispatch executor.
 * Buffers are returned unstarted; the session owns their lifecycle.
 */
@Component
public class TranslationBufferFactory {

    private final TranslationBufferProperties props;
    private final Executor dispatchExecutor;
    private final ApplicationEventPublisher publisher;
    private final TranslationMetricsPublisher metrics;

    public TranslationBufferFactory(TranslationBufferProperties props,
                                    @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                                    ApplicationEventPublisher publisher,
                                    TranslationMetricsPublisher metrics) {
        this.props = Objects.requireNonNull(props);
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = metrics;
    }

    public TranslationBuffer create(String sessionId) {
        return new RealtimeTranslationBuffer(sessionId, props, dispatchExecutor, publisher, metrics);
    }
}
