package com.phillippitts.speaktomany.service.metrics;

import com.phillippitts.speaktomany.domain.Language;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TranslationMetricsTest {

    private MeterRegistry registry;
    private TranslationMetricsPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new TranslationMetricsPublisher(new TranslationMetrics(registry));
    }

    @Test
    void shouldRecordSuccessWithLatencies() {
        publisher.recordSuccess(Language.EN, Language.ES, 120, 480);

        Timer latency = registry.find("speaktomany.translation.latency")
                .tag("source", "en").tag("target", "es").timer();
        Timer total = registry.find("speaktomany.translation.total.latency").timer();
        Counter success = registry.find("speaktomany.translation.success").tag("target", "es").counter();

        assertThat(latency).isNotNull();
        assertThat(latency.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
        assertThat(total.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(480.0);
        assertThat(success.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountFailuresByReason() {
        publisher.recordFailure(Language.EN, Language.FR, "timeout");
        publisher.recordFailure(Language.EN, Language.FR, "timeout");
        publisher.recordFailure(Language.EN, Language.FR, "provider_error");

        Counter timeouts = registry.find("speaktomany.translation.failure").tag("reason", "timeout").counter();

        assertThat(timeouts.count()).isEqualTo(2.0);
    }

    @Test
    void shouldCountDispatchesByReason() {
        publisher.recordDispatch("max_delay");

        assertThat(registry.find("speaktomany.translation.dispatch").tag("reason", "max_delay").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void noopPublisherAcceptsEverything() {
        TranslationMetricsPublisher.NOOP.recordSuccess(Language.EN, Language.ES, 1, 2);
        TranslationMetricsPublisher.NOOP.recordFailure(Language.EN, Language.ES, "timeout");
        TranslationMetricsPublisher.NOOP.recordDispatch("final");

        assertThat(TranslationMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThat(publisher.isEnabled()).isTrue();
    }
}
