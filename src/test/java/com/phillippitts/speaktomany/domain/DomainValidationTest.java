package com.phillippitts.speaktomany.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainValidationTest {

    @Test
    void segmentUpdateRejectsOutOfRangeConfidence() {
        assertThatThrownBy(() -> new SegmentUpdate("s1", "alice", "hi", Language.EN, false, 1.2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Confidence");
        assertThatThrownBy(() -> new SegmentUpdate("s1", "alice", "hi", Language.EN, false, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void segmentUpdateRequiresIds() {
        assertThatThrownBy(() -> new SegmentUpdate(" ", "alice", "hi", Language.EN, false, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SegmentUpdate("s1", "", "hi", Language.EN, false, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void routeCannotLoopBack() {
        assertThatThrownBy(() -> new AudioRoute("alice", "alice", Language.EN, Language.ES,
                StreamType.TRANSLATED, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void routeIdNamesEndpointsAndType() {
        AudioRoute route = new AudioRoute("alice", "bob", Language.EN, Language.ES, StreamType.TRANSLATED, true);

        assertThat(route.routeId()).isEqualTo("alice_to_bob_translated");
        assertThat(route.withActive(true)).isSameAs(route);
        assertThat(route.withActive(false).active()).isFalse();
    }

    @Test
    void profileFillsDefaults() {
        ParticipantProfile profile = ParticipantProfile.of("bob", Language.ES);

        assertThat(profile.preferences()).isEqualTo(TranslationPreferences.DEFAULT);
        assertThat(profile.voice()).isEqualTo(Language.ES.defaultVoice());
        assertThatThrownBy(() -> ParticipantProfile.of(" ", Language.ES))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
