package com.maildraft.infrastructure.ai.control;

import com.maildraft.domain.email.model.ClassificationResult;
import com.maildraft.domain.email.model.ConfidenceTier;
import com.maildraft.domain.email.model.ControlRecord;
import com.maildraft.domain.email.model.LengthTarget;
import com.maildraft.domain.email.model.Tone;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ControlResolverTest {

    private ControlResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ControlResolver(ControlResolver.DEFAULT_CONFIDENCE_THRESHOLD);
    }

    static Set<String> intents() {
        return ControlResolver.knownIntents();
    }

    @ParameterizedTest
    @MethodSource("intents")
    @DisplayName("every known intent resolves to a fully populated record")
    void fully_populated(String intent) {
        ControlRecord control = resolver.resolve(new ClassificationResult(intent, 0.9, "v"));

        assertThat(control.senderRole()).isNotBlank();
        assertThat(control.recipientRole()).isNotBlank();
        assertThat(control.domain()).isNotBlank();
        assertThat(control.intent()).isEqualTo(intent);
        assertThat(control.tone()).isNotNull();
        assertThat(control.lengthTarget()).isNotNull();
        assertThat(control.tier()).isEqualTo(ConfidenceTier.HIGH);
    }

    @Test
    @DisplayName("confidence exactly at the threshold is LOW")
    void threshold_is_exclusive() {
        assertThat(resolver.resolve(new ClassificationResult("employee_to_hr", 0.6, "v")).tier())
                .isEqualTo(ConfidenceTier.LOW);
        assertThat(resolver.resolve(new ClassificationResult("employee_to_hr", 0.6000001, "v")).tier())
                .isEqualTo(ConfidenceTier.HIGH);
    }

    @Test
    @DisplayName("consultant intent never resolves to a student sender")
    void consultant_sender() {
        ControlRecord control = resolver.resolve(new ClassificationResult("advisor_to_institution", 0.97, "v"));

        assertThat(control.senderRole()).isEqualTo("consultant").isNotEqualTo("student");
        assertThat(control.recipientRole()).isEqualTo("institution leadership");
        assertThat(control.lengthTarget()).isEqualTo(LengthTarget.LONG);
    }

    @Test
    @DisplayName("unknown label and null classification fall back to general")
    void unknown_label() {
        ControlRecord unknown = resolver.resolve(new ClassificationResult("pirate_to_parrot", 0.99, "v"));
        assertThat(unknown.intent()).isEqualTo("general");
        assertThat(unknown.domain()).isEqualTo("general");
        assertThat(unknown.tone()).isEqualTo(Tone.NEUTRAL);

        ControlRecord missing = resolver.resolve(null);
        assertThat(missing.intent()).isEqualTo("general");
        assertThat(missing.tier()).isEqualTo(ConfidenceTier.LOW);
    }

    @Test
    @DisplayName("threshold is configurable")
    void configurable_threshold() {
        ControlResolver strict = new ControlResolver(0.95);

        assertThat(strict.resolve(new ClassificationResult("employee_to_hr", 0.9, "v")).tier())
                .isEqualTo(ConfidenceTier.LOW);
        assertThatThrownBy(() -> new ControlResolver(1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
