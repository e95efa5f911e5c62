package com.maildraft.infrastructure.ai.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maildraft.domain.email.exception.MalformedOutputException;
import com.maildraft.domain.email.model.EmailDraft;
import com.maildraft.domain.email.model.GeneratedText;
import com.maildraft.domain.email.model.GenerationSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructuredExtractorTest {

    private static final String RECORD = """
            {"subject": "Leave application status", "greeting": "Dear HR Team,", \
            "body": "I would like to ask about the status of my leave application.", "closing": "Best regards,"}""";

    private StructuredExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new StructuredExtractor(new ObjectMapper());
    }

    private static GeneratedText text(String content) {
        return new GeneratedText(content, GenerationSource.GENERATED, Duration.ofMillis(10), 1);
    }

    private static String reasonOf(Throwable e) {
        return ((MalformedOutputException) e).getReasonCode();
    }

    @Nested
    @DisplayName("Recovery")
    class Recovery {

        @Test
        @DisplayName("bare record")
        void bare_record() {
            EmailDraft draft = extractor.extract(text(RECORD));

            assertThat(draft.subject()).isEqualTo("Leave application status");
            assertThat(draft.greeting()).isEqualTo("Dear HR Team,");
            assertThat(draft.closing()).isEqualTo("Best regards,");
        }

        @Test
        @DisplayName("record surrounded by prose after a malformed fragment")
        void prose_and_malformed_fragment() {
            String output = "Sure! Here is a draft {subject: broken, \"greeting\": } and the final version:\n"
                    + RECORD + "\nLet me know if you need changes.";

            EmailDraft draft = extractor.extract(text(output));

            assertThat(draft.body()).isEqualTo("I would like to ask about the status of my leave application.");
        }

        @Test
        @DisplayName("record inside a markdown code fence")
        void code_fence() {
            EmailDraft draft = extractor.extract(text("```json\n" + RECORD + "\n```"));

            assertThat(draft.subject()).isEqualTo("Leave application status");
        }

        @Test
        @DisplayName("extra fields are ignored")
        void extra_fields() {
            String output = "{\"subject\":\"Hello there\",\"greeting\":\"Hi,\",\"body\":\"Body text that is long enough.\","
                    + "\"closing\":\"Thanks,\",\"signature\":\"Alex\",\"meta\":{\"x\":1}}";

            EmailDraft draft = extractor.extract(text(output));

            assertThat(draft.subject()).isEqualTo("Hello there");
            assertThat(draft.closing()).isEqualTo("Thanks,");
        }

        @Test
        @DisplayName("braces inside string values do not confuse extraction")
        void braces_in_values() {
            String output = "{\"subject\":\"Use {curly} braces\",\"greeting\":\"Hi,\","
                    + "\"body\":\"Text with } and { inside.\",\"closing\":\"Bye,\"}";

            assertThat(extractor.extract(text(output)).subject()).isEqualTo("Use {curly} braces");
        }

        @Test
        @DisplayName("bracketed prose around a record is not an array")
        void brackets_in_prose() {
            EmailDraft draft = extractor.extract(text("[Draft] " + RECORD + " [end of draft]"));

            assertThat(draft.subject()).isEqualTo("Leave application status");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("empty output")
        void empty() {
            assertThatThrownBy(() -> extractor.extract(text("   ")))
                    .isInstanceOf(MalformedOutputException.class)
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo("EMPTY_OUTPUT"));
        }

        @Test
        @DisplayName("top-level array is not a record")
        void array() {
            assertThatThrownBy(() -> extractor.extract(text("[" + RECORD + "]")))
                    .isInstanceOf(MalformedOutputException.class)
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo("NON_RECORD_SHAPE"));
        }

        @Test
        @DisplayName("array after leading prose is not a record either")
        void array_after_prose() {
            assertThatThrownBy(() -> extractor.extract(text("Here you go: [ " + RECORD + " ]\nHope this helps.")))
                    .isInstanceOf(MalformedOutputException.class)
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo("NON_RECORD_SHAPE"));
        }

        @Test
        @DisplayName("prose only")
        void prose_only() {
            assertThatThrownBy(() -> extractor.extract(text("I am sorry, I cannot write that email.")))
                    .isInstanceOf(MalformedOutputException.class)
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo("NO_RECORD_FOUND"));
        }

        @Test
        @DisplayName("missing or non-string fields")
        void wrong_shape() {
            assertThatThrownBy(() -> extractor.extract(text("{\"subject\":\"a\",\"greeting\":\"b\",\"body\":\"c\"}")))
                    .isInstanceOf(MalformedOutputException.class);
            assertThatThrownBy(() -> extractor.extract(
                    text("{\"subject\":\"a\",\"greeting\":\"b\",\"body\":42,\"closing\":\"d\"}")))
                    .isInstanceOf(MalformedOutputException.class);
        }
    }
}
