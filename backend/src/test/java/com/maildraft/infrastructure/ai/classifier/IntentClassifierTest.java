package com.maildraft.infrastructure.ai.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maildraft.domain.email.model.ClassificationResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntentClassifierTest {

    private static IntentModel trained;

    @BeforeAll
    static void trainOnce() throws IOException {
        trained = new DatasetIntentModelSource(
                new ClassPathResource("ml/intent-dataset.json"), new ObjectMapper(), new IntentModelTrainer()).load();
    }

    private static IntentClassifier classifierFor(IntentModel model) throws IOException {
        IntentModelSource source = mock(IntentModelSource.class);
        when(source.load()).thenReturn(model);
        when(source.describe()).thenReturn("test model");
        return new IntentClassifier(source);
    }

    @Nested
    @DisplayName("Bundled dataset")
    class BundledDataset {

        @Test
        @DisplayName("consultant writing to a dean is advisor_to_institution, not student")
        void consultant_to_dean() throws IOException {
            ClassificationResult result = classifierFor(trained)
                    .classify("I am a consultant advising a college on fee policy, write to the dean");

            assertThat(result.label()).isEqualTo("advisor_to_institution");
            assertThat(result.confidence()).isGreaterThan(0.6);
            assertThat(result.modelVersion()).isEqualTo("intent-v1");
        }

        @Test
        @DisplayName("'write an email' is not confidently classified")
        void vague_request_low_confidence() throws IOException {
            ClassificationResult result = classifierFor(trained).classify("write an email");

            assertThat(result.confidence()).isLessThanOrEqualTo(0.6);
        }

        @Test
        @DisplayName("explicit roles win over mentioned roles")
        void parent_not_student() throws IOException {
            ClassificationResult result = classifierFor(trained).classify(
                    "I am not a student, I am a parent, please write to the teacher about my son's attendance");

            assertThat(result.label()).isEqualTo("parent_to_teacher");
        }

        @Test
        @DisplayName("typical requests map to their intents")
        void typical_requests() throws IOException {
            IntentClassifier classifier = classifierFor(trained);

            assertThat(classifier.classify("write an email to HR asking about the status of my leave application").label())
                    .isEqualTo("employee_to_hr");
            assertThat(classifier.classify("tell my manager the project report will be delayed by two days").label())
                    .isEqualTo("employee_to_manager");
            assertThat(classifier.classify("invite my neighbours to a barbecue this saturday").label())
                    .isEqualTo("general");
        }

        @Test
        @DisplayName("classification is deterministic")
        void deterministic() throws IOException {
            IntentClassifier classifier = classifierFor(trained);
            String text = "ask the school about my exam results";

            assertThat(classifier.classify(text)).isEqualTo(classifier.classify(text));
        }
    }

    @Nested
    @DisplayName("Degraded model")
    class Degraded {

        @Test
        @DisplayName("missing artifact degrades to general/0.0")
        void missing_artifact() {
            IntentClassifier classifier = new IntentClassifier(new ArtifactIntentModelSource(
                    new FileSystemResource("/nonexistent/intent-model.json"), new ObjectMapper()));

            ClassificationResult result = classifier.classify("write to my manager about the report");

            assertThat(result).isEqualTo(ClassificationResult.fallback());
            assertThat(result.label()).isEqualTo("general");
            assertThat(result.confidence()).isZero();
        }

        @Test
        @DisplayName("a failed load is not retried")
        void failed_load_memoized() throws IOException {
            IntentModelSource source = mock(IntentModelSource.class);
            when(source.load()).thenThrow(new IOException("disk gone"));
            when(source.describe()).thenReturn("broken");
            IntentClassifier classifier = new IntentClassifier(source);

            classifier.classify("first request text");
            classifier.classify("second request text");

            verify(source, times(1)).load();
        }
    }

    @Test
    @DisplayName("concurrent first callers share one load")
    void single_flight_load() throws Exception {
        IntentModelSource source = mock(IntentModelSource.class);
        when(source.describe()).thenReturn("slow model");
        when(source.load()).thenAnswer(invocation -> {
            Thread.sleep(200);
            return trained;
        });
        IntentClassifier classifier = new IntentClassifier(source);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ClassificationResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return classifier.classify("tell my manager the project report will be delayed by two days");
                }));
            }
            start.countDown();

            for (Future<ClassificationResult> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS).label()).isEqualTo("employee_to_manager");
            }
        } finally {
            executor.shutdownNow();
        }

        verify(source, times(1)).load();
    }
}
