package com.eainde.augury.extraction;

import com.eainde.augury.conversation.ConversationStage;
import com.eainde.augury.error.ExtractionParseException;
import com.eainde.augury.error.ExtractionProviderException;
import com.eainde.augury.error.ExtractionTimeoutException;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.UserInput;
import com.eainde.augury.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimedFieldExtractorTest {

    private MdcAwareExecutor pool;

    @BeforeEach
    void setUp() {
        pool = new MdcAwareExecutor("test-extraction", 2);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdown();
    }

    @Test
    @DisplayName("should return the delegate's answer within the timeout")
    void inTime() {
        FieldExtractor delegate = (stage, text, known) -> Map.of(FieldNames.GENDER, "male");
        TimedFieldExtractor extractor = new TimedFieldExtractor(delegate, pool, Duration.ofSeconds(2));

        assertThat(extractor.extract(ConversationStage.COLLECT, "male", UserInput.empty()))
                .containsEntry(FieldNames.GENDER, "male");
    }

    @Test
    @DisplayName("should give up after the timeout")
    void tooSlow() {
        FieldExtractor delegate = (stage, text, known) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Map.of();
        };
        TimedFieldExtractor extractor = new TimedFieldExtractor(delegate, pool, Duration.ofMillis(50));

        assertThatThrownBy(() -> extractor.extract(ConversationStage.COLLECT, "text", UserInput.empty()))
                .isInstanceOf(ExtractionTimeoutException.class);
    }

    @Test
    @DisplayName("should interrupt the worker that ran out of time")
    void interruptsWorker() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        FieldExtractor delegate = (stage, text, known) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return Map.of();
        };
        TimedFieldExtractor extractor = new TimedFieldExtractor(delegate, pool, Duration.ofMillis(50));

        assertThatThrownBy(() -> extractor.extract(ConversationStage.COLLECT, "text", UserInput.empty()))
                .isInstanceOf(ExtractionTimeoutException.class);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("should rethrow extraction errors unchanged and wrap everything else")
    void failures() {
        TimedFieldExtractor parseFailure = new TimedFieldExtractor((stage, text, known) -> {
            throw new ExtractionParseException(stage.name(), "bad json", null);
        }, pool, Duration.ofSeconds(2));
        TimedFieldExtractor crash = new TimedFieldExtractor((stage, text, known) -> {
            throw new IllegalStateException("boom");
        }, pool, Duration.ofSeconds(2));

        assertThatThrownBy(() -> parseFailure.extract(ConversationStage.COLLECT, "text", UserInput.empty()))
                .isInstanceOf(ExtractionParseException.class);
        assertThatThrownBy(() -> crash.extract(ConversationStage.COLLECT, "text", UserInput.empty()))
                .isInstanceOf(ExtractionProviderException.class)
                .hasMessageContaining("boom");
    }
}
