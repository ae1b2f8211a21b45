package com.eainde.augury.extraction;

import com.eainde.augury.conversation.ConversationStage;
import com.eainde.augury.error.ExtractionException;
import com.eainde.augury.error.ExtractionProviderException;
import com.eainde.augury.error.ExtractionTimeoutException;
import com.eainde.augury.theory.UserInput;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds a delegate extractor by a timeout. The caller blocks until the delegate answers,
 * fails or runs out of time. On timeout the worker is interrupted and a late answer is discarded.
 */
@Slf4j
public class TimedFieldExtractor implements FieldExtractor {

    private final FieldExtractor delegate;
    private final Executor executor;
    private final Duration timeout;

    public TimedFieldExtractor(FieldExtractor delegate, Executor executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public Map<String, Object> extract(ConversationStage stage, String text, UserInput known) {
        // FutureTask, unlike CompletableFuture, interrupts the worker on cancel
        FutureTask<Map<String, Object>> task = new FutureTask<>(() -> delegate.extract(stage, text, known));
        executor.execute(task);
        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Extraction for stage {} timed out after {}; worker interrupted", stage, timeout);
            throw new ExtractionTimeoutException(stage.name(), timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionProviderException(stage.name(), "Interrupted while waiting for extraction", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ExtractionException extraction) {
                throw extraction;
            }
            throw new ExtractionProviderException(stage.name(), "Extraction failed: " + e.getCause(), e.getCause());
        }
    }
}
