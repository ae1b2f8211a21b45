package com.eainde.augury.analysis;

import com.eainde.augury.error.CalculationException;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryRegistry;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.UserInput;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs theories concurrently and joins them before anything downstream sees a result.
 *
 * <p>A failing, slow or misbehaving runner only removes its own theory from the batch.</p>
 */
@Log4j2
@Component
public class TheoryExecutor {

    private final TheoryRegistry registry;
    private final Executor executor;
    private final ExecutionSettings settings;

    public TheoryExecutor(TheoryRegistry registry,
                          @Qualifier("theoryPool") Executor executor,
                          ExecutionSettings settings) {
        this.registry = registry;
        this.executor = executor;
        this.settings = settings;
    }

    public TheoryExecution execute(List<TheoryDescriptor> descriptors, UserInput input) {
        Map<String, CompletableFuture<TheoryResult>> futures = new LinkedHashMap<>();
        for (TheoryDescriptor descriptor : descriptors) {
            futures.put(descriptor.getName(), CompletableFuture
                    .supplyAsync(() -> runOne(descriptor, input), executor)
                    .orTimeout(settings.runTimeout().toMillis(), TimeUnit.MILLISECONDS));
        }

        // Join point: every run has finished or failed before results are collected
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                .exceptionally(ex -> null)
                .join();

        List<TheoryResult> results = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        futures.forEach((name, future) -> {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                String reason = reason(e.getCause() == null ? e : e.getCause());
                log.warn("Dropping theory {}: {}", name, reason);
                failures.put(name, reason);
            }
        });

        log.info("Executed {} theories: {} succeeded, {} dropped", descriptors.size(), results.size(), failures.size());
        return new TheoryExecution(results, failures);
    }

    /**
     * Runs one theory on the calling thread.
     *
     * @throws CalculationException when the runner fails or returns a result for another theory
     */
    public TheoryResult runOne(TheoryDescriptor descriptor, UserInput input) {
        String name = descriptor.getName();
        long start = System.currentTimeMillis();
        TheoryResult result;
        try {
            result = registry.runnerFor(name).run(descriptor, input);
        } catch (CalculationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CalculationException(name, "runner failed: " + e.getMessage(), e);
        }
        if (result == null || !name.equals(result.theoryName())) {
            throw new CalculationException(name, "runner returned a result for "
                    + (result == null ? "nothing" : result.theoryName()));
        }
        log.debug("Theory {} finished in {}ms: {} (level {}, confidence {})", name,
                System.currentTimeMillis() - start, result.judgment(), result.level(), result.confidence());
        return result;
    }

    private static String reason(Throwable error) {
        if (error instanceof TimeoutException) {
            return "timed out";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
