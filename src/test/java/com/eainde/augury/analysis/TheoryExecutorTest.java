package com.eainde.augury.analysis;

import com.eainde.augury.error.CalculationException;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryNames;
import com.eainde.augury.theory.TheoryRegistry;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.TheoryRunner;
import com.eainde.augury.theory.UserInput;
import com.eainde.augury.theory.runner.MeihuaRunner;
import com.eainde.augury.thread.MdcAwareExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TheoryExecutorTest {

    @Mock
    private TheoryRunner xiaoliuRunner;

    private static final UserInput INPUT = UserInput.of(Map.of(FieldNames.NUMBERS, List.of(3, 5, 8)));

    private TheoryRegistry registryWithMock() {
        when(xiaoliuRunner.theoryName()).thenReturn(TheoryNames.XIAOLIU);
        return new TheoryRegistry(List.of(xiaoliuRunner, new MeihuaRunner()));
    }

    private static List<TheoryDescriptor> fastTier(TheoryRegistry registry) {
        return List.of(registry.descriptor(TheoryNames.XIAOLIU), registry.descriptor(TheoryNames.MEIHUA));
    }

    // =========================================================================
    //  Failure isolation
    // =========================================================================

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("should drop a failing runner and keep the others")
        void failingRunner() {
            TheoryRegistry registry = registryWithMock();
            when(xiaoliuRunner.run(any(), any())).thenThrow(new IllegalStateException("boom"));
            TheoryExecutor executor = new TheoryExecutor(registry, Runnable::run, ExecutionSettings.defaults());

            TheoryExecution execution = executor.execute(fastTier(registry), INPUT);

            assertThat(execution.results()).extracting(TheoryResult::theoryName).containsExactly(TheoryNames.MEIHUA);
            assertThat(execution.failures()).containsOnlyKeys(TheoryNames.XIAOLIU);
            assertThat(execution.failures().get(TheoryNames.XIAOLIU)).contains("boom");
        }

        @Test
        @DisplayName("should reject a result labelled with another theory")
        void mislabelledResult() {
            TheoryRegistry registry = registryWithMock();
            when(xiaoliuRunner.run(any(), any())).thenReturn(TheoryResult.of(TheoryNames.BAZI, 0.5, 0.5, ""));
            TheoryExecutor executor = new TheoryExecutor(registry, Runnable::run, ExecutionSettings.defaults());

            assertThatThrownBy(() -> executor.runOne(registry.descriptor(TheoryNames.XIAOLIU), INPUT))
                    .isInstanceOf(CalculationException.class)
                    .hasMessageContaining(TheoryNames.BAZI);
        }

        @Test
        @DisplayName("should drop a run that exceeds the timeout")
        void slowRunner() throws InterruptedException {
            TheoryRegistry registry = registryWithMock();
            lenient().when(xiaoliuRunner.run(any(), any())).thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return TheoryResult.of(TheoryNames.XIAOLIU, 0.5, 0.5, "late");
            });
            MdcAwareExecutor pool = new MdcAwareExecutor("test-theory", 2);
            try {
                TheoryExecutor executor = new TheoryExecutor(registry, pool,
                        new ExecutionSettings(2, Duration.ofMillis(100)));

                TheoryExecution execution = executor.execute(fastTier(registry), INPUT);

                assertThat(execution.failures()).containsEntry(TheoryNames.XIAOLIU, "timed out");
                assertThat(execution.results()).hasSize(1);
            } finally {
                pool.shutdown();
            }
        }
    }

    @Test
    @DisplayName("should keep submission order of successful results")
    void submissionOrder() {
        TheoryRegistry registry = AnalysisFixtures.registry();
        TheoryExecutor executor = new TheoryExecutor(registry, Runnable::run, ExecutionSettings.defaults());

        TheoryExecution execution = executor.execute(fastTier(registry), INPUT);

        assertThat(execution.results()).extracting(TheoryResult::theoryName)
                .containsExactly(TheoryNames.XIAOLIU, TheoryNames.MEIHUA);
        assertThat(execution.failures()).isEmpty();
    }
}
