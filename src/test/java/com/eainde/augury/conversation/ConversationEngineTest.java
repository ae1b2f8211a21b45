package com.eainde.augury.conversation;

import com.eainde.augury.analysis.AnalysisFixtures;
import com.eainde.augury.conversation.TurnReply.ReplyType;
import com.eainde.augury.extraction.DeterministicOnlyExtractor;
import com.eainde.augury.report.ComprehensiveReport;
import com.eainde.augury.report.ReportAdvisor;
import com.eainde.augury.report.ReportAssembler;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.TheoryRegistry;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.UserInput;
import com.eainde.augury.verification.AnswerClassifier;
import com.eainde.augury.verification.ConfidenceAdjuster;
import com.eainde.augury.verification.VerificationQuestionGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class ConversationEngineTest {

    @Mock
    private ObjectProvider<ChatModel> noChatModel;

    private TheoryRegistry registry;
    private ConversationEngine engine;
    private ConversationContext context;

    @BeforeEach
    void setUp() {
        registry = AnalysisFixtures.registry();
        engine = new ConversationEngine(
                new FlowGuard(new DeterministicOnlyExtractor(), registry, ConversationSettings.defaults()),
                new ModificationDetector(),
                AnalysisFixtures.analysisService(registry),
                new VerificationQuestionGenerator(),
                new AnswerClassifier(),
                new ConfidenceAdjuster(),
                new ReportAssembler(),
                new ReportAdvisor(noChatModel, new ObjectMapper()));
        context = new ConversationContext("session-1", UserInput.of(Map.of(
                FieldNames.QUESTION_TEXT, "Should I take the new job?",
                FieldNames.INQUIRY_TIME, "2024-03-05T10:15:00")), 100);
    }

    private void reachVerification() {
        engine.start(context);
        engine.handleTurn(context, "career, 3 5 8");
        engine.handleTurn(context, "I have two job offers and cannot decide which to take. My character is 福");
        engine.handleTurn(context, "born 1990-05-12 at 14:30, female");
    }

    // =========================================================================
    //  Collecting stages
    // =========================================================================

    @Nested
    @DisplayName("Collecting stages")
    class Collecting {

        @Test
        @DisplayName("should open with the icebreaker prompt")
        void start() {
            TurnReply reply = engine.start(context);

            assertThat(reply.type()).isEqualTo(ReplyType.PROMPT);
            assertThat(reply.stage()).isEqualTo(ConversationStage.ICEBREAK);
            assertThat(reply.message()).startsWith("Welcome.");
        }

        @Test
        @DisplayName("should list what is missing and stay in the stage")
        void missing() {
            engine.start(context);

            TurnReply reply = engine.handleTurn(context, "it's about my career");

            assertThat(reply.type()).isEqualTo(ReplyType.MISSING_FIELDS);
            assertThat(reply.stage()).isEqualTo(ConversationStage.ICEBREAK);
            assertThat(reply.missingFields()).containsExactly(FieldNames.NUMBERS);
            assertThat(reply.progress().percent()).isEqualTo(50);
        }

        @Test
        @DisplayName("should give a quick reading when a stage completes")
        void quickReading() {
            engine.start(context);

            TurnReply reply = engine.handleTurn(context, "career, 3 5 8");

            assertThat(reply.stage()).isEqualTo(ConversationStage.DEEPEN);
            assertThat(reply.message()).contains("Quick reading from");
            assertThat(context.getPreliminaryPass()).isNotNull();
        }

        @Test
        @DisplayName("should run the full pass and ask the first verification question after collection")
        void fullPass() {
            reachVerification();

            assertThat(context.getStage()).isEqualTo(ConversationStage.VERIFY);
            assertThat(context.getInitialPass()).isNotNull();
            assertThat(context.getQuestions()).hasSize(VerificationQuestionGenerator.QUESTION_COUNT);
            assertThat(context.getInput().getInt(FieldNames.BIRTH_HOUR)).contains(14);
        }

        @Test
        @DisplayName("should refuse turns before the session is started")
        void notStarted() {
            assertThatThrownBy(() -> engine.handleTurn(context, "hello"))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    // =========================================================================
    //  Verification, report and Q&A
    // =========================================================================

    @Nested
    @DisplayName("Report and Q&A")
    class ReportAndQa {

        @BeforeEach
        void setUp() {
            reachVerification();
        }

        @Test
        @DisplayName("should publish the report after the third answer")
        void report() {
            TurnReply first = engine.handleTurn(context, "yes");
            TurnReply second = engine.handleTurn(context, "no");
            TurnReply third = engine.handleTurn(context, "I don't know");

            assertThat(first.type()).isEqualTo(ReplyType.PROMPT);
            assertThat(second.message()).contains("3. ");
            assertThat(third.type()).isEqualTo(ReplyType.FINAL_REPORT);
            assertThat(third.stage()).isEqualTo(ConversationStage.QA);
            assertThat(third.report().verification()).hasSize(3);
            assertThat(third.message()).contains("=== Reading for: Should I take the new job? ===");
        }

        @Test
        @DisplayName("should mark the report stale after a modification and refresh it on request")
        void modificationAfterReport() {
            answerAll();

            TurnReply modified = engine.handleTurn(context, "change my birth year to 1991");
            assertThat(modified.type()).isEqualTo(ReplyType.PROMPT);
            assertThat(modified.message()).contains("report");
            assertThat(context.isReportStale()).isTrue();

            TurnReply refreshed = engine.handleTurn(context, "show me the report");
            assertThat(refreshed.type()).isEqualTo(ReplyType.FINAL_REPORT);
            assertThat(refreshed.stage()).isEqualTo(ConversationStage.QA);
            assertThat(context.isReportStale()).isFalse();
            assertThat(context.getInput().getInt(FieldNames.BIRTH_YEAR)).contains(1991);
        }

        @Test
        @DisplayName("should answer questions about the report and close on goodbye")
        void qaAndClose() {
            answerAll();

            TurnReply answer = engine.handleTurn(context, "How confident are these readings?");
            TurnReply closed = engine.handleTurn(context, "bye");
            TurnReply afterClose = engine.handleTurn(context, "one more thing");

            assertThat(answer.type()).isEqualTo(ReplyType.PROMPT);
            assertThat(answer.message()).isNotBlank();
            assertThat(closed.type()).isEqualTo(ReplyType.CLOSED);
            assertThat(context.getStage()).isEqualTo(ConversationStage.COMPLETED);
            assertThat(afterClose.type()).isEqualTo(ReplyType.CLOSED);
        }

        @Test
        @DisplayName("should recompute invalidated readings when a field changes during verification")
        void modificationDuringVerification() {
            ModificationResult modified = engine.modify(context, FieldNames.BIRTH_YEAR, 1975);

            assertThat(modified.invalidated()).isNotEmpty();
            assertThat(context.getInitialPass().results()).extracting(TheoryResult::theoryName)
                    .doesNotContainAnyElementsOf(context.staleTheories());
            assertThat(context.getQuestions()).hasSize(VerificationQuestionGenerator.QUESTION_COUNT);

            answerAll();

            ComprehensiveReport report = context.getReport();
            assertThat(report).isNotNull();
            List<TheoryResult> recomputed = report.results().stream()
                    .filter(r -> modified.invalidated().contains(r.theoryName()))
                    .toList();
            assertThat(recomputed).isNotEmpty();
            for (TheoryResult result : recomputed) {
                TheoryResult fresh = registry.runnerFor(result.theoryName())
                        .run(registry.descriptor(result.theoryName()), context.getInput());
                assertThat(result.level()).as(result.theoryName()).isEqualTo(fresh.level());
            }
            assertThat(context.getInput().getInt(FieldNames.BIRTH_YEAR)).contains(1975);
        }

        private void answerAll() {
            engine.handleTurn(context, "yes");
            engine.handleTurn(context, "no");
            engine.handleTurn(context, "about the same");
        }
    }

    @Test
    @DisplayName("should keep the conversation history in order")
    void history() {
        engine.start(context);
        engine.handleTurn(context, "career, 3 5 8");

        assertThat(context.history()).extracting(HistoryEntry::role)
                .containsExactly(HistoryEntry.Role.SYSTEM, HistoryEntry.Role.USER, HistoryEntry.Role.SYSTEM);
    }
}
