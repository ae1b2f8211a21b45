package com.eainde.augury.session;

import com.eainde.augury.conversation.ConversationContext;
import com.eainde.augury.conversation.ConversationEngine;
import com.eainde.augury.conversation.ConversationSettings;
import com.eainde.augury.conversation.ConversationStage;
import com.eainde.augury.conversation.ModificationResult;
import com.eainde.augury.conversation.TurnReply;
import com.eainde.augury.error.InputValidationException;
import com.eainde.augury.error.SessionNotFoundException;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.QuestionCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final Duration IDLE_TIMEOUT = Duration.ofMinutes(30);

    @Mock
    private ConversationEngine engine;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-05T10:15:00Z"));

    private SessionService service;

    @BeforeEach
    void setUp() {
        service = new SessionService(engine, ConversationSettings.defaults(), clock, IDLE_TIMEOUT);
        lenient().when(engine.start(any())).thenReturn(TurnReply.prompt(ConversationStage.ICEBREAK, "Welcome."));
    }

    // =========================================================================
    //  Start
    // =========================================================================

    @Nested
    @DisplayName("Start")
    class Start {

        @Test
        @DisplayName("should reject a blank question without touching the engine")
        void blankQuestion() {
            assertThatThrownBy(() -> service.startSession("   "))
                    .isInstanceOf(InputValidationException.class)
                    .hasMessageContaining(FieldNames.QUESTION_TEXT);
            assertThatThrownBy(() -> service.startSession(null))
                    .isInstanceOf(InputValidationException.class);

            verifyNoInteractions(engine);
            assertThat(service.activeSessions()).isZero();
        }

        @Test
        @DisplayName("should seed question, inquiry time and detected category")
        void seedsInput() {
            SessionStarted started = service.startSession("  How will my career go at work this year?  ");

            ArgumentCaptor<ConversationContext> captor = ArgumentCaptor.forClass(ConversationContext.class);
            verify(engine).start(captor.capture());
            ConversationContext context = captor.getValue();

            assertThat(started.sessionId()).isEqualTo(context.getSessionId());
            assertThat(started.reply().message()).isEqualTo("Welcome.");
            assertThat(context.getInput().getString(FieldNames.QUESTION_TEXT))
                    .contains("How will my career go at work this year?");
            assertThat(context.getInput().getString(FieldNames.INQUIRY_TIME)).contains("2024-03-05T10:15");
            assertThat(context.category()).isEqualTo(QuestionCategory.CAREER);
            assertThat(service.find(started.sessionId())).containsSame(context);
        }

        @Test
        @DisplayName("should leave the category open when the question names none")
        void noCategory() {
            SessionStarted started = service.startSession("What does the future hold?");

            ConversationContext context = service.find(started.sessionId()).orElseThrow();
            assertThat(context.getInput().has(FieldNames.QUESTION_CATEGORY)).isFalse();
        }

        @Test
        @DisplayName("should give every session its own id")
        void distinctIds() {
            String first = service.startSession("Should I change my job?").sessionId();
            String second = service.startSession("Should I change my job?").sessionId();

            assertThat(first).isNotEqualTo(second);
            assertThat(service.activeSessions()).isEqualTo(2);
        }
    }

    // =========================================================================
    //  Turns and modifications
    // =========================================================================

    @Nested
    @DisplayName("Turns and modifications")
    class Turns {

        @Test
        @DisplayName("should route a turn to the session's context with the session id in the MDC")
        void submitTurn() {
            String sessionId = service.startSession("Should I change my job?").sessionId();
            AtomicReference<String> mdcDuringTurn = new AtomicReference<>();
            when(engine.handleTurn(any(), eq("3 5 8"))).thenAnswer(invocation -> {
                mdcDuringTurn.set(MDC.get(SessionService.MDC_SESSION_ID));
                return TurnReply.prompt(ConversationStage.ICEBREAK, "Thanks.");
            });

            TurnReply reply = service.submitTurn(sessionId, "3 5 8");

            assertThat(reply.message()).isEqualTo("Thanks.");
            assertThat(mdcDuringTurn.get()).isEqualTo(sessionId);
            assertThat(MDC.get(SessionService.MDC_SESSION_ID)).isNull();
        }

        @Test
        @DisplayName("should fail for an unknown session")
        void unknownSession() {
            assertThatThrownBy(() -> service.submitTurn("missing", "hello"))
                    .isInstanceOf(SessionNotFoundException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("should pass modifications through and propagate validation errors")
        void modifyField() {
            String sessionId = service.startSession("Should I change my job?").sessionId();
            ModificationResult result = new ModificationResult(FieldNames.BIRTH_YEAR, 1990, 1991,
                    List.of("bazi"), ConversationStage.VERIFY);
            when(engine.modify(any(), eq(FieldNames.BIRTH_YEAR), eq(1991))).thenReturn(result);
            when(engine.modify(any(), eq(FieldNames.BIRTH_MONTH), any()))
                    .thenThrow(new InputValidationException(FieldNames.BIRTH_MONTH, "must be between 1 and 12"));

            assertThat(service.modifyField(sessionId, FieldNames.BIRTH_YEAR, 1991)).isSameAs(result);
            assertThatThrownBy(() -> service.modifyField(sessionId, FieldNames.BIRTH_MONTH, 13))
                    .isInstanceOf(InputValidationException.class);
        }
    }

    // =========================================================================
    //  Abandon
    // =========================================================================

    @Nested
    @DisplayName("Abandon")
    class Abandon {

        @Test
        @DisplayName("should discard the context and forget the session")
        void abandon() {
            String sessionId = service.startSession("Should I change my job?").sessionId();
            ConversationContext context = service.find(sessionId).orElseThrow();

            service.abandonSession(sessionId);

            assertThat(context.isAbandoned()).isTrue();
            assertThat(service.find(sessionId)).isEmpty();
            assertThat(service.activeSessions()).isZero();
            assertThatThrownBy(() -> service.submitTurn(sessionId, "hello"))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        @DisplayName("should fail to abandon an unknown session")
        void abandonUnknown() {
            assertThatThrownBy(() -> service.abandonSession("missing"))
                    .isInstanceOf(SessionNotFoundException.class);
            verify(engine, never()).handleTurn(any(), anyString());
        }
    }

    // =========================================================================
    //  Lifetime
    // =========================================================================

    @Nested
    @DisplayName("Lifetime")
    class Lifetime {

        @Test
        @DisplayName("should forget a session once its conversation has ended")
        void completedSessionIsRemoved() {
            String sessionId = service.startSession("Should I change my job?").sessionId();
            when(engine.handleTurn(any(), eq("bye"))).thenAnswer(invocation -> {
                ConversationContext context = invocation.getArgument(0);
                context.setStage(ConversationStage.COMPLETED);
                return TurnReply.closed("Take care.");
            });

            TurnReply reply = service.submitTurn(sessionId, "bye");

            assertThat(reply.type()).isEqualTo(TurnReply.ReplyType.CLOSED);
            assertThat(service.find(sessionId)).isEmpty();
            assertThat(service.activeSessions()).isZero();
        }

        @Test
        @DisplayName("should evict sessions idle for longer than the timeout")
        void idleSessionIsEvicted() {
            String sessionId = service.startSession("Should I change my job?").sessionId();
            ConversationContext context = service.find(sessionId).orElseThrow();

            clock.advance(IDLE_TIMEOUT.plusMinutes(1));

            assertThat(service.evictIdleSessions()).isEqualTo(1);
            assertThat(service.find(sessionId)).isEmpty();
            assertThat(context.isAbandoned()).isTrue();
            assertThatThrownBy(() -> service.submitTurn(sessionId, "hello"))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        @DisplayName("should measure idleness from the last call")
        void activityKeepsSessionAlive() {
            String sessionId = service.startSession("Should I change my job?").sessionId();
            when(engine.handleTurn(any(), eq("3 5 8")))
                    .thenReturn(TurnReply.prompt(ConversationStage.ICEBREAK, "Thanks."));

            clock.advance(Duration.ofMinutes(20));
            service.submitTurn(sessionId, "3 5 8");
            clock.advance(Duration.ofMinutes(20));

            assertThat(service.evictIdleSessions()).isZero();
            assertThat(service.find(sessionId)).isPresent();
        }

        @Test
        @DisplayName("should reject a non-positive idle timeout")
        void invalidTimeout() {
            assertThatThrownBy(() -> new SessionService(engine, ConversationSettings.defaults(), clock, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
