package com.eainde.augury.session;

import com.eainde.augury.conversation.ConversationContext;
import com.eainde.augury.conversation.ConversationEngine;
import com.eainde.augury.conversation.ConversationSettings;
import com.eainde.augury.conversation.ModificationResult;
import com.eainde.augury.conversation.TurnReply;
import com.eainde.augury.error.InputValidationException;
import com.eainde.augury.error.SessionNotFoundException;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.UserInput;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Session control surface: start, submit a turn, modify a field, abandon.
 *
 * <p>Sessions live in memory. Calls on one session are serialized by that session's lock;
 * different sessions proceed in parallel. Every call runs with {@code sessionId} in the MDC.</p>
 */
@Log4j2
@Service
public class SessionService {

    static final String MDC_SESSION_ID = "sessionId";

    private final Map<String, ConversationContext> sessions = new ConcurrentHashMap<>();
    private final ConversationEngine engine;
    private final ConversationSettings settings;
    private final Clock clock;
    private final Duration idleTimeout;

    @Autowired
    public SessionService(ConversationEngine engine, ConversationSettings settings,
                          @Value("${augury.session.idle-timeout:30m}") Duration idleTimeout) {
        this(engine, settings, Clock.systemDefaultZone(), idleTimeout);
    }

    SessionService(ConversationEngine engine, ConversationSettings settings, Clock clock, Duration idleTimeout) {
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        this.engine = engine;
        this.settings = settings;
        this.clock = clock;
        this.idleTimeout = idleTimeout;
    }

    /**
     * Opens a session for a question. The category is pre-filled when the question names one clearly.
     *
     * @throws InputValidationException if the question is blank
     */
    public SessionStarted startSession(String question) {
        if (question == null || question.isBlank()) {
            throw new InputValidationException(FieldNames.QUESTION_TEXT, "question must not be blank");
        }
        String sessionId = UUID.randomUUID().toString();

        Map<String, Object> initial = new LinkedHashMap<>();
        initial.put(FieldNames.QUESTION_TEXT, question.trim());
        initial.put(FieldNames.INQUIRY_TIME, LocalDateTime.now(clock).withNano(0).toString());
        QuestionCategory.detect(question).ifPresent(c -> initial.put(FieldNames.QUESTION_CATEGORY, c.key()));

        ConversationContext context = new ConversationContext(sessionId, UserInput.of(initial), settings.maxHistory());
        context.setLastActivity(clock.instant());
        sessions.put(sessionId, context);
        TurnReply opening = withSession(sessionId, engine::start);
        log.info("Started session {} ({} active)", sessionId, sessions.size());
        return new SessionStarted(sessionId, opening);
    }

    public TurnReply submitTurn(String sessionId, String text) {
        return withSession(sessionId, context -> engine.handleTurn(context, text));
    }

    /**
     * @throws InputValidationException if the field is unknown or the value does not validate
     */
    public ModificationResult modifyField(String sessionId, String field, Object value) {
        return withSession(sessionId, context -> engine.modify(context, field, value));
    }

    /** Discards the session and everything computed for it. */
    public void abandonSession(String sessionId) {
        withSession(sessionId, context -> {
            context.discard();
            sessions.remove(sessionId);
            return null;
        });
        log.info("Abandoned session {} ({} active)", sessionId, sessions.size());
    }

    /**
     * Discards sessions with no call for longer than the idle timeout.
     *
     * @return number of sessions evicted
     */
    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        for (ConversationContext context : sessions.values()) {
            if (context.getLastActivity().isBefore(cutoff) && evict(context, cutoff)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle session(s) ({} active)", evicted, sessions.size());
        }
        return evicted;
    }

    @Scheduled(fixedDelayString = "${augury.session.sweep-interval:PT5M}")
    void sweepIdleSessions() {
        evictIdleSessions();
    }

    private boolean evict(ConversationContext context, Instant cutoff) {
        ReentrantLock lock = context.lock();
        // A session busy with a call is not idle
        if (!lock.tryLock()) {
            return false;
        }
        try {
            if (context.isAbandoned() || !context.getLastActivity().isBefore(cutoff)) {
                return false;
            }
            context.discard();
            sessions.remove(context.getSessionId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ConversationContext> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int activeSessions() {
        return sessions.size();
    }

    private <T> T withSession(String sessionId, Function<ConversationContext, T> action) {
        ConversationContext context = sessions.get(sessionId);
        if (context == null) {
            throw new SessionNotFoundException(sessionId);
        }
        ReentrantLock lock = context.lock();
        lock.lock();
        MDC.put(MDC_SESSION_ID, sessionId);
        try {
            // Abandoned while this call waited for the lock
            if (context.isAbandoned()) {
                throw new SessionNotFoundException(sessionId);
            }
            T result = action.apply(context);
            if (context.getStage().isTerminal()) {
                sessions.remove(sessionId);
                log.info("Session {} completed ({} active)", sessionId, sessions.size());
            }
            return result;
        } finally {
            context.setLastActivity(clock.instant());
            MDC.remove(MDC_SESSION_ID);
            lock.unlock();
        }
    }
}
