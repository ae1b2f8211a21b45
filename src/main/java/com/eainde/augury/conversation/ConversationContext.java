package com.eainde.augury.conversation;

import com.eainde.augury.analysis.AnalysisPass;
import com.eainde.augury.conflict.ConflictResolution;
import com.eainde.augury.report.ComprehensiveReport;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.UserInput;
import com.eainde.augury.verification.ConfidenceAdjustment;
import com.eainde.augury.verification.VerificationQuestion;
import com.eainde.augury.verification.VerificationRecord;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one session.
 *
 * <p>Owned by a single session and mutated only by the {@link FlowGuard} and the
 * {@link ConversationEngine} while the session lock is held. Analysis artifacts held here are
 * immutable; a new pass replaces them rather than changing them.</p>
 */
@Getter
public class ConversationContext {

    private final String sessionId;
    private final Instant createdAt;
    private final int maxHistory;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    @Setter
    private ConversationStage stage = ConversationStage.INIT;

    @Setter
    private UserInput input;

    @Getter(AccessLevel.NONE)
    private final Set<ConversationStage> completedStages = EnumSet.noneOf(ConversationStage.class);

    @Getter(AccessLevel.NONE)
    private final Map<ConversationStage, Integer> retries = new EnumMap<>(ConversationStage.class);

    @Getter(AccessLevel.NONE)
    private final Deque<HistoryEntry> history = new ArrayDeque<>();

    // ── Analysis ──

    @Getter(AccessLevel.NONE)
    private final Map<String, TheoryResult> cachedResults = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    private final Set<String> staleTheories = new LinkedHashSet<>();

    @Setter
    private AnalysisPass preliminaryPass;

    @Setter
    private AnalysisPass initialPass;

    @Setter
    private ConflictResolution finalResolution;

    // ── Verification ──

    @Setter
    private List<VerificationQuestion> questions = List.of();

    @Getter(AccessLevel.NONE)
    private final List<VerificationRecord> records = new ArrayList<>();

    @Setter
    private List<ConfidenceAdjustment> adjustments = List.of();

    // ── Report ──

    @Setter
    private ComprehensiveReport report;

    @Setter
    private boolean reportStale;

    private boolean abandoned;

    /** Last time a call on this session finished; drives idle eviction. */
    @Setter
    private Instant lastActivity;

    public ConversationContext(String sessionId, UserInput input, int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive");
        }
        this.sessionId = sessionId;
        this.input = input;
        this.maxHistory = maxHistory;
        this.createdAt = Instant.now();
        this.lastActivity = createdAt;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public QuestionCategory category() {
        return QuestionCategory.fromKey(input.getString(FieldNames.QUESTION_CATEGORY).orElse(null));
    }

    // =========================================================================
    //  Stage bookkeeping
    // =========================================================================

    public void markCompleted(ConversationStage completed) {
        completedStages.add(completed);
    }

    public boolean isCompleted(ConversationStage candidate) {
        return completedStages.contains(candidate);
    }

    public Set<ConversationStage> completedStages() {
        return Collections.unmodifiableSet(completedStages);
    }

    public int retries(ConversationStage target) {
        return retries.getOrDefault(target, 0);
    }

    public int incrementRetries(ConversationStage target) {
        return retries.merge(target, 1, Integer::sum);
    }

    public void resetRetries(ConversationStage target) {
        retries.remove(target);
    }

    // =========================================================================
    //  History
    // =========================================================================

    public void addHistory(HistoryEntry.Role role, String text) {
        history.addLast(new HistoryEntry(role, text, Instant.now()));
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
    }

    public List<HistoryEntry> history() {
        return List.copyOf(history);
    }

    // =========================================================================
    //  Result cache
    // =========================================================================

    public Map<String, TheoryResult> cachedResults() {
        return Collections.unmodifiableMap(cachedResults);
    }

    public Set<String> staleTheories() {
        return Collections.unmodifiableSet(staleTheories);
    }

    /** Stores fresh results; a theory re-run in this pass is no longer stale. */
    public void cacheResults(Collection<TheoryResult> results) {
        for (TheoryResult result : results) {
            cachedResults.put(result.theoryName(), result);
            staleTheories.remove(result.theoryName());
        }
    }

    /** Marks cached theories for recomputation; theories never computed are ignored. */
    public Set<String> invalidate(Collection<String> theories) {
        Set<String> invalidated = new LinkedHashSet<>();
        for (String theory : theories) {
            if (cachedResults.containsKey(theory) && staleTheories.add(theory)) {
                invalidated.add(theory);
            }
        }
        return invalidated;
    }

    // =========================================================================
    //  Verification
    // =========================================================================

    public List<VerificationRecord> records() {
        return List.copyOf(records);
    }

    public void addRecord(VerificationRecord record) {
        records.add(record);
    }

    /** Next unanswered question, or null when all are answered. */
    public VerificationQuestion pendingQuestion() {
        return records.size() < questions.size() ? questions.get(records.size()) : null;
    }

    // =========================================================================
    //  Lifecycle
    // =========================================================================

    /** Drops every partial artifact; the context can no longer be used. */
    public void discard() {
        abandoned = true;
        cachedResults.clear();
        staleTheories.clear();
        records.clear();
        preliminaryPass = null;
        initialPass = null;
        finalResolution = null;
        report = null;
    }
}
