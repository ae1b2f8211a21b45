package com.eainde.augury.verification;

import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the verification round after the initial resolution.
 *
 * <p>Always exactly {@value #QUESTION_COUNT} questions. They target the most confident theories,
 * best first, cycling through them when fewer than three results exist. A theory's own
 * retrospective claims are asked before the category templates; no question text repeats.</p>
 */
@Log4j2
@Component
public class VerificationQuestionGenerator {

    public static final int QUESTION_COUNT = 3;

    public List<VerificationQuestion> generate(List<TheoryResult> results, QuestionCategory category) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Verification needs at least one theory result");
        }

        List<TheoryResult> targets = new ArrayList<>(results);
        // Stable: equal confidence keeps execution order
        targets.sort(Comparator.comparingDouble(TheoryResult::confidence).reversed());
        if (targets.size() > QUESTION_COUNT) {
            targets = targets.subList(0, QUESTION_COUNT);
        }

        Map<String, List<RetrospectiveClaim>> pools = new LinkedHashMap<>();
        for (TheoryResult target : targets) {
            List<RetrospectiveClaim> pool = new ArrayList<>(target.claims());
            pool.addAll(QuestionTemplates.claimsFor(category, target));
            pools.put(target.theoryName(), pool);
        }

        List<VerificationQuestion> questions = new ArrayList<>();
        Set<String> asked = new HashSet<>();
        int cursor = 0;
        while (questions.size() < QUESTION_COUNT) {
            TheoryResult target = targets.get(cursor % targets.size());
            cursor++;
            RetrospectiveClaim claim = nextClaim(pools.get(target.theoryName()), asked);
            if (claim == null) {
                // Every template already asked: allow a repeat rather than return fewer questions
                claim = pools.get(target.theoryName()).get(0);
            }
            asked.add(claim.question());
            questions.add(VerificationQuestion.of(questions.size() + 1, target.theoryName(), claim));
        }

        log.info("Generated {} verification questions for theories {}", questions.size(),
                questions.stream().map(VerificationQuestion::theoryName).toList());
        return questions;
    }

    private static RetrospectiveClaim nextClaim(List<RetrospectiveClaim> pool, Set<String> asked) {
        for (RetrospectiveClaim claim : pool) {
            if (!asked.contains(claim.question())) {
                return claim;
            }
        }
        return null;
    }
}
