package com.eainde.augury.verification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a free-text answer against the expected answer of a verification question.
 *
 * <p>Matching is by meaning rather than by literal text: yes/no synonyms and negation,
 * hedges ("partly", "sort of") downgrade a match to partial, years within one of the expected
 * year count as partial, and free text is scored by keyword overlap.</p>
 */
@Slf4j
@Component
public class AnswerClassifier {

    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");

    private static final List<String> UNKNOWN_PHRASES = List.of(
            "don't know", "dont know", "do not know", "not sure", "no idea", "can't remember", "cannot remember",
            "don't remember", "unsure", "dunno", "can't say", "hard to say");

    private static final List<String> HEDGES = List.of(
            "partly", "partially", "somewhat", "kind of", "sort of", "a bit", "a little", "more or less",
            "in a way", "to some extent", "maybe", "sometimes", "not entirely", "not completely", "half");

    private static final Set<String> YES_WORDS = Set.of(
            "yes", "yeah", "yep", "yup", "correct", "right", "true", "indeed", "definitely", "sure", "exactly",
            "absolutely", "did", "have", "has", "was", "certainly", "accurate");

    private static final Set<String> NO_WORDS = Set.of(
            "no", "nope", "nah", "not", "never", "didn't", "didnt", "haven't", "havent", "hasn't", "wasn't",
            "none", "don't", "dont", "wrong", "false", "incorrect", "inaccurate");

    public FeedbackVerdict classify(VerificationQuestion question, String answer) {
        if (answer == null || answer.isBlank()) {
            return FeedbackVerdict.UNKNOWN;
        }
        String text = answer.trim().toLowerCase(Locale.ROOT);
        if (UNKNOWN_PHRASES.stream().anyMatch(text::contains)) {
            return FeedbackVerdict.UNKNOWN;
        }
        boolean hedged = HEDGES.stream().anyMatch(text::contains);

        FeedbackVerdict verdict = switch (question.shape()) {
            case YES_NO -> yesNo(question, text, hedged);
            case YEAR -> year(question, text);
            case CHOICE -> choice(question, text, hedged);
            case FREE_TEXT -> freeText(question, text, hedged);
        };
        log.debug("Answer '{}' to question {} classified as {}", answer, question.index(), verdict);
        return verdict;
    }

    private FeedbackVerdict yesNo(VerificationQuestion question, String text, boolean hedged) {
        Optional<Boolean> polarity = polarity(text);
        if (polarity.isEmpty()) {
            return hedged ? FeedbackVerdict.PARTIALLY_CONFIRMED : FeedbackVerdict.UNKNOWN;
        }
        boolean expectYes = question.expectedAnswers().stream().anyMatch("yes"::equalsIgnoreCase);
        if (hedged) {
            return FeedbackVerdict.PARTIALLY_CONFIRMED;
        }
        return polarity.get() == expectYes ? FeedbackVerdict.CONFIRMED : FeedbackVerdict.DENIED;
    }

    private FeedbackVerdict year(VerificationQuestion question, String text) {
        Matcher matcher = YEAR.matcher(text);
        if (!matcher.find()) {
            // "no, never happened" rejects the claim without naming a year
            return polarity(text).filter(yes -> !yes).isPresent() ? FeedbackVerdict.DENIED : FeedbackVerdict.UNKNOWN;
        }
        int answered = Integer.parseInt(matcher.group());
        int best = Integer.MAX_VALUE;
        for (String expected : question.expectedAnswers()) {
            try {
                best = Math.min(best, Math.abs(Integer.parseInt(expected.trim()) - answered));
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric expected year '{}' on question {}", expected, question.index());
            }
        }
        if (best == 0) {
            return FeedbackVerdict.CONFIRMED;
        }
        return best == 1 ? FeedbackVerdict.PARTIALLY_CONFIRMED : FeedbackVerdict.DENIED;
    }

    private FeedbackVerdict choice(VerificationQuestion question, String text, boolean hedged) {
        List<String> choices = question.choices();
        int picked = -1;
        int pickedLength = 0;
        for (int i = 0; i < choices.size(); i++) {
            String option = choices.get(i).toLowerCase(Locale.ROOT);
            // Longest matching option wins, so "about the same" beats "same"
            if (text.contains(option) && option.length() > pickedLength) {
                picked = i;
                pickedLength = option.length();
            }
        }
        if (picked < 0) {
            picked = synonymChoice(choices, text);
        }
        if (picked < 0) {
            return FeedbackVerdict.UNKNOWN;
        }
        int expected = question.expectedAnswers().isEmpty() ? -1 : indexOf(choices, question.expectedAnswers().get(0));
        if (expected < 0) {
            return FeedbackVerdict.UNKNOWN;
        }
        if (picked == expected) {
            return hedged ? FeedbackVerdict.PARTIALLY_CONFIRMED : FeedbackVerdict.CONFIRMED;
        }
        return Math.abs(picked - expected) == 1 ? FeedbackVerdict.PARTIALLY_CONFIRMED : FeedbackVerdict.DENIED;
    }

    private FeedbackVerdict freeText(VerificationQuestion question, String text, boolean hedged) {
        Set<String> tokens = Set.copyOf(Arrays.asList(tokens(text)));
        long overlap = question.expectedAnswers().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .filter(tokens::contains)
                .count();
        boolean negated = tokens.contains("not") || tokens.contains("never") || tokens.contains("no");
        if (overlap == 0 || negated) {
            return FeedbackVerdict.DENIED;
        }
        return overlap >= 2 && !hedged ? FeedbackVerdict.CONFIRMED : FeedbackVerdict.PARTIALLY_CONFIRMED;
    }

    /**
     * True for an affirmative answer, false for a negative one, empty when neither is recognisable.
     * Any negation wins over affirmative words ("yes, but not really" is negative).
     */
    static Optional<Boolean> polarity(String text) {
        boolean yes = false;
        boolean no = false;
        for (String token : tokens(text)) {
            if (NO_WORDS.contains(token)) {
                no = true;
            } else if (YES_WORDS.contains(token)) {
                yes = true;
            }
        }
        if (no) {
            return Optional.of(false);
        }
        return yes ? Optional.of(true) : Optional.empty();
    }

    private static int synonymChoice(List<String> choices, String text) {
        if (!choices.equals(QuestionTemplates.TREND_CHOICES)) {
            return -1;
        }
        if (text.matches(".*\\b(improved|improving|good|great|up)\\b.*")) {
            return 0;
        }
        if (text.matches(".*\\b(same|similar|unchanged|stable|steady)\\b.*")) {
            return 1;
        }
        if (text.matches(".*\\b(declined|bad|down|harder|poorer)\\b.*")) {
            return 2;
        }
        return -1;
    }

    private static int indexOf(List<String> choices, String value) {
        for (int i = 0; i < choices.size(); i++) {
            if (choices.get(i).equalsIgnoreCase(value)) {
                return i;
            }
        }
        return -1;
    }

    private static String[] tokens(String text) {
        return text.replaceAll("[^a-z0-9' ]", " ").trim().split("\\s+");
    }
}
