package com.eainde.augury.verification;

import com.eainde.augury.theory.Judgment;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryResult;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Category-specific retrospective questions for theories that did not supply claims of their own.
 * The expected answer follows the side of neutral the theory's judgment falls on.
 */
public final class QuestionTemplates {

    private QuestionTemplates() {
    }

    static final List<String> TREND_CHOICES = List.of("better", "about the same", "worse");

    private record Template(String question, AnswerShape shape, String favorableClaim, String unfavorableClaim,
                            List<String> favorableKeywords, List<String> unfavorableKeywords) {
    }

    // ── Templates per category ──

    private static final Map<QuestionCategory, List<Template>> TEMPLATES = new EnumMap<>(QuestionCategory.class);

    private static final List<Template> DEFAULT = List.of(
            yesNo("Has this matter moved forward noticeably in the past year?",
                    "the matter moved forward in the past year", "the matter stalled in the past year"),
            trend("Compared with three years ago, is your situation in this area better, about the same, or worse?"),
            freeText("In a few words, how has this matter developed recently?",
                    List.of("better", "improve", "improved", "progress", "grow", "grew", "good", "success"),
                    List.of("worse", "decline", "difficult", "problem", "bad", "stuck", "loss", "fail")));

    static {
        TEMPLATES.put(QuestionCategory.CAREER, List.of(
                yesNo("In the past three years, did you change jobs or get promoted?",
                        "a job change or promotion in the past three years", "no career movement in the past three years"),
                yesNo("Has your income grown noticeably since 2020?",
                        "income growth since 2020", "flat or falling income since 2020"),
                trend("Compared with three years ago, is your career situation better, about the same, or worse?")));
        TEMPLATES.put(QuestionCategory.WEALTH, List.of(
                yesNo("Did you make a major investment or financial decision in the past three years?",
                        "a major financial decision that paid off", "a costly financial decision"),
                yesNo("Have you had an unexpected gain in money recently?",
                        "an unexpected gain", "no windfall, rather unexpected expenses"),
                trend("Compared with three years ago, is your financial situation better, about the same, or worse?")));
        List<Template> love = List.of(
                yesNo("Has your relationship status changed significantly in the past three years?",
                        "a significant positive change in love life", "no meaningful change in love life"),
                yesNo("Did you start an important relationship after 2020?",
                        "an important relationship begun after 2020", "no new important relationship after 2020"),
                trend("Compared with three years ago, is your love life better, about the same, or worse?"));
        TEMPLATES.put(QuestionCategory.LOVE, love);
        TEMPLATES.put(QuestionCategory.MARRIAGE, love);
        TEMPLATES.put(QuestionCategory.RELATIONSHIP, love);
        TEMPLATES.put(QuestionCategory.HEALTH, List.of(
                yesNo("Have you picked up a new healthy habit in recent years?",
                        "new healthy habits in recent years", "health habits slipping in recent years"),
                yesNo("Have you or your family been free of serious health problems in the past three years?",
                        "no serious health problems in the past three years", "a health problem in the past three years"),
                trend("Compared with three years ago, is your health better, about the same, or worse?")));
        TEMPLATES.put(QuestionCategory.DECISION, List.of(
                yesNo("Did your last major life decision turn out as you expected?",
                        "the last major decision worked out", "the last major decision disappointed"),
                yesNo("Have you recently felt clearer about which option you prefer?",
                        "growing clarity about the options", "growing doubt about the options"),
                freeText("In a few words, how did your last big decision work out?",
                        List.of("well", "good", "right", "glad", "success", "worked"),
                        List.of("regret", "bad", "wrong", "mistake", "failed", "worse"))));
    }

    /**
     * Concrete claims for a theory's result under a category, in template order.
     */
    public static List<RetrospectiveClaim> claimsFor(QuestionCategory category, TheoryResult result) {
        Judgment.Side side = result.judgment().side();
        return TEMPLATES.getOrDefault(category, DEFAULT).stream()
                .map(t -> instantiate(t, side))
                .toList();
    }

    private static RetrospectiveClaim instantiate(Template template, Judgment.Side side) {
        boolean favorable = side == Judgment.Side.POSITIVE;
        return switch (template.shape()) {
            case YES_NO -> RetrospectiveClaim.yesNo(favorable ? template.favorableClaim() : template.unfavorableClaim(),
                    template.question(), favorable);
            case CHOICE -> {
                String expected = switch (side) {
                    case POSITIVE -> TREND_CHOICES.get(0);
                    case NEUTRAL -> TREND_CHOICES.get(1);
                    case NEGATIVE -> TREND_CHOICES.get(2);
                };
                yield new RetrospectiveClaim("the situation is " + expected + " than three years ago",
                        template.question(), AnswerShape.CHOICE, List.of(expected), TREND_CHOICES);
            }
            default -> new RetrospectiveClaim(favorable ? template.favorableClaim() : template.unfavorableClaim(),
                    template.question(), AnswerShape.FREE_TEXT,
                    favorable ? template.favorableKeywords() : template.unfavorableKeywords(), List.of());
        };
    }

    private static Template yesNo(String question, String favorableClaim, String unfavorableClaim) {
        return new Template(question, AnswerShape.YES_NO, favorableClaim, unfavorableClaim, List.of(), List.of());
    }

    private static Template trend(String question) {
        return new Template(question, AnswerShape.CHOICE, null, null, List.of(), List.of());
    }

    private static Template freeText(String question, List<String> favorableKeywords,
                                     List<String> unfavorableKeywords) {
        return new Template(question, AnswerShape.FREE_TEXT, "a favorable recent development",
                "an unfavorable recent development", favorableKeywords, unfavorableKeywords);
    }
}
