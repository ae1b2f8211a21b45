package com.eainde.augury.selection;

import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryNames;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Feature vectors used to score how well a theory fits a question.
 *
 * <p>Both categories and theories live in the same 8-feature space:
 * <pre>
 *   [time, space, interpersonal, finance, health, decision, emotion, complexity]
 * </pre>
 * Category affinity is the cosine similarity of the two vectors. Unknown categories and
 * theories get a flat 0.5 vector.</p>
 *
 * <p>The optional personality axis maps an MBTI type to a per-theory acceptance score.</p>
 */
public final class AffinityProfile {

    public static final int FEATURES = 8;
    public static final double NEUTRAL_PERSONALITY_SCORE = 0.7;

    private static final double[] FLAT = {0.5, 0.5, 0.5, 0.5, 0.5, 0.5, 0.5, 0.5};

    private final Map<QuestionCategory, double[]> categoryVectors;
    private final Map<String, double[]> theoryVectors;
    private final Map<String, Map<String, Double>> personalityAcceptance;

    public AffinityProfile(Map<QuestionCategory, double[]> categoryVectors,
                           Map<String, double[]> theoryVectors,
                           Map<String, Map<String, Double>> personalityAcceptance) {
        categoryVectors.values().forEach(AffinityProfile::requireDimension);
        theoryVectors.values().forEach(AffinityProfile::requireDimension);
        this.categoryVectors = new EnumMap<>(QuestionCategory.class);
        this.categoryVectors.putAll(categoryVectors);
        this.theoryVectors = new HashMap<>(theoryVectors);
        this.personalityAcceptance = new HashMap<>(personalityAcceptance);
    }

    public double[] categoryVector(QuestionCategory category) {
        return categoryVectors.getOrDefault(category, FLAT).clone();
    }

    public double[] theoryVector(String theoryName) {
        return theoryVectors.getOrDefault(theoryName, FLAT).clone();
    }

    public double categoryAffinity(QuestionCategory category, String theoryName) {
        return cosine(categoryVectors.getOrDefault(category, FLAT), theoryVectors.getOrDefault(theoryName, FLAT));
    }

    /**
     * Acceptance of a theory by a personality type; neutral when the type is absent or unknown.
     */
    public double personalityScore(String personalityType, String theoryName) {
        if (personalityType == null) {
            return NEUTRAL_PERSONALITY_SCORE;
        }
        Map<String, Double> row = personalityAcceptance.get(personalityType.toUpperCase(Locale.ROOT));
        if (row == null) {
            return NEUTRAL_PERSONALITY_SCORE;
        }
        return row.getOrDefault(theoryName, NEUTRAL_PERSONALITY_SCORE);
    }

    static double cosine(double[] a, double[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, dot / (Math.sqrt(normA) * Math.sqrt(normB))));
    }

    private static void requireDimension(double[] vector) {
        if (vector.length != FEATURES) {
            throw new IllegalArgumentException("Affinity vectors must have " + FEATURES + " features, got " + vector.length);
        }
    }

    // =========================================================================
    //  Defaults
    // =========================================================================

    public static AffinityProfile defaults() {
        Map<QuestionCategory, double[]> categories = new EnumMap<>(QuestionCategory.class);
        categories.put(QuestionCategory.CAREER, new double[]{0.7, 0.3, 0.8, 0.9, 0.2, 0.9, 0.5, 0.8});
        categories.put(QuestionCategory.WEALTH, new double[]{0.6, 0.4, 0.5, 1.0, 0.1, 0.8, 0.4, 0.7});
        categories.put(QuestionCategory.LOVE, new double[]{0.4, 0.2, 0.9, 0.3, 0.3, 0.6, 1.0, 0.8});
        categories.put(QuestionCategory.MARRIAGE, new double[]{0.3, 0.3, 1.0, 0.5, 0.2, 0.7, 0.9, 0.9});
        categories.put(QuestionCategory.HEALTH, new double[]{0.9, 0.2, 0.3, 0.4, 1.0, 0.5, 0.7, 0.6});
        categories.put(QuestionCategory.STUDY, new double[]{0.5, 0.2, 0.4, 0.3, 0.2, 0.6, 0.5, 0.5});
        categories.put(QuestionCategory.RELATIONSHIP, new double[]{0.3, 0.3, 1.0, 0.2, 0.1, 0.4, 0.8, 0.6});
        categories.put(QuestionCategory.TIMING, new double[]{1.0, 0.8, 0.3, 0.5, 0.2, 1.0, 0.3, 0.5});
        categories.put(QuestionCategory.DECISION, new double[]{0.7, 0.5, 0.6, 0.7, 0.2, 1.0, 0.5, 0.8});
        categories.put(QuestionCategory.PERSONALITY, new double[]{0.1, 0.1, 0.7, 0.3, 0.4, 0.2, 0.6, 0.7});

        Map<String, double[]> theories = new HashMap<>();
        theories.put(TheoryNames.BAZI, new double[]{0.3, 0.1, 0.8, 0.7, 0.9, 0.5, 0.6, 0.9});
        theories.put(TheoryNames.QIMEN, new double[]{0.9, 0.8, 0.6, 0.85, 0.7, 0.9, 0.4, 0.6});
        theories.put(TheoryNames.MEIHUA, new double[]{0.7, 0.5, 0.7, 0.6, 0.5, 0.6, 0.8, 0.5});
        theories.put(TheoryNames.XIAOLIU, new double[]{0.8, 0.3, 0.5, 0.7, 0.6, 0.4, 0.5, 0.3});
        theories.put(TheoryNames.CEZI, new double[]{0.6, 0.2, 0.9, 0.4, 0.3, 0.3, 0.9, 0.4});
        theories.put(TheoryNames.LIUYAO, new double[]{0.5, 0.4, 0.8, 0.9, 0.7, 0.8, 0.7, 0.6});
        theories.put(TheoryNames.ZIWEI, new double[]{0.2, 0.1, 0.9, 0.8, 0.9, 0.6, 0.7, 0.9});
        theories.put(TheoryNames.DALIUREN, new double[]{0.8, 0.7, 0.7, 0.7, 0.7, 0.85, 0.5, 0.8});

        Map<String, Map<String, Double>> personality = new HashMap<>();
        // order: bazi, qimen, meihua, xiaoliu, cezi, liuyao, ziwei, daliuren
        personality.put("INTJ", row(0.8, 0.9, 0.7, 0.6, 0.5, 0.7, 0.8, 0.7));
        personality.put("INTP", row(0.9, 0.7, 0.8, 0.5, 0.6, 0.8, 0.9, 0.6));
        personality.put("ENTJ", row(0.7, 0.9, 0.6, 0.7, 0.4, 0.6, 0.7, 0.8));
        personality.put("ENTP", row(0.6, 0.8, 0.9, 0.6, 0.7, 0.7, 0.6, 0.7));
        personality.put("INFJ", row(0.8, 0.6, 0.9, 0.5, 0.9, 0.7, 0.8, 0.6));
        personality.put("INFP", row(0.9, 0.5, 0.8, 0.4, 0.9, 0.6, 0.9, 0.5));
        personality.put("ENFJ", row(0.7, 0.7, 0.7, 0.6, 0.8, 0.5, 0.7, 0.7));
        personality.put("ENFP", row(0.6, 0.6, 0.9, 0.7, 0.9, 0.6, 0.6, 0.6));
        personality.put("ISTJ", row(0.8, 0.8, 0.5, 0.9, 0.4, 0.8, 0.8, 0.8));
        personality.put("ISFJ", row(0.9, 0.6, 0.6, 0.8, 0.7, 0.7, 0.9, 0.6));
        personality.put("ESTJ", row(0.7, 0.9, 0.5, 0.9, 0.3, 0.7, 0.7, 0.9));
        personality.put("ESFJ", row(0.8, 0.7, 0.6, 0.8, 0.8, 0.6, 0.8, 0.7));
        personality.put("ISTP", row(0.7, 0.8, 0.7, 0.6, 0.5, 0.9, 0.7, 0.7));
        personality.put("ISFP", row(0.8, 0.5, 0.8, 0.5, 0.9, 0.7, 0.8, 0.5));
        personality.put("ESTP", row(0.6, 0.9, 0.6, 0.7, 0.4, 0.8, 0.6, 0.8));
        personality.put("ESFP", row(0.7, 0.6, 0.8, 0.6, 0.9, 0.6, 0.7, 0.6));

        return new AffinityProfile(categories, theories, personality);
    }

    private static Map<String, Double> row(double bazi, double qimen, double meihua, double xiaoliu,
                                           double cezi, double liuyao, double ziwei, double daliuren) {
        return Map.of(
                TheoryNames.BAZI, bazi,
                TheoryNames.QIMEN, qimen,
                TheoryNames.MEIHUA, meihua,
                TheoryNames.XIAOLIU, xiaoliu,
                TheoryNames.CEZI, cezi,
                TheoryNames.LIUYAO, liuyao,
                TheoryNames.ZIWEI, ziwei,
                TheoryNames.DALIUREN, daliuren);
    }
}
