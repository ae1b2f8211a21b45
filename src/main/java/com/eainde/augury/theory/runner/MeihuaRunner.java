package com.eainde.augury.theory.runner;

import com.eainde.augury.error.CalculationException;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.Judgment;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryNames;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.TheoryRunner;
import com.eainde.augury.theory.UserInput;
import com.eainde.augury.verification.RetrospectiveClaim;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plum Blossom numerology. Upper and lower trigrams come from the first two seeds, the moving
 * line from the third. The trigram holding the moving line is the "use", the other the "body";
 * the five-element relation between them decides the verdict.
 *
 * <p>Without seeds, a favorite color or current direction picks the upper trigram and the inquiry
 * time supplies the rest.</p>
 */
@Component
public class MeihuaRunner implements TheoryRunner {

    static final double CONFIDENCE = 0.75;

    enum Element { METAL, WOOD, WATER, FIRE, EARTH;

        Element generates() {
            return switch (this) {
                case WOOD -> FIRE;
                case FIRE -> EARTH;
                case EARTH -> METAL;
                case METAL -> WATER;
                case WATER -> WOOD;
            };
        }

        Element overcomes() {
            return switch (this) {
                case WOOD -> EARTH;
                case EARTH -> WATER;
                case WATER -> FIRE;
                case FIRE -> METAL;
                case METAL -> WOOD;
            };
        }
    }

    /** Early Heaven order: seed 1 is Qian, 8 is Kun. */
    enum Trigram {
        QIAN(Element.METAL), DUI(Element.METAL), LI(Element.FIRE), ZHEN(Element.WOOD),
        XUN(Element.WOOD), KAN(Element.WATER), GEN(Element.EARTH), KUN(Element.EARTH);

        final Element element;

        Trigram(Element element) {
            this.element = element;
        }

        static Trigram fromNumber(int number) {
            return values()[Math.floorMod(number - 1, 8)];
        }
    }

    enum Relation {
        USE_NOURISHES_BODY(0.85, "Help arrives from outside; move forward with the current.",
                "Someone unexpectedly helped you with this matter recently."),
        BODY_CONTROLS_USE(0.7, "The matter is within your control; take the initiative.",
                "You have recently felt more in control of this matter than before."),
        HARMONY(0.55, "Steady development; keep the current course and avoid rash moves.",
                "Nothing about this matter has changed much in the past few months."),
        BODY_NOURISHES_USE(0.3, "The matter drains your energy; act within your means.",
                "This matter has cost you more effort or money than you expected."),
        USE_CONTROLS_BODY(0.1, "Heavy resistance; hold back and wait for a better time.",
                "You met clear resistance or a refusal regarding this matter recently.");

        final double level;
        final String advice;
        final String pastSign;

        Relation(double level, String advice, String pastSign) {
            this.level = level;
            this.advice = advice;
            this.pastSign = pastSign;
        }
    }

    private static final Map<String, Trigram> COLOR_TRIGRAMS = Map.of(
            "red", Trigram.LI, "purple", Trigram.LI,
            "black", Trigram.KAN, "blue", Trigram.KAN,
            "green", Trigram.ZHEN, "cyan", Trigram.XUN,
            "white", Trigram.DUI, "gold", Trigram.QIAN,
            "yellow", Trigram.KUN, "brown", Trigram.GEN);

    private static final Map<String, Trigram> DIRECTION_TRIGRAMS = Map.of(
            "south", Trigram.LI, "north", Trigram.KAN,
            "east", Trigram.ZHEN, "southeast", Trigram.XUN,
            "west", Trigram.DUI, "northwest", Trigram.QIAN,
            "northeast", Trigram.GEN, "southwest", Trigram.KUN);

    @Override
    public String theoryName() {
        return TheoryNames.MEIHUA;
    }

    @Override
    public TheoryResult run(TheoryDescriptor descriptor, UserInput input) {
        int[] seeds = seeds(input);
        Trigram upper = Trigram.fromNumber(seeds[0]);
        Trigram lower = Trigram.fromNumber(seeds[1]);
        int movingLine = Math.floorMod(seeds[2] - 1, 6) + 1;

        // Moving line in the lower half makes the lower trigram the "use"
        Trigram body = movingLine <= 3 ? upper : lower;
        Trigram use = movingLine <= 3 ? lower : upper;
        Relation relation = relation(body.element, use.element);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("upper", upper.name());
        payload.put("lower", lower.name());
        payload.put("moving_line", movingLine);
        payload.put("body", body.name());
        payload.put("use", use.name());
        payload.put("relation", relation.name());

        RetrospectiveClaim claim = RetrospectiveClaim.yesNo(relation.pastSign,
                "Is this true for you: " + relation.pastSign, true);

        return new TheoryResult(theoryName(), Judgment.fromLevel(relation.level), relation.level, CONFIDENCE,
                payload, relation.advice, List.of(claim));
    }

    static Relation relation(Element body, Element use) {
        if (body == use) {
            return Relation.HARMONY;
        }
        if (use.generates() == body) {
            return Relation.USE_NOURISHES_BODY;
        }
        if (body.generates() == use) {
            return Relation.BODY_NOURISHES_USE;
        }
        if (body.overcomes() == use) {
            return Relation.BODY_CONTROLS_USE;
        }
        return Relation.USE_CONTROLS_BODY;
    }

    private int[] seeds(UserInput input) {
        List<Integer> numbers = input.getNumbers();
        if (numbers.size() >= 2) {
            int moving = numbers.size() >= 3 ? numbers.get(2) : numbers.get(0) + numbers.get(1);
            return new int[]{numbers.get(0), numbers.get(1), moving};
        }

        Trigram anchor = input.getString(FieldNames.FAVORITE_COLOR)
                .map(c -> COLOR_TRIGRAMS.get(c.toLowerCase(Locale.ROOT)))
                .or(() -> input.getString(FieldNames.CURRENT_DIRECTION)
                        .map(d -> DIRECTION_TRIGRAMS.get(d.toLowerCase(Locale.ROOT))))
                .orElseThrow(() -> new CalculationException(theoryName(),
                        "needs two seed numbers, a favorite color or a current direction"));

        LocalDateTime time = RunnerSupport.inquiryTime(input)
                .orElseThrow(() -> new CalculationException(theoryName(), "needs the inquiry time to cast from a color or direction"));
        int timeNumber = time.getHour() + time.getMinute();
        int anchorNumber = anchor.ordinal() + 1;
        return new int[]{anchorNumber, timeNumber % 8 + 1, anchorNumber + timeNumber};
    }
}
