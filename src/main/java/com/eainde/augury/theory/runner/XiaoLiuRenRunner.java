package com.eainde.augury.theory.runner;

import com.eainde.augury.error.CalculationException;
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
import java.util.Map;

/**
 * Six-palace count. The first seed (or the month) lands on a palace, the second (or the day)
 * counts on from there, the third (or the double-hour) counts on again; the final palace is the answer.
 */
@Component
public class XiaoLiuRenRunner implements TheoryRunner {

    static final double CONFIDENCE = 0.7;

    enum Palace {
        DA_AN("Da An", 0.75, "Steady and safe; proceed as planned without haste.",
                "The matter has been fairly stable so far."),
        LIU_LIAN("Liu Lian", 0.3, "Obstacles and delays; wait patiently for a better moment.",
                "Progress on this matter has already stalled or been delayed."),
        SU_XI("Su Xi", 0.9, "Quick good news; seize the opportunity.",
                "There was recent encouraging news about this matter."),
        CHI_KOU("Chi Kou", 0.2, "Beware of quarrels; speak carefully and avoid disputes.",
                "There were recent arguments or disputes around this matter."),
        XIAO_JI("Xiao Ji", 0.65, "Modest luck; things go smoothly but keep expectations measured.",
                "Someone has already offered you help with this matter."),
        KONG_WANG("Kong Wang", 0.1, "Efforts tend to come to nothing; reassess or change plans.",
                "Earlier efforts on this matter came to nothing.");

        final String label;
        final double level;
        final String advice;
        final String pastSign;

        Palace(String label, double level, String advice, String pastSign) {
            this.label = label;
            this.level = level;
            this.advice = advice;
            this.pastSign = pastSign;
        }
    }

    @Override
    public String theoryName() {
        return TheoryNames.XIAOLIU;
    }

    @Override
    public TheoryResult run(TheoryDescriptor descriptor, UserInput input) {
        int[] counts = counts(input);
        int monthIndex = Math.floorMod(counts[0] - 1, 6);
        int dayIndex = Math.floorMod(monthIndex + counts[1] - 1, 6);
        int finalIndex = Math.floorMod(dayIndex + counts[2], 6);
        Palace palace = Palace.values()[finalIndex];

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("counts", List.of(counts[0], counts[1], counts[2]));
        payload.put("month_palace", Palace.values()[monthIndex].label);
        payload.put("day_palace", Palace.values()[dayIndex].label);
        payload.put("final_palace", palace.label);

        RetrospectiveClaim claim = RetrospectiveClaim.yesNo(palace.pastSign,
                "Looking back, would you say this is true: " + lowerFirst(palace.pastSign), true);

        return new TheoryResult(theoryName(), Judgment.fromLevel(palace.level), palace.level, CONFIDENCE,
                payload, palace.label + ": " + palace.advice, List.of(claim));
    }

    private int[] counts(UserInput input) {
        List<Integer> numbers = input.getNumbers();
        if (numbers.size() >= 3) {
            return new int[]{numbers.get(0), numbers.get(1), numbers.get(2)};
        }
        LocalDateTime time = RunnerSupport.inquiryTime(input)
                .orElseThrow(() -> new CalculationException(theoryName(), "needs three seed numbers or the inquiry time"));
        return new int[]{time.getMonthValue(), time.getDayOfMonth(), time.getHour() / 2};
    }

    private static String lowerFirst(String text) {
        return Character.toLowerCase(text.charAt(0)) + text.substring(1);
    }
}
