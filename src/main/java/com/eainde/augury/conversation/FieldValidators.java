package com.eainde.augury.conversation;

import com.eainde.augury.theory.QuestionCategory;

import java.time.Year;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Built-in deterministic validators, one factory per field kind.
 */
public final class FieldValidators {

    private FieldValidators() {
    }

    public static final int MAX_DESCRIPTION_LENGTH = 200;
    public static final int MIN_DESCRIPTION_LENGTH = 5;
    public static final int MIN_BIRTH_YEAR = 1900;

    static final List<String> DIRECTIONS = List.of(
            "northeast", "northwest", "southeast", "southwest", "north", "south", "east", "west");

    static final List<String> COLORS = List.of(
            "red", "purple", "black", "blue", "green", "cyan", "white", "gold", "yellow", "brown",
            "orange", "pink", "grey", "gray", "silver");

    static final List<String> CERTAINTIES = List.of("certain", "uncertain", "unknown");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("january", 1), Map.entry("february", 2), Map.entry("march", 3), Map.entry("april", 4),
            Map.entry("may", 5), Map.entry("june", 6), Map.entry("july", 7), Map.entry("august", 8),
            Map.entry("september", 9), Map.entry("october", 10), Map.entry("november", 11),
            Map.entry("december", 12), Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3),
            Map.entry("apr", 4), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("oct", 10), Map.entry("nov", 11),
            Map.entry("dec", 12));

    private static final String MONTH_NAMES = MONTHS.keySet().stream()
            .sorted((a, b) -> b.length() - a.length())
            .collect(Collectors.joining("|"));

    private static final Pattern ISO_DATE = Pattern.compile("\\b(19\\d{2}|20\\d{2})[-/.](\\d{1,2})[-/.](\\d{1,2})\\b");
    private static final Pattern NAMED_DATE = Pattern.compile(
            "\\b(" + MONTH_NAMES + ")\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(19\\d{2}|20\\d{2})\\b");
    private static final Pattern NAMED_DATE_DAY_FIRST = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?(" + MONTH_NAMES + ")\\.?,?\\s+(19\\d{2}|20\\d{2})\\b");
    private static final Pattern YEAR = Pattern.compile("\\b(1\\d{3}|2\\d{3})\\b");
    private static final Pattern MONTH_NUMBER = Pattern.compile("\\bmonth\\s*(?:is|:|=)?\\s*(\\d{1,2})\\b");
    private static final Pattern MONTH_NAME = Pattern.compile("\\b(" + MONTH_NAMES + ")\\b");
    private static final Pattern DAY_NUMBER = Pattern.compile("\\bday\\s*(?:is|:|=)?\\s*(\\d{1,2})\\b");
    private static final Pattern ORDINAL_DAY = Pattern.compile("\\b(\\d{1,2})(?:st|nd|rd|th)\\b");
    private static final Pattern CLOCK_TIME = Pattern.compile("\\b(\\d{1,2}):(\\d{2})\\s*(am|pm)?\\b");
    private static final Pattern MERIDIEM_TIME = Pattern.compile("\\b(\\d{1,2})\\s*(am|pm)\\b");
    private static final Pattern HOUR_NUMBER = Pattern.compile("\\b(?:hour\\s*(?:is|:|=)?\\s*(\\d{1,2})|(\\d{1,2})\\s*o'?clock)\\b");
    private static final Pattern APPROXIMATE_TIME = Pattern.compile(
            "\\b(around|about|roughly|approximately|circa|maybe)\\s+\\d{1,2}(:\\d{2})?");
    private static final Pattern EXACT_TIME = Pattern.compile("\\b(exactly|precisely|exact|certain)\\b");
    private static final Pattern PERSONALITY = Pattern.compile("\\b([ei][ns][tf][jp])\\b");
    private static final Pattern FAVORITE_COLOR = Pattern.compile("\\bfavou?rite colou?r\\s*(?:is|:)?\\s*([a-z]+)");
    private static final Pattern CHARACTER = Pattern.compile(
            "\\b(?:character|char|word)\\s*(?:is|:)?\\s*[\"'“「]?(\\p{L})");
    private static final Pattern HAN = Pattern.compile("\\p{IsHan}");

    private static final Set<String> MALE = Set.of("male", "man", "boy", "guy");
    private static final Set<String> FEMALE = Set.of("female", "woman", "girl", "lady");

    private record Composite(BiFunction<String, String, FieldCheck> detector,
                             BiFunction<String, Object, FieldCheck> validator) implements FieldValidator {

        @Override
        public FieldCheck detect(String field, String text) {
            if (text == null || text.isBlank()) {
                return FieldCheck.absent(field);
            }
            return detector.apply(field, text);
        }

        @Override
        public FieldCheck validate(String field, Object candidate) {
            if (candidate == null || candidate.toString().isBlank()) {
                return FieldCheck.absent(field);
            }
            return validator.apply(field, candidate);
        }
    }

    // ── ICEBREAK ────────────────────────────────────────────────────────

    public static FieldValidator questionCategory() {
        return new Composite(
                (field, text) -> {
                    List<QuestionCategory> candidates = QuestionCategory.candidates(text);
                    if (candidates.size() == 1) {
                        return FieldCheck.found(field, candidates.get(0).key());
                    }
                    if (candidates.size() > 1) {
                        return FieldCheck.ambiguous(field, "Is this mainly about "
                                + candidates.stream().map(QuestionCategory::key).collect(Collectors.joining(" or ")) + "?");
                    }
                    return lower(text).matches(".*\\bother\\b.*") ? FieldCheck.found(field, "other") : FieldCheck.absent(field);
                },
                (field, candidate) -> {
                    String value = lower(candidate.toString()).trim();
                    QuestionCategory category = QuestionCategory.fromKey(value);
                    if (category != QuestionCategory.OTHER || "other".equals(value)) {
                        return FieldCheck.found(field, category.key());
                    }
                    return QuestionCategory.detect(value)
                            .map(c -> FieldCheck.found(field, c.key()))
                            .orElseGet(() -> FieldCheck.invalid(field, "Choose one of: " + Arrays.stream(QuestionCategory.values())
                                    .map(QuestionCategory::key).collect(Collectors.joining(", "))));
                });
    }

    public static FieldValidator numbers() {
        return new Composite(FieldValidators::parseNumbers, (field, candidate) -> {
            if (candidate instanceof List<?> list) {
                return parseNumbers(field, list.stream().map(String::valueOf).collect(Collectors.joining(" ")));
            }
            return parseNumbers(field, candidate.toString());
        });
    }

    // ── DEEPEN ──────────────────────────────────────────────────────────

    public static FieldValidator questionDescription() {
        BiFunction<String, String, FieldCheck> check = (field, text) -> {
            String trimmed = text.trim();
            if (trimmed.codePointCount(0, trimmed.length()) <= MIN_DESCRIPTION_LENGTH) {
                return FieldCheck.invalid(field, "Please describe your situation in a sentence or two.");
            }
            return FieldCheck.found(field, trimmed.length() > MAX_DESCRIPTION_LENGTH
                    ? trimmed.substring(0, MAX_DESCRIPTION_LENGTH) : trimmed);
        };
        return new Composite(check, (field, candidate) -> check.apply(field, candidate.toString()));
    }

    public static FieldValidator character() {
        return new Composite(
                (field, text) -> {
                    Matcher named = CHARACTER.matcher(lower(text));
                    if (named.find()) {
                        // Keep the original casing of the named character
                        int start = named.start(1);
                        return FieldCheck.found(field, text.substring(start, text.offsetByCodePoints(start, 1)));
                    }
                    List<String> han = new ArrayList<>();
                    Matcher matcher = HAN.matcher(text);
                    while (matcher.find()) {
                        han.add(matcher.group());
                    }
                    if (han.size() == 1) {
                        return FieldCheck.found(field, han.get(0));
                    }
                    if (han.size() > 1) {
                        return FieldCheck.ambiguous(field, "Please give just one character.");
                    }
                    String trimmed = text.trim();
                    if (trimmed.codePointCount(0, trimmed.length()) == 1 && Character.isLetter(trimmed.codePointAt(0))) {
                        return FieldCheck.found(field, trimmed);
                    }
                    return FieldCheck.absent(field);
                },
                (field, candidate) -> {
                    String value = candidate.toString().trim();
                    if (value.codePointCount(0, value.length()) == 1 && Character.isLetter(value.codePointAt(0))) {
                        return FieldCheck.found(field, value);
                    }
                    return FieldCheck.invalid(field, "The seed must be exactly one character.");
                });
    }

    // ── COLLECT ─────────────────────────────────────────────────────────

    public static FieldValidator birthYear() {
        return new Composite(
                (field, text) -> {
                    Optional<int[]> date = fullDate(lower(text));
                    if (date.isPresent()) {
                        return yearCheck(field, date.get()[0]);
                    }
                    Set<Integer> years = new LinkedHashSet<>();
                    Matcher matcher = YEAR.matcher(text);
                    while (matcher.find()) {
                        years.add(Integer.parseInt(matcher.group(1)));
                    }
                    if (years.size() > 1) {
                        return FieldCheck.ambiguous(field, "Which of " + years + " is your birth year?");
                    }
                    return years.isEmpty() ? FieldCheck.absent(field) : yearCheck(field, years.iterator().next());
                },
                (field, candidate) -> integer(candidate)
                        .map(year -> yearCheck(field, year))
                        .orElseGet(() -> FieldCheck.invalid(field, "Birth year must be a four-digit year.")));
    }

    public static FieldValidator birthMonth() {
        return new Composite(
                (field, text) -> {
                    String lower = lower(text);
                    Optional<int[]> date = fullDate(lower);
                    if (date.isPresent()) {
                        return rangeCheck(field, date.get()[1], 1, 12, "Birth month must be between 1 and 12.");
                    }
                    Matcher number = MONTH_NUMBER.matcher(lower);
                    if (number.find()) {
                        return rangeCheck(field, Integer.parseInt(number.group(1)), 1, 12, "Birth month must be between 1 and 12.");
                    }
                    Matcher name = MONTH_NAME.matcher(lower);
                    // "may" is also a verb; only trust it next to a day or year
                    while (name.find()) {
                        if (!"may".equals(name.group(1)) || lower.matches(".*\\bmay\\s+\\d.*")) {
                            return FieldCheck.found(field, MONTHS.get(name.group(1)));
                        }
                    }
                    return FieldCheck.absent(field);
                },
                (field, candidate) -> integer(candidate)
                        .map(month -> rangeCheck(field, month, 1, 12, "Birth month must be between 1 and 12."))
                        .orElseGet(() -> Optional.ofNullable(MONTHS.get(lower(candidate.toString()).trim()))
                                .map(month -> FieldCheck.found(field, month))
                                .orElseGet(() -> FieldCheck.invalid(field, "Birth month must be between 1 and 12."))));
    }

    public static FieldValidator birthDay() {
        return new Composite(
                (field, text) -> {
                    String lower = lower(text);
                    Optional<int[]> date = fullDate(lower);
                    if (date.isPresent()) {
                        return rangeCheck(field, date.get()[2], 1, 31, "Birth day must be between 1 and 31.");
                    }
                    Matcher number = DAY_NUMBER.matcher(lower);
                    if (number.find()) {
                        return rangeCheck(field, Integer.parseInt(number.group(1)), 1, 31, "Birth day must be between 1 and 31.");
                    }
                    Matcher ordinal = ORDINAL_DAY.matcher(lower);
                    if (ordinal.find()) {
                        return rangeCheck(field, Integer.parseInt(ordinal.group(1)), 1, 31, "Birth day must be between 1 and 31.");
                    }
                    return FieldCheck.absent(field);
                },
                (field, candidate) -> integer(candidate)
                        .map(day -> rangeCheck(field, day, 1, 31, "Birth day must be between 1 and 31."))
                        .orElseGet(() -> FieldCheck.invalid(field, "Birth day must be between 1 and 31.")));
    }

    public static FieldValidator birthHour() {
        return new Composite(
                (field, text) -> {
                    String lower = lower(text);
                    Matcher clock = CLOCK_TIME.matcher(lower);
                    if (clock.find()) {
                        return hourCheck(field, Integer.parseInt(clock.group(1)), clock.group(3));
                    }
                    Matcher meridiem = MERIDIEM_TIME.matcher(lower);
                    if (meridiem.find()) {
                        return hourCheck(field, Integer.parseInt(meridiem.group(1)), meridiem.group(2));
                    }
                    Matcher hour = HOUR_NUMBER.matcher(lower);
                    if (hour.find()) {
                        String digits = hour.group(1) != null ? hour.group(1) : hour.group(2);
                        return hourCheck(field, Integer.parseInt(digits), null);
                    }
                    return FieldCheck.absent(field);
                },
                (field, candidate) -> integer(candidate)
                        .map(hour -> rangeCheck(field, hour, 0, 23, "Birth hour must be between 0 and 23."))
                        .orElseGet(() -> FieldValidators.birthHour().detect(field, candidate.toString())));
    }

    public static FieldValidator gender() {
        return new Composite(
                (field, text) -> {
                    Set<String> tokens = tokens(text);
                    boolean male = tokens.stream().anyMatch(MALE::contains);
                    boolean female = tokens.stream().anyMatch(FEMALE::contains);
                    if (male && female) {
                        return FieldCheck.ambiguous(field, "Please state male or female.");
                    }
                    if (male || female) {
                        return FieldCheck.found(field, male ? "male" : "female");
                    }
                    return FieldCheck.absent(field);
                },
                (field, candidate) -> {
                    String value = lower(candidate.toString()).trim();
                    if (MALE.contains(value) || "m".equals(value)) {
                        return FieldCheck.found(field, "male");
                    }
                    if (FEMALE.contains(value) || "f".equals(value)) {
                        return FieldCheck.found(field, "female");
                    }
                    return FieldCheck.invalid(field, "Please state male or female.");
                });
    }

    public static FieldValidator personalityType() {
        BiFunction<String, String, FieldCheck> check = (field, text) -> {
            Matcher matcher = PERSONALITY.matcher(lower(text));
            return matcher.find()
                    ? FieldCheck.found(field, matcher.group(1).toUpperCase(Locale.ROOT))
                    : FieldCheck.absent(field);
        };
        return new Composite(check, (field, candidate) -> {
            FieldCheck result = check.apply(field, candidate.toString());
            return result.isFound() ? result : FieldCheck.invalid(field, "Use a four-letter MBTI type such as INTJ.");
        });
    }

    public static FieldValidator favoriteColor() {
        return new Composite(
                (field, text) -> {
                    String lower = lower(text);
                    Matcher matcher = FAVORITE_COLOR.matcher(lower);
                    if (matcher.find()) {
                        return FieldCheck.found(field, matcher.group(1));
                    }
                    if (lower.contains("colo")) {
                        Set<String> tokens = tokens(lower);
                        return COLORS.stream().filter(tokens::contains).findFirst()
                                .map(color -> FieldCheck.found(field, color))
                                .orElseGet(() -> FieldCheck.absent(field));
                    }
                    return FieldCheck.absent(field);
                },
                (field, candidate) -> {
                    String value = lower(candidate.toString()).trim();
                    return value.matches("[a-z]+")
                            ? FieldCheck.found(field, value)
                            : FieldCheck.invalid(field, "Name one color, e.g. red or blue.");
                });
    }

    public static FieldValidator currentDirection() {
        return new Composite(
                (field, text) -> {
                    String lower = lower(text);
                    if (!lower.matches(".*\\b(facing|face|direction|toward|towards|heading|sit|sitting)\\b.*")) {
                        return FieldCheck.absent(field);
                    }
                    Set<String> tokens = tokens(lower);
                    return DIRECTIONS.stream().filter(tokens::contains).findFirst()
                            .map(direction -> FieldCheck.found(field, direction))
                            .orElseGet(() -> FieldCheck.absent(field));
                },
                (field, candidate) -> {
                    String value = lower(candidate.toString()).replaceAll("[^a-z]", "");
                    return DIRECTIONS.contains(value)
                            ? FieldCheck.found(field, value)
                            : FieldCheck.invalid(field, "Use a compass direction such as north or southeast.");
                });
    }

    public static FieldValidator birthTimeCertainty() {
        return new Composite(
                (field, text) -> {
                    String lower = lower(text);
                    if (APPROXIMATE_TIME.matcher(lower).find()) {
                        return FieldCheck.found(field, "uncertain");
                    }
                    if (EXACT_TIME.matcher(lower).find()) {
                        return FieldCheck.found(field, "certain");
                    }
                    return FieldCheck.absent(field);
                },
                (field, candidate) -> {
                    String value = lower(candidate.toString()).trim();
                    return CERTAINTIES.contains(value)
                            ? FieldCheck.found(field, value)
                            : FieldCheck.invalid(field, "Use certain, uncertain or unknown.");
                });
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private static FieldCheck parseNumbers(String field, String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = Pattern.compile("\\d+").matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        if (tokens.isEmpty()) {
            return FieldCheck.absent(field);
        }
        // "358" is read as three separate seeds
        if (tokens.size() == 1 && tokens.get(0).length() == 3) {
            tokens = List.of(tokens.get(0).split(""));
        }
        if (tokens.size() != 3) {
            return FieldCheck.ambiguous(field, "Please give exactly three numbers between 1 and 9, e.g. 3 5 8.");
        }
        List<Integer> numbers = new ArrayList<>();
        for (String token : tokens) {
            int value = Integer.parseInt(token);
            if (value < 1 || value > 9) {
                return FieldCheck.invalid(field, "Each number must be between 1 and 9.");
            }
            numbers.add(value);
        }
        return FieldCheck.found(field, List.copyOf(numbers));
    }

    private static Optional<int[]> fullDate(String lower) {
        Matcher iso = ISO_DATE.matcher(lower);
        if (iso.find()) {
            return Optional.of(new int[]{Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)),
                    Integer.parseInt(iso.group(3))});
        }
        Matcher named = NAMED_DATE.matcher(lower);
        if (named.find()) {
            return Optional.of(new int[]{Integer.parseInt(named.group(3)), MONTHS.get(named.group(1)),
                    Integer.parseInt(named.group(2))});
        }
        Matcher dayFirst = NAMED_DATE_DAY_FIRST.matcher(lower);
        if (dayFirst.find()) {
            return Optional.of(new int[]{Integer.parseInt(dayFirst.group(3)), MONTHS.get(dayFirst.group(2)),
                    Integer.parseInt(dayFirst.group(1))});
        }
        return Optional.empty();
    }

    private static FieldCheck yearCheck(String field, int year) {
        int current = Year.now().getValue();
        if (year < MIN_BIRTH_YEAR || year > current) {
            return FieldCheck.invalid(field, "Birth year must be between " + MIN_BIRTH_YEAR + " and " + current + ".");
        }
        return FieldCheck.found(field, year);
    }

    private static FieldCheck hourCheck(String field, int hour, String meridiem) {
        int value = hour;
        if ("pm".equals(meridiem) && hour < 12) {
            value = hour + 12;
        } else if ("am".equals(meridiem) && hour == 12) {
            value = 0;
        }
        return rangeCheck(field, value, 0, 23, "Birth hour must be between 0 and 23.");
    }

    private static FieldCheck rangeCheck(String field, int value, int min, int max, String hint) {
        return value < min || value > max ? FieldCheck.invalid(field, hint) : FieldCheck.found(field, value);
    }

    private static Optional<Integer> integer(Object candidate) {
        if (candidate instanceof Number number) {
            return Optional.of(number.intValue());
        }
        try {
            return Optional.of(Integer.parseInt(candidate.toString().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Set<String> tokens(String text) {
        return new HashSet<>(Arrays.asList(lower(text).replaceAll("[^a-z0-9 ]", " ").trim().split("\\s+")));
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
