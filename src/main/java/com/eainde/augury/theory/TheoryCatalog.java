package com.eainde.augury.theory;

import java.util.List;

import static com.eainde.augury.theory.FieldNames.*;

/**
 * The built-in theory descriptors, in declaration order. Declaration order breaks fitness ties.
 */
public final class TheoryCatalog {

    private TheoryCatalog() {}

    public static List<TheoryDescriptor> descriptors() {
        return List.of(
                TheoryDescriptor.of(TheoryNames.XIAOLIU, "Xiao Liu Ren", TheoryTier.FAST)
                        .optional(NUMBERS, 0.5)
                        .optional(BIRTH_MONTH, 0.2)
                        .optional(BIRTH_DAY, 0.2)
                        .optional(INQUIRY_TIME, 0.1)
                        .build(),

                TheoryDescriptor.of(TheoryNames.CEZI, "Character Analysis", TheoryTier.FAST)
                        .required(QUESTION_DESCRIPTION, 0.3)
                        .required(CHARACTER, 0.7)
                        .minCompleteness(0.7)
                        .build(),

                TheoryDescriptor.of(TheoryNames.MEIHUA, "Plum Blossom", TheoryTier.FAST)
                        .optional(NUMBERS, 0.3)
                        .optional(CHARACTER, 0.2)
                        .optional(FAVORITE_COLOR, 0.2)
                        .optional(CURRENT_DIRECTION, 0.2)
                        .optional(INQUIRY_TIME, 0.1)
                        .build(),

                TheoryDescriptor.of(TheoryNames.BAZI, "Four Pillars", TheoryTier.BASIC)
                        .required(BIRTH_YEAR, 0.25)
                        .required(BIRTH_MONTH, 0.25)
                        .required(BIRTH_DAY, 0.25)
                        .optional(BIRTH_HOUR, 0.15)
                        .optional(GENDER, 0.05)
                        .minCompleteness(0.75)
                        .birthTimeSensitive()
                        .build(),

                TheoryDescriptor.of(TheoryNames.ZIWEI, "Purple Star", TheoryTier.BASIC)
                        .required(QUESTION_CATEGORY, 0.15)
                        .required(QUESTION_DESCRIPTION, 0.15)
                        .required(BIRTH_YEAR, 0.15)
                        .required(BIRTH_MONTH, 0.15)
                        .required(BIRTH_DAY, 0.15)
                        .required(BIRTH_HOUR, 0.2)
                        .required(GENDER, 0.05)
                        .minCompleteness(0.95)
                        .birthTimeSensitive()
                        .build(),

                TheoryDescriptor.of(TheoryNames.QIMEN, "Qi Men Dun Jia", TheoryTier.DEEP)
                        .required(QUESTION_CATEGORY, 0.3)
                        .required(QUESTION_DESCRIPTION, 0.3)
                        .required(INQUIRY_TIME, 0.3)
                        .optional(BIRTH_YEAR, 0.05)
                        .optional(BIRTH_MONTH, 0.025)
                        .optional(BIRTH_DAY, 0.025)
                        .minCompleteness(0.7)
                        .build(),

                TheoryDescriptor.of(TheoryNames.DALIUREN, "Da Liu Ren", TheoryTier.DEEP)
                        .required(QUESTION_DESCRIPTION, 0.3)
                        .required(INQUIRY_TIME, 0.4)
                        .optional(QUESTION_CATEGORY, 0.3)
                        .minCompleteness(0.6)
                        .build(),

                TheoryDescriptor.of(TheoryNames.LIUYAO, "Six Lines", TheoryTier.DEEP)
                        .required(NUMBERS, 0.7)
                        .optional(INQUIRY_TIME, 0.2)
                        .optional(QUESTION_DESCRIPTION, 0.1)
                        .minCompleteness(0.6)
                        .build()
        );
    }
}
