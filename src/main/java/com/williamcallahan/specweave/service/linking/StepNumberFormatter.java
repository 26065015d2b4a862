package com.williamcallahan.specweave.service.linking;

import java.util.List;

/**
 * Formats step paths the way nested algorithm lists display them: decimal, then lowercase
 * letters, then lowercase roman numerals, repeating for deeper levels.
 */
public final class StepNumberFormatter {

    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_SYMBOLS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};

    private StepNumberFormatter() {}

    /**
     * Formats a step path.
     *
     * @param stepNumbers path, outermost first
     * @return dotted label such as {@code 2.a.iii}
     */
    public static String format(List<Integer> stepNumbers) {
        StringBuilder label = new StringBuilder();
        for (int depth = 0; depth < stepNumbers.size(); depth++) {
            if (depth > 0) {
                label.append('.');
            }
            int number = stepNumbers.get(depth);
            switch (depth % 3) {
                case 0 -> label.append(number);
                case 1 -> label.append(alphabetic(number));
                default -> label.append(roman(number));
            }
        }
        return label.toString();
    }

    static String alphabetic(int number) {
        if (number < 1) {
            return String.valueOf(number);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = number;
        while (remaining > 0) {
            remaining--;
            letters.insert(0, (char) ('a' + remaining % 26));
            remaining /= 26;
        }
        return letters.toString();
    }

    static String roman(int number) {
        if (number < 1) {
            return String.valueOf(number);
        }
        StringBuilder numeral = new StringBuilder();
        int remaining = number;
        for (int i = 0; i < ROMAN_VALUES.length; i++) {
            while (remaining >= ROMAN_VALUES[i]) {
                numeral.append(ROMAN_SYMBOLS[i]);
                remaining -= ROMAN_VALUES[i];
            }
        }
        return numeral.toString();
    }
}
