package com.whereq.foundry.progress;

import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts an exact percentage from progress bars and progress phrases.
 * Patterns are tried in order and the first one that yields a number wins.
 */
public class StructuredProgressParser {

    // tqdm: " 50%|█████     | 1/2 [00:01<00:01]"
    private static final Pattern BAR_WITH_FRACTION = Pattern.compile("(\\d+(?:\\.\\d+)?)%\\|.*?\\|\\s*(\\d+)/(\\d+)");
    private static final Pattern BAR = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)%\\|");
    private static final Pattern PROGRESS_MARKER = Pattern.compile("progress:\\s*(\\d+(?:\\.\\d+)?)\\s*%", Pattern.CASE_INSENSITIVE);
    private static final Pattern PERCENT_COMPLETE = Pattern.compile("(\\d+(?:\\.\\d+)?)%\\s*complete", Pattern.CASE_INSENSITIVE);
    private static final Pattern STEP_OF = Pattern.compile("step\\s+(\\d+)\\s+of\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD_PERCENT = Pattern.compile("[a-z]+(?:\\.{3}|\u2026|:)?\\s*(\\d+(?:\\.\\d+)?)%(?!\\|)", Pattern.CASE_INSENSITIVE);

    private final List<Extractor> extractors = List.of(
        this::barWithFraction,
        line -> single(BAR, line),
        line -> single(PROGRESS_MARKER, line),
        line -> single(PERCENT_COMPLETE, line),
        line -> fraction(STEP_OF, line),
        line -> single(WORD_PERCENT, line)
    );

    /**
     * Parse a line of worker output.
     *
     * @param line raw output line
     * @return percentage clamped to [0, 100], empty if the line carries none
     */
    public OptionalDouble parse(String line) {
        if (line == null || line.isBlank()) {
            return OptionalDouble.empty();
        }
        for (Extractor extractor : extractors) {
            OptionalDouble value = extractor.extract(line);
            if (value.isPresent()) {
                return OptionalDouble.of(clamp(value.getAsDouble()));
            }
        }
        return OptionalDouble.empty();
    }

    private OptionalDouble barWithFraction(String line) {
        Matcher m = BAR_WITH_FRACTION.matcher(line);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            double current = Double.parseDouble(m.group(2));
            double total = Double.parseDouble(m.group(3));
            if (total > 0) {
                // the fraction is more precise than the rounded display
                return OptionalDouble.of(current / total * 100.0);
            }
            return OptionalDouble.of(Double.parseDouble(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static OptionalDouble single(Pattern pattern, String line) {
        Matcher m = pattern.matcher(line);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static OptionalDouble fraction(Pattern pattern, String line) {
        Matcher m = pattern.matcher(line);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            double current = Double.parseDouble(m.group(1));
            double total = Double.parseDouble(m.group(2));
            return total > 0 ? OptionalDouble.of(current / total * 100.0) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static double clamp(double value) {
        return Math.min(100.0, Math.max(0.0, value));
    }

    @FunctionalInterface
    private interface Extractor {
        OptionalDouble extract(String line);
    }
}
