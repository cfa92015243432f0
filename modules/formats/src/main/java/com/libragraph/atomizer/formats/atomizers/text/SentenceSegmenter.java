package com.libragraph.atomizer.formats.atomizers.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Abbreviation-aware sentence boundary detection.
 *
 * <p>Segments partition the input: each one carries its trailing whitespace, leading
 * whitespace belongs to the first, so concatenating them gives the input back.
 * Blank input yields no segments.
 */
public final class SentenceSegmenter {

    private static final String TERMINATORS = ".!?。！？";
    private static final String CLOSERS = "\"')]}”’»";

    private static final Set<String> ABBREVIATIONS = Set.of(
            "mr", "mrs", "ms", "dr", "prof", "sr", "jr", "st", "mt", "ave", "vs", "etc", "inc", "ltd",
            "co", "corp", "dept", "est", "fig", "figs", "no", "nos", "vol", "approx", "al", "cf", "ca",
            "e.g", "i.e", "u.s", "u.k", "a.m", "p.m", "ph.d", "jan", "feb", "mar", "apr", "jun", "jul",
            "aug", "sep", "sept", "oct", "nov", "dec");

    private SentenceSegmenter() {
    }

    /**
     * Half-open span {@code [start, end)} of the input.
     */
    public record Segment(int start, int end) {
        public String of(String text) {
            return text.substring(start, end);
        }
    }

    public static List<Segment> segment(String text) {
        List<Segment> segments = new ArrayList<>();
        if (text.isBlank()) {
            return segments;
        }
        int n = text.length();
        int start = 0;
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            int boundary = -1;
            if (TERMINATORS.indexOf(c) >= 0) {
                boundary = sentenceEnd(text, i);
            } else if (c == '\n') {
                boundary = paragraphEnd(text, i);
            }
            if (boundary > 0 && boundary < n && !text.substring(start, boundary).isBlank()) {
                segments.add(new Segment(start, boundary));
                start = boundary;
                i = boundary;
            } else {
                i++;
            }
        }
        if (start < n) {
            if (text.substring(start).isBlank() && !segments.isEmpty()) {
                Segment last = segments.remove(segments.size() - 1);
                segments.add(new Segment(last.start(), n));
            } else {
                segments.add(new Segment(start, n));
            }
        }
        return segments;
    }

    /**
     * Returns the index where the next sentence starts, or -1 when the terminator at
     * {@code i} does not end a sentence.
     */
    private static int sentenceEnd(String text, int i) {
        int n = text.length();
        int j = i + 1;
        while (j < n && (TERMINATORS.indexOf(text.charAt(j)) >= 0 || CLOSERS.indexOf(text.charAt(j)) >= 0)) {
            j++;
        }
        if (j == n) {
            return n;
        }
        if (!Character.isWhitespace(text.charAt(j))) {
            return -1;
        }
        if (text.charAt(i) == '.' && isAbbreviation(text, i)) {
            return -1;
        }
        int k = skipWhitespace(text, j);
        if (k < n && Character.isLowerCase(text.charAt(k))) {
            return -1;
        }
        return k;
    }

    /**
     * A blank line ends a paragraph even without punctuation.
     */
    private static int paragraphEnd(String text, int i) {
        int k = skipWhitespace(text, i);
        if (text.substring(i, k).chars().filter(ch -> ch == '\n').count() >= 2) {
            return k;
        }
        return -1;
    }

    private static boolean isAbbreviation(String text, int dot) {
        int s = dot;
        while (s > 0 && (Character.isLetter(text.charAt(s - 1)) || text.charAt(s - 1) == '.')) {
            s--;
        }
        String word = text.substring(s, dot);
        if (word.isEmpty()) {
            return false;
        }
        if (word.length() == 1 && Character.isUpperCase(word.charAt(0))) {
            return true;
        }
        return ABBREVIATIONS.contains(word.toLowerCase(Locale.ROOT));
    }

    private static int skipWhitespace(String text, int from) {
        int k = from;
        while (k < text.length() && Character.isWhitespace(text.charAt(k))) {
            k++;
        }
        return k;
    }
}
