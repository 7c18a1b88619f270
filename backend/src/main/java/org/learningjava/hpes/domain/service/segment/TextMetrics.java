package org.learningjava.hpes.domain.service.segment;

import org.learningjava.hpes.domain.model.StructuralMetrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language independent signals used to tell code from prose and to score
 * fallback blocks.
 */
public final class TextMetrics {

    private static final String TECHNICAL_CHARS = "{}[]()<>;:=+-*/%&|!~^#@$";

    private static final Set<String> KEYWORDS = Set.of(
            "def", "class", "function", "var", "let", "const", "import", "export",
            "if", "else", "elif", "for", "while", "return", "void", "int", "string",
            "public", "private", "static", "async", "await", "try", "catch", "except",
            "package", "struct", "fn", "func", "new", "null", "true", "false", "none",
            "select", "from", "where", "echo", "then", "fi", "end");

    private static final Set<String> PROSE_WORDS = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "and", "or",
            "but", "however", "therefore", "this", "that", "these", "those");

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");
    private static final Pattern SENTENCE = Pattern.compile("\\.\\s+[A-Z]");
    private static final Pattern DEFINITIONS = Pattern.compile("\\b(def|function|public|private)\\b");
    private static final Pattern CONTROL_FLOW = Pattern.compile("\\b(if|for|while|switch)\\b");
    private static final Pattern TYPES = Pattern.compile("\\b(class|interface|struct)\\b");

    private TextMetrics() {
    }

    public static StructuralMetrics measure(String text) {
        return new StructuralMetrics(
                nonBlankLines(text),
                technicalDensity(text),
                keywordDensity(text),
                terminatorRatio(text),
                bracketsBalanced(text),
                proseRatio(text),
                sentenceCount(text),
                complexity(text));
    }

    /** 0.7 x share of technical characters + 0.3 x share of keyword tokens. */
    public static double technicalDensity(String text) {
        if (text.isBlank()) {
            return 0.0;
        }
        int tech = 0;
        for (int i = 0; i < text.length(); i++) {
            if (TECHNICAL_CHARS.indexOf(text.charAt(i)) >= 0) {
                tech++;
            }
        }
        double charDensity = (double) tech / text.length();
        return charDensity * 0.7 + keywordDensity(text) * 0.3;
    }

    public static double keywordDensity(String text) {
        String[] words = text.trim().split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) {
            return 0.0;
        }
        int keywords = 0;
        for (String w : words) {
            if (KEYWORDS.contains(w.toLowerCase(Locale.ROOT))) {
                keywords++;
            }
        }
        return (double) keywords / words.length;
    }

    public static double terminatorRatio(String text) {
        int lines = 0;
        int terminated = 0;
        for (String line : text.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            lines++;
            char last = trimmed.charAt(trimmed.length() - 1);
            if (last == ';' || last == '{' || last == '}' || last == ':' || last == ')' || last == ']') {
                terminated++;
            }
        }
        return lines == 0 ? 0.0 : (double) terminated / lines;
    }

    /** Round, square and curly brackets nest properly; text without brackets counts as balanced. */
    public static boolean bracketsBalanced(String text) {
        Deque<Character> open = new ArrayDeque<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '(', '[', '{' -> open.push(c);
                case ')', ']', '}' -> {
                    if (open.isEmpty() || open.pop() != partnerOf(c)) {
                        return false;
                    }
                }
                default -> {
                }
            }
        }
        return open.isEmpty();
    }

    public static double proseRatio(String text) {
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        int words = 0;
        int prose = 0;
        while (m.find()) {
            words++;
            if (PROSE_WORDS.contains(m.group())) {
                prose++;
            }
        }
        return words == 0 ? 0.0 : (double) prose / words;
    }

    public static int sentenceCount(String text) {
        return count(SENTENCE, text);
    }

    /** Definitions, control-flow keywords, type declarations and bracket pairs present. */
    public static int complexity(String text) {
        int score = count(DEFINITIONS, text) + count(CONTROL_FLOW, text) + count(TYPES, text);
        if (text.indexOf('{') >= 0 && text.indexOf('}') >= 0) {
            score++;
        }
        if (text.indexOf('(') >= 0 && text.indexOf(')') >= 0) {
            score++;
        }
        return score;
    }

    public static boolean looksLikeProse(String text, double maxProseRatio, int maxSentences) {
        return proseRatio(text) > maxProseRatio || sentenceCount(text) > maxSentences;
    }

    public static int nonBlankLines(String text) {
        int count = 0;
        for (String line : text.split("\n")) {
            if (!line.isBlank()) {
                count++;
            }
        }
        return count;
    }

    private static char partnerOf(char close) {
        return switch (close) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }
}
