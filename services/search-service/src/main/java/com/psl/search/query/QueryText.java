package com.psl.search.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Free text split into bare words, quoted literals and wildcard terms. Wildcard characters inside a literal are
 * ordinary characters.
 */
final class QueryText {
    private static final Pattern DATE_PARTIAL = Pattern.compile("(?:^|\\s)(\\d{2})(0[1-9]|1[0-2])(?=$|\\s)");
    private static final Pattern CLASSIC_AUTHOR = Pattern.compile("^([^\\s_,]+)_([^\\s_,]+)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<String> words;
    private final List<String> phrases;
    private final List<String> wildcards;
    private final String stripped;

    private QueryText(List<String> words, List<String> phrases, List<String> wildcards, String stripped) {
        this.words = List.copyOf(words);
        this.phrases = List.copyOf(phrases);
        this.wildcards = List.copyOf(wildcards);
        this.stripped = stripped;
    }

    static QueryText parse(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.startsWith("*") || text.startsWith("?")) {
            throw new QueryException("Query cannot start with a wildcard");
        }
        List<String> words = new ArrayList<>();
        List<String> phrases = new ArrayList<>();
        List<String> wildcards = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inLiteral = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                if (inLiteral) {
                    addPhrase(current, phrases);
                } else {
                    addWord(current, words, wildcards);
                }
                inLiteral = !inLiteral;
            } else if (!inLiteral && Character.isWhitespace(c)) {
                addWord(current, words, wildcards);
            } else {
                current.append(c);
            }
        }
        if (inLiteral) {
            addPhrase(current, phrases);
        } else {
            addWord(current, words, wildcards);
        }
        String stripped = WHITESPACE.matcher(text.replace("\"", " ")).replaceAll(" ").trim();
        return new QueryText(words, phrases, wildcards, stripped);
    }

    /**
     * Finds a standalone four-digit {@code yymm} token. Years from 91 on are read as 19yy, earlier ones as 20yy.
     */
    static Optional<DatePartial> datePartial(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = DATE_PARTIAL.matcher(raw);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String year = matcher.group(1);
        String century = Integer.parseInt(year) >= 91 ? "19" : "20";
        String month = century + year + "-" + matcher.group(2);
        String remainder = raw.substring(0, matcher.start()) + " " + raw.substring(matcher.end());
        return Optional.of(new DatePartial(month, WHITESPACE.matcher(remainder).replaceAll(" ").trim()));
    }

    /**
     * Splits an author query on {@code ;}. The classic {@code surname_f} form becomes {@code surname, f}.
     */
    static List<String> authorTerms(String raw) {
        List<String> terms = new ArrayList<>();
        if (raw == null) {
            return terms;
        }
        for (String part : raw.split(";")) {
            String term = WHITESPACE.matcher(part).replaceAll(" ").trim();
            if (term.isEmpty()) {
                continue;
            }
            Matcher classic = CLASSIC_AUTHOR.matcher(term);
            if (classic.matches()) {
                term = classic.group(1) + ", " + classic.group(2);
            }
            terms.add(term);
        }
        return terms;
    }

    List<String> words() {
        return words;
    }

    String plainText() {
        return String.join(" ", words);
    }

    List<String> phrases() {
        return phrases;
    }

    List<String> wildcards() {
        return wildcards;
    }

    /**
     * The whole text without quotes, for exact-keyword comparisons.
     */
    String stripped() {
        return stripped;
    }

    boolean hasWildcards() {
        return !wildcards.isEmpty();
    }

    boolean isLiteral() {
        return !phrases.isEmpty();
    }

    boolean isEmpty() {
        return words.isEmpty() && phrases.isEmpty() && wildcards.isEmpty();
    }

    private static void addWord(StringBuilder current, List<String> words, List<String> wildcards) {
        String word = current.toString().trim();
        current.setLength(0);
        if (word.isEmpty()) {
            return;
        }
        if (word.indexOf('*') >= 0 || word.indexOf('?') >= 0) {
            if (word.startsWith("*") || word.startsWith("?")) {
                throw new QueryException("Wildcard terms cannot start with a wildcard: " + word);
            }
            wildcards.add(word.toLowerCase(Locale.ROOT));
        } else {
            words.add(word);
        }
    }

    private static void addPhrase(StringBuilder current, List<String> phrases) {
        String phrase = WHITESPACE.matcher(current.toString()).replaceAll(" ").trim();
        current.setLength(0);
        if (!phrase.isEmpty()) {
            phrases.add(phrase);
        }
    }

    record DatePartial(String month, String remainder) {
    }
}
