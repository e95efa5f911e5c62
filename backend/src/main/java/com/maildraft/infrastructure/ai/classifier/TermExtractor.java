package com.maildraft.infrastructure.ai.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into lower-cased word unigrams and bigrams.
 * Tokens are runs of two or more word characters, so "I" and "a" are dropped and
 * "not a student" yields the bigram "not student".
 */
final class TermExtractor {

    private static final Pattern TOKEN = Pattern.compile("(?U)\\b\\w\\w+\\b");

    private TermExtractor() {
    }

    static List<String> terms(String text) {
        List<String> tokens = tokens(text);
        List<String> terms = new ArrayList<>(tokens.size() * 2);
        terms.addAll(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            terms.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return terms;
    }

    static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
