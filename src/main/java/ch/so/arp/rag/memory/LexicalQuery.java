package ch.so.arp.rag.memory;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Query text prepared for lexical matching: lowercased, with question marks and
 * periods removed, split on whitespace.
 */
record LexicalQuery(String text, List<String> words) {

    static LexicalQuery parse(String text) {
        String normalized = text.toLowerCase(Locale.ROOT).replace("?", "").replace(".", "");
        List<String> words = Arrays.stream(normalized.split("\\s+"))
                .filter(word -> !word.isEmpty())
                .toList();
        return new LexicalQuery(text, words);
    }

    /**
     * @return the distinct words, in order of first appearance
     */
    Set<String> terms() {
        return new LinkedHashSet<>(words);
    }

    String lowercaseText() {
        return text.toLowerCase(Locale.ROOT);
    }
}
