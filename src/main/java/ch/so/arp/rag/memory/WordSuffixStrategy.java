package ch.so.arp.rag.memory;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches documents containing the query words in order, first with all words
 * and then dropping leading words one at a time.
 */
class WordSuffixStrategy implements LexicalFallbackStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(WordSuffixStrategy.class);

    static final int MAX_ATTEMPTS = 4;

    private final DocumentRepository repository;

    WordSuffixStrategy(DocumentRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return "word-suffix";
    }

    @Override
    public List<Document> find(LexicalQuery query, int topK) {
        List<String> words = query.words();
        int attempts = Math.min(words.size(), MAX_ATTEMPTS);
        for (int start = 0; start < attempts; start++) {
            List<String> suffix = words.subList(start, words.size());
            List<Document> matches = repository.findByContentFragments(suffix, topK);
            if (!matches.isEmpty()) {
                LOGGER.debug("Found {} documents for words {}", matches.size(), suffix);
                return matches;
            }
        }
        return List.of();
    }
}
