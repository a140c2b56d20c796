package ch.so.arp.rag.memory;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Best effort search over the content column, used when similarity search is
 * unavailable or empty. The strategies run in order and the first non-empty
 * result wins. Results are not ranked by relevance.
 */
public class LexicalFallback {

    private static final Logger LOGGER = LoggerFactory.getLogger(LexicalFallback.class);

    private final List<LexicalFallbackStrategy> strategies;

    LexicalFallback(List<LexicalFallbackStrategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Default chain: word suffixes, project keyword, term scan, any documents.
     */
    public static LexicalFallback standard(DocumentRepository repository, int scanLimit) {
        Objects.requireNonNull(repository, "repository");
        return new LexicalFallback(List.of(
                new WordSuffixStrategy(repository),
                new ProjectKeywordStrategy(repository),
                new TermScanStrategy(repository, scanLimit),
                new AnyDocumentsStrategy(repository)));
    }

    /**
     * An empty strategy result clears an earlier backend error, so a reachable
     * store that holds nothing matching yields an empty list.
     *
     * @return hits from the first strategy that found anything, or an empty list
     * @throws PersistenceException if nothing was found and the last strategy
     *                              failed with a backend error
     */
    public List<SearchHit> search(String query, int topK) {
        LOGGER.info("Using fallback search for: {}", query);
        LexicalQuery lexicalQuery = LexicalQuery.parse(query);
        DataAccessException lastFailure = null;
        for (LexicalFallbackStrategy strategy : strategies) {
            try {
                List<Document> documents = strategy.find(lexicalQuery, topK);
                if (!documents.isEmpty()) {
                    LOGGER.info("Found {} results with fallback strategy {}", documents.size(), strategy.name());
                    return documents.stream().limit(topK).map(SearchHit::lexical).toList();
                }
                lastFailure = null;
            } catch (DataAccessException ex) {
                LOGGER.warn("Fallback strategy {} failed: {}", strategy.name(), ex.getMessage());
                lastFailure = ex;
            }
        }
        if (lastFailure != null) {
            throw new PersistenceException("Lexical fallback found nothing and the store reported errors",
                    lastFailure);
        }
        LOGGER.info("Fallback search found nothing for: {}", query);
        return List.of();
    }
}
