package ch.so.arp.rag.memory;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Cosine similarity search that degrades to the {@link LexicalFallback} instead
 * of failing. Embedding or backend errors and empty vector results hand the
 * query over to the fallback.
 */
public class SimilaritySearch {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimilaritySearch.class);

    private final Embedder embedder;
    private final DocumentRepository repository;
    private final LexicalFallback lexicalFallback;

    public SimilaritySearch(Embedder embedder, DocumentRepository repository, LexicalFallback lexicalFallback) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.lexicalFallback = Objects.requireNonNull(lexicalFallback, "lexicalFallback");
    }

    /**
     * Search without a score cutoff.
     */
    public List<SearchHit> search(String query, int topK) {
        return search(query, topK, Double.NEGATIVE_INFINITY);
    }

    /**
     * @param scoreThreshold vector hits scoring below this value are dropped;
     *                       scores range from -1 to 1
     * @throws ValidationException           for a blank query or a non positive topK
     * @throws EmbeddingUnavailableException if the query could not be embedded
     *                                       and the fallback found nothing
     */
    public List<SearchHit> search(String query, int topK, double scoreThreshold) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query cannot be empty");
        }
        if (topK <= 0) {
            throw new ValidationException("topK must be positive but was " + topK);
        }

        EmbeddingUnavailableException embeddingFailure = null;
        try {
            float[] queryVector = embedder.embedOne(query);
            List<SearchHit> hits = repository.findNearest(queryVector, topK);
            if (!hits.isEmpty()) {
                return hits.stream().filter(hit -> hit.score() >= scoreThreshold).toList();
            }
            LOGGER.info("Vector search returned no rows, falling back to lexical search");
        } catch (EmbeddingUnavailableException ex) {
            LOGGER.warn("Query embedding unavailable, falling back to lexical search: {}", ex.getMessage());
            embeddingFailure = ex;
        } catch (DataAccessException ex) {
            LOGGER.warn("Vector search failed, falling back to lexical search: {}", ex.getMessage());
        }

        List<SearchHit> fallbackHits;
        try {
            fallbackHits = lexicalFallback.search(query, topK);
        } catch (PersistenceException ex) {
            if (embeddingFailure != null) {
                embeddingFailure.addSuppressed(ex);
                throw embeddingFailure;
            }
            throw ex;
        }
        if (fallbackHits.isEmpty() && embeddingFailure != null) {
            throw embeddingFailure;
        }
        return fallbackHits;
    }
}
