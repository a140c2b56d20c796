package ch.so.arp.rag.memory;

/**
 * Search result. Vector hits carry {@code 1 - cosine distance} as score,
 * lexical fallback hits always score {@code 0}.
 */
public record SearchHit(Document document, double score, MatchSource source) {

    static SearchHit lexical(Document document) {
        return new SearchHit(document, 0.0d, MatchSource.LEXICAL);
    }

    /**
     * How a hit was found.
     */
    public enum MatchSource {
        VECTOR,
        LEXICAL
    }
}
