package ch.so.arp.rag.memory;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scans a bounded number of documents client side and keeps those containing
 * any single query term.
 */
class TermScanStrategy implements LexicalFallbackStrategy {

    private final DocumentRepository repository;
    private final int scanLimit;

    TermScanStrategy(DocumentRepository repository, int scanLimit) {
        this.repository = repository;
        this.scanLimit = scanLimit;
    }

    @Override
    public String name() {
        return "term-scan";
    }

    @Override
    public List<Document> find(LexicalQuery query, int topK) {
        Set<String> terms = query.terms();
        if (terms.isEmpty()) {
            return List.of();
        }
        return repository.findAll(scanLimit).stream()
                .filter(document -> containsAny(document.content(), terms))
                .limit(topK)
                .toList();
    }

    private static boolean containsAny(String content, Set<String> terms) {
        String normalized = content.toLowerCase(Locale.ROOT);
        return terms.stream().anyMatch(normalized::contains);
    }
}
