package ch.so.arp.rag.memory;

import java.util.List;

/**
 * Last stage: any stored documents, so that a search on a non-empty store never
 * comes back empty handed.
 */
class AnyDocumentsStrategy implements LexicalFallbackStrategy {

    private final DocumentRepository repository;

    AnyDocumentsStrategy(DocumentRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return "any-documents";
    }

    @Override
    public List<Document> find(LexicalQuery query, int topK) {
        return repository.findAll(topK);
    }
}
