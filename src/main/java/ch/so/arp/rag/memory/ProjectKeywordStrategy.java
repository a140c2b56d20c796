package ch.so.arp.rag.memory;

import java.util.List;

/**
 * Looks up {@code "project <name>"} when the query mentions a project. Kept
 * literal: only the English keyword "project" triggers it.
 */
class ProjectKeywordStrategy implements LexicalFallbackStrategy {

    private static final String KEYWORD = "project";

    private final DocumentRepository repository;

    ProjectKeywordStrategy(DocumentRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return "project-keyword";
    }

    @Override
    public List<Document> find(LexicalQuery query, int topK) {
        String text = query.lowercaseText();
        int position = text.indexOf(KEYWORD);
        if (position < 0) {
            return List.of();
        }
        String remainder = text.substring(position + KEYWORD.length()).trim();
        if (remainder.isEmpty()) {
            return List.of();
        }
        String projectName = remainder.split("\\s+")[0];
        return repository.findByContentFragments(List.of(KEYWORD + " " + projectName), topK);
    }
}
