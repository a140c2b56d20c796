package ch.so.arp.rag.memory;

import java.util.List;

/**
 * One stage of the {@link LexicalFallback}. Returns an empty list when it has
 * nothing to offer so the next stage gets its turn.
 */
interface LexicalFallbackStrategy {

    String name();

    List<Document> find(LexicalQuery query, int topK);
}
