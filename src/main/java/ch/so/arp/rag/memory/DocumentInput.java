package ch.so.arp.rag.memory;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Caller supplied document before it is embedded.
 */
public record DocumentInput(String id, String content, ObjectNode metadata) {

    boolean isEmbeddable() {
        return id != null && !id.isBlank() && content != null && !content.isBlank();
    }
}
