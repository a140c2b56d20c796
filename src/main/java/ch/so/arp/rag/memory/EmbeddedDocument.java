package ch.so.arp.rag.memory;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Row handed to a {@link DocumentRepository} for writing.
 */
public record EmbeddedDocument(String id, String content, float[] vector, ObjectNode metadata) {
}
