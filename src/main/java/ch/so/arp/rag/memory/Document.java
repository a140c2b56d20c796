package ch.so.arp.rag.memory;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A stored document. The metadata is kept verbatim and never used for ranking.
 */
public record Document(
        String id,
        String content,
        @JsonIgnore float[] vector,
        ObjectNode metadata,
        Instant createdAt,
        Instant updatedAt) {

    /**
     * @return number of dimensions of the stored vector
     */
    public int dimensions() {
        return vector == null ? 0 : vector.length;
    }
}
