package ch.so.arp.rag.memory;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope returned by the document API. Only the fields relevant to the
 * operation are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreResponse(
        String status,
        String message,
        Document document,
        List<SearchHit> hits,
        Long count) {

    static final String SUCCESS = "success";
    static final String WARNING = "warning";
    static final String NOT_FOUND = "not_found";
    static final String ERROR = "error";

    static StoreResponse document(Document document) {
        return new StoreResponse(SUCCESS, null, document, null, null);
    }

    static StoreResponse hits(List<SearchHit> hits) {
        return new StoreResponse(SUCCESS, null, null, hits, (long) hits.size());
    }

    static StoreResponse count(String message, long count) {
        return new StoreResponse(SUCCESS, message, null, null, count);
    }

    static StoreResponse message(String status, String message) {
        return new StoreResponse(status, message, null, null, null);
    }
}
