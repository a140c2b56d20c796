package ch.so.arp.rag.memory;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint exposing the document store to agent tools. Every answer is
 * wrapped in a {@link StoreResponse}.
 */
@RestController
@RequestMapping(path = "/api/documents", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class DocumentController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentController.class);

    private final DocumentStore documentStore;

    public DocumentController(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @PutMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public StoreResponse upsert(@PathVariable String id, @Valid @RequestBody UpsertRequest request) {
        LOGGER.info("Storing document: id={}", id);
        return StoreResponse.document(documentStore.upsert(id, request.content(), request.metadata()));
    }

    @PostMapping(path = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public StoreResponse upsertBatch(@RequestBody List<DocumentInput> documents) {
        LOGGER.info("Storing {} documents", documents.size());
        List<Document> written = documentStore.upsertBatch(documents);
        return StoreResponse.count("Successfully processed " + written.size() + " documents", written.size());
    }

    @GetMapping("/count")
    public StoreResponse count() {
        return StoreResponse.count(null, documentStore.count());
    }

    @GetMapping("/{id}")
    public ResponseEntity<StoreResponse> get(@PathVariable String id) {
        return documentStore.get(id)
                .map(document -> ResponseEntity.ok(StoreResponse.document(document)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(StoreResponse.message(StoreResponse.NOT_FOUND, "Document " + id + " not found")));
    }

    @DeleteMapping("/{id}")
    public StoreResponse delete(@PathVariable String id) {
        LOGGER.info("Deleting document: id={}", id);
        if (documentStore.delete(id)) {
            return StoreResponse.message(StoreResponse.SUCCESS, "Document " + id + " deleted");
        }
        return StoreResponse.message(StoreResponse.WARNING, "Document " + id + " not found");
    }

    @PostMapping(path = "/batch-delete", consumes = MediaType.APPLICATION_JSON_VALUE)
    public StoreResponse deleteBatch(@RequestBody List<String> ids) {
        int removed = documentStore.deleteBatch(ids);
        return StoreResponse.count("Deleted " + removed + " documents", removed);
    }

    @PostMapping(path = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
    public StoreResponse search(@Valid @RequestBody SearchRequest request) {
        int topK = request.topK() != null ? request.topK() : documentStore.defaultTopK();
        List<SearchHit> hits = request.scoreThreshold() != null
                ? documentStore.search(request.query(), topK, request.scoreThreshold())
                : documentStore.search(request.query(), topK);
        LOGGER.info("Found {} results for: {}", hits.size(), request.query());
        return StoreResponse.hits(hits);
    }
}
