package ch.so.arp.rag.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Entry point of the memory store. Validates input, embeds content through the
 * {@link Embedder}, persists rows via the {@link DocumentRepository} and exposes
 * {@link SimilaritySearch}. Backend failures surface as
 * {@link PersistenceException}.
 */
public class DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentStore.class);

    private final DocumentRepository repository;
    private final Embedder embedder;
    private final SimilaritySearch similaritySearch;
    private final int dimensions;
    private final int batchSize;
    private final int defaultTopK;

    public DocumentStore(DocumentRepository repository, Embedder embedder, SimilaritySearch similaritySearch,
            DocumentStoreProperties properties) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.similaritySearch = Objects.requireNonNull(similaritySearch, "similaritySearch");
        this.dimensions = properties.getDimensions();
        this.batchSize = properties.getBatchSize();
        this.defaultTopK = properties.getDefaultTopK();
    }

    /**
     * Insert or replace a document.
     *
     * @throws ValidationException           for blank id or content
     * @throws EmbeddingUnavailableException if the content could not be embedded
     * @throws PersistenceException          if the write failed
     */
    public Document upsert(String id, String content, ObjectNode metadata) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Document content cannot be empty");
        }
        requireId(id);
        float[] vector = embedder.embedOne(content);
        EmbeddedDocument row = toRow(new DocumentInput(id, content, metadata), vector, 0);
        try {
            Document stored = repository.upsert(row);
            LOGGER.debug("Stored document {}", id);
            return stored;
        } catch (DataAccessException ex) {
            throw new PersistenceException("Upsert of document " + id + " failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Insert or replace many documents, chunk by chunk. Inputs without id or
     * content are skipped. Chunks whose embedding failed are skipped as well and
     * reported in the log; compare the result size with the input to reconcile.
     *
     * @return the written documents in input order
     * @throws EmbeddingUnavailableException if no chunk could be embedded at all
     * @throws PersistenceException          if a chunk write failed; remaining
     *                                       chunks are not attempted
     */
    public List<Document> upsertBatch(List<DocumentInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return List.of();
        }
        List<Document> written = new ArrayList<>(inputs.size());
        int skipped = 0;
        int embeddingFailures = 0;
        for (int start = 0; start < inputs.size(); start += batchSize) {
            List<DocumentInput> chunk = inputs.subList(start, Math.min(start + batchSize, inputs.size()));
            List<DocumentInput> valid = chunk.stream().filter(DocumentInput::isEmbeddable).toList();
            skipped += chunk.size() - valid.size();
            if (valid.isEmpty()) {
                continue;
            }

            EmbeddingBatch embeddings = embedder.embedMany(valid.stream().map(DocumentInput::content).toList());
            if (!embeddings.isComplete()) {
                embeddingFailures += embeddings.failedIndexes().size();
            }
            List<EmbeddedDocument> rows = new ArrayList<>(embeddings.embeddedCount());
            for (EmbeddingBatch.Embedded embedded : embeddings.embeddings()) {
                rows.add(toRow(valid.get(embedded.index()), embedded.vector(), written.size()));
            }
            if (rows.isEmpty()) {
                continue;
            }
            try {
                written.addAll(repository.upsertAll(rows));
            } catch (DataAccessException ex) {
                throw new PersistenceException("Batch upsert failed after " + written.size()
                        + " committed documents: " + ex.getMessage(), ex, written.size());
            }
        }
        if (skipped > 0) {
            LOGGER.warn("Skipped {} documents without id or content", skipped);
        }
        if (embeddingFailures > 0) {
            LOGGER.warn("{} documents could not be embedded, {} of {} written", embeddingFailures, written.size(),
                    inputs.size());
            if (written.isEmpty()) {
                throw new EmbeddingUnavailableException(
                        "None of the " + embeddingFailures + " documents could be embedded", null);
            }
        }
        LOGGER.debug("Batch upsert wrote {} of {} documents", written.size(), inputs.size());
        return written;
    }

    /**
     * @return {@code true} if the document existed and was removed
     */
    public boolean delete(String id) {
        requireId(id);
        try {
            return repository.deleteById(id);
        } catch (DataAccessException ex) {
            throw new PersistenceException("Delete of document " + id + " failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * @return number of documents removed; blank and unknown ids are ignored
     */
    public int deleteBatch(Collection<String> ids) {
        if (ids == null) {
            return 0;
        }
        List<String> validIds = ids.stream().filter(id -> id != null && !id.isBlank()).distinct().toList();
        if (validIds.isEmpty()) {
            return 0;
        }
        try {
            return repository.deleteAllById(validIds);
        } catch (DataAccessException ex) {
            throw new PersistenceException("Batch delete failed: " + ex.getMessage(), ex);
        }
    }

    public Optional<Document> get(String id) {
        requireId(id);
        try {
            return repository.findById(id);
        } catch (DataAccessException ex) {
            throw new PersistenceException("Lookup of document " + id + " failed: " + ex.getMessage(), ex);
        }
    }

    public long count() {
        try {
            return repository.count();
        } catch (DataAccessException ex) {
            throw new PersistenceException("Counting documents failed: " + ex.getMessage(), ex);
        }
    }

    public List<SearchHit> search(String query) {
        return similaritySearch.search(query, defaultTopK);
    }

    public List<SearchHit> search(String query, int topK) {
        return similaritySearch.search(query, topK);
    }

    public List<SearchHit> search(String query, int topK, double scoreThreshold) {
        return similaritySearch.search(query, topK, scoreThreshold);
    }

    public int defaultTopK() {
        return defaultTopK;
    }

    private EmbeddedDocument toRow(DocumentInput input, float[] vector, int committed) {
        if (vector.length != dimensions) {
            throw new PersistenceException("Vector of document " + input.id() + " has " + vector.length
                    + " dimensions, expected " + dimensions, null, committed);
        }
        return new EmbeddedDocument(input.id(), input.content(), vector, input.metadata());
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Document ID is required");
        }
    }
}
