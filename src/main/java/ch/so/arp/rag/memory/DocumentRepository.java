package ch.so.arp.rag.memory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Capability set of the persistence backend: a keyed row store with pattern
 * filtering over the content column and cosine similarity ranking. Failures are
 * reported as Spring {@link org.springframework.dao.DataAccessException}s.
 */
public interface DocumentRepository {

    /**
     * Insert or replace the row with the document's id.
     *
     * @return the stored row including its timestamps
     */
    Document upsert(EmbeddedDocument document);

    /**
     * Insert or replace all rows in one write.
     *
     * @return the stored rows in input order
     */
    List<Document> upsertAll(List<EmbeddedDocument> documents);

    /**
     * @return {@code true} if a row was removed
     */
    boolean deleteById(String id);

    /**
     * @return number of rows removed, unknown ids are ignored
     */
    int deleteAllById(Collection<String> ids);

    Optional<Document> findById(String id);

    long count();

    /**
     * Case-insensitive match of rows whose content contains all fragments in the
     * given order, equivalent to {@code content ILIKE '%f1%f2%'}. Rows come back
     * in store order.
     *
     * @param fragments literal text fragments, matched without wildcards
     * @param limit     maximum number of rows
     */
    List<Document> findByContentFragments(List<String> fragments, int limit);

    /**
     * @return up to {@code limit} rows in store order
     */
    List<Document> findAll(int limit);

    /**
     * Rank rows by cosine similarity with the vector, best first. Rows with the
     * same score keep store order.
     */
    List<SearchHit> findNearest(float[] vector, int limit);

    /**
     * @return {@code true} if the backing table exists and vector operations work
     */
    boolean isReady();
}
