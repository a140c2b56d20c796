package ch.so.arp.rag.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Process local replacement for the PostgreSQL repository. Rows live in an
 * insertion ordered map so that store order and tie-breaks match the
 * {@code BIGSERIAL} ordering of the database table.
 */
class InMemoryDocumentRepository implements DocumentRepository {

    private final Map<String, Document> rows = new LinkedHashMap<>();
    private final Clock clock;

    InMemoryDocumentRepository() {
        this(Clock.systemUTC());
    }

    InMemoryDocumentRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Document upsert(EmbeddedDocument document) {
        Instant now = clock.instant();
        Document existing = rows.get(document.id());
        Instant createdAt = existing != null ? existing.createdAt() : now;
        Instant updatedAt = now;
        // updatedAt must advance even when the clock did not
        if (existing != null && !now.isAfter(existing.updatedAt())) {
            updatedAt = existing.updatedAt().plusNanos(1);
        }
        Document stored = new Document(document.id(), document.content(), document.vector().clone(),
                copyOf(document.metadata()), createdAt, updatedAt);
        rows.put(document.id(), stored);
        return copy(stored);
    }

    @Override
    public synchronized List<Document> upsertAll(List<EmbeddedDocument> documents) {
        List<Document> stored = new ArrayList<>(documents.size());
        for (EmbeddedDocument document : documents) {
            stored.add(upsert(document));
        }
        return stored;
    }

    @Override
    public synchronized boolean deleteById(String id) {
        return rows.remove(id) != null;
    }

    @Override
    public synchronized int deleteAllById(Collection<String> ids) {
        int removed = 0;
        for (String id : Set.copyOf(ids)) {
            if (rows.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized Optional<Document> findById(String id) {
        return Optional.ofNullable(rows.get(id)).map(InMemoryDocumentRepository::copy);
    }

    @Override
    public synchronized long count() {
        return rows.size();
    }

    @Override
    public synchronized List<Document> findByContentFragments(List<String> fragments, int limit) {
        return rows.values().stream()
                .filter(row -> containsInOrder(row.content(), fragments))
                .limit(limit)
                .map(InMemoryDocumentRepository::copy)
                .toList();
    }

    @Override
    public synchronized List<Document> findAll(int limit) {
        return rows.values().stream().limit(limit).map(InMemoryDocumentRepository::copy).toList();
    }

    @Override
    public synchronized List<SearchHit> findNearest(float[] vector, int limit) {
        // Stream.sorted is stable, equal scores keep insertion order
        return rows.values().stream()
                .map(row -> new SearchHit(copy(row), cosineSimilarity(vector, row.vector()),
                        SearchHit.MatchSource.VECTOR))
                .sorted(Comparator.comparingDouble(SearchHit::score).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public boolean isReady() {
        return true;
    }

    static double cosineSimilarity(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                    "Vector dimensions differ: " + left.length + " != " + right.length);
        }
        double dot = 0.0d;
        double leftNorm = 0.0d;
        double rightNorm = 0.0d;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0d || rightNorm == 0.0d) {
            return 0.0d;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private static boolean containsInOrder(String content, List<String> fragments) {
        String normalized = content.toLowerCase(Locale.ROOT);
        int position = 0;
        for (String fragment : fragments) {
            String needle = fragment.toLowerCase(Locale.ROOT);
            int found = normalized.indexOf(needle, position);
            if (found < 0) {
                return false;
            }
            position = found + needle.length();
        }
        return true;
    }

    private static Document copy(Document row) {
        return new Document(row.id(), row.content(), row.vector().clone(), row.metadata().deepCopy(),
                row.createdAt(), row.updatedAt());
    }

    private static ObjectNode copyOf(ObjectNode metadata) {
        return metadata == null ? JsonNodeFactory.instance.objectNode() : metadata.deepCopy();
    }
}
