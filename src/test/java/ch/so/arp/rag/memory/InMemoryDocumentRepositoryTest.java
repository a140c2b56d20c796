package ch.so.arp.rag.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

class InMemoryDocumentRepositoryTest {

    private final InMemoryDocumentRepository repository = new InMemoryDocumentRepository(
            Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    void replacesRowAndAdvancesUpdatedAt() {
        Document first = repository.upsert(StoreFixtures.row("a", "first", 1.0f));
        Document second = repository.upsert(StoreFixtures.row("a", "second", 0.0f, 1.0f));

        assertThat(repository.count()).isEqualTo(1);
        assertThat(second.content()).isEqualTo("second");
        assertThat(second.createdAt()).isEqualTo(first.createdAt());
        assertThat(second.updatedAt()).isAfter(first.updatedAt());
    }

    @Test
    void keepsStoredRowsIsolatedFromCallerMutation() {
        EmbeddedDocument row = StoreFixtures.row("a", "content", 1.0f);
        repository.upsert(row);

        row.vector()[0] = 42.0f;
        row.metadata().put("id", "changed");

        Document stored = repository.findById("a").orElseThrow();
        assertThat(stored.vector()[0]).isEqualTo(1.0f);
        assertThat(stored.metadata().get("id").asText()).isEqualTo("a");
    }

    @Test
    void matchesFragmentsInOrderIgnoringCase() {
        repository.upsert(StoreFixtures.row("policy", "Remote work policy allows 3 days per week", 1.0f));
        repository.upsert(StoreFixtures.row("other", "Policy on remote work", 1.0f));

        assertThat(repository.findByContentFragments(List.of("remote", "policy"), 10))
                .extracting(Document::id).containsExactly("policy");
        assertThat(repository.findByContentFragments(List.of("WORK"), 10))
                .extracting(Document::id).containsExactly("policy", "other");
        assertThat(repository.findByContentFragments(List.of("work"), 1)).hasSize(1);
    }

    @Test
    void ranksByCosineSimilarityKeepingInsertionOrderForTies() {
        repository.upsert(StoreFixtures.row("orthogonal", "x", 0.0f, 1.0f));
        repository.upsert(StoreFixtures.row("tie-1", "y", 2.0f));
        repository.upsert(StoreFixtures.row("tie-2", "z", 5.0f));
        repository.upsert(StoreFixtures.row("opposite", "w", -1.0f));

        List<SearchHit> hits = repository.findNearest(StoreFixtures.vector(1.0f), 3);

        assertThat(hits).extracting(hit -> hit.document().id()).containsExactly("tie-1", "tie-2", "orthogonal");
        assertThat(hits.get(0).score()).isCloseTo(1.0d, within(1e-6));
        assertThat(hits.get(2).score()).isCloseTo(0.0d, within(1e-6));
        assertThat(hits).allMatch(hit -> hit.source() == SearchHit.MatchSource.VECTOR);
    }

    @Test
    void deletesOnlyExistingRows() {
        repository.upsert(StoreFixtures.row("a", "a", 1.0f));
        repository.upsert(StoreFixtures.row("b", "b", 1.0f));

        assertThat(repository.deleteAllById(List.of("a", "a", "missing"))).isEqualTo(1);
        assertThat(repository.deleteById("a")).isFalse();
        assertThat(repository.findAll(10)).extracting(Document::id).containsExactly("b");
    }

    @Test
    void scoresZeroVectorsAsUnrelated() {
        assertThat(InMemoryDocumentRepository.cosineSimilarity(new float[2], new float[] { 1.0f, 0.0f }))
                .isZero();
    }
}
