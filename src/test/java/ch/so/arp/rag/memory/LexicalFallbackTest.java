package ch.so.arp.rag.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class LexicalFallbackTest {

    private final InMemoryDocumentRepository repository = new InMemoryDocumentRepository();
    private final LexicalFallback fallback = LexicalFallback.standard(repository, 100);

    @BeforeEach
    void storeDocuments() {
        repository.upsert(StoreFixtures.row("policy", "Remote work policy allows 3 days per week", 1.0f));
        repository.upsert(StoreFixtures.row("apollo", "Status of project apollo: launch delayed", 1.0f));
        repository.upsert(StoreFixtures.row("budget", "Quarterly budget approved by finance", 1.0f));
    }

    @Test
    void matchesAllQueryWords() {
        List<SearchHit> hits = fallback.search("Remote work policy?", 8);

        assertThat(hits).extracting(hit -> hit.document().id()).containsExactly("policy");
        assertThat(hits).allMatch(hit -> hit.source() == SearchHit.MatchSource.LEXICAL && hit.score() == 0.0d);
    }

    @Test
    void dropsLeadingWordsUntilSomethingMatches() {
        List<SearchHit> hits = fallback.search("what the remote work policy", 8);

        assertThat(hits).extracting(hit -> hit.document().id()).containsExactly("policy");
    }

    @Test
    void triesAtMostFourWordSuffixes() {
        WordSuffixStrategy strategy = new WordSuffixStrategy(repository);

        assertThat(strategy.find(LexicalQuery.parse("one two three four remote work"), 8)).isEmpty();
        assertThat(strategy.find(LexicalQuery.parse("one two three remote work"), 8))
                .extracting(Document::id).containsExactly("policy");
    }

    @Test
    void looksUpProjectByName() {
        List<SearchHit> hits = fallback.search("latest news on the project apollo", 8);

        assertThat(hits).extracting(hit -> hit.document().id()).containsExactly("apollo");
    }

    @Test
    void ignoresProjectKeywordWithoutName() {
        ProjectKeywordStrategy strategy = new ProjectKeywordStrategy(repository);

        assertThat(strategy.find(LexicalQuery.parse("tell me about the project"), 8)).isEmpty();
        assertThat(strategy.find(LexicalQuery.parse("no keyword here"), 8)).isEmpty();
        assertThat(strategy.find(LexicalQuery.parse("Project Apollo timeline"), 8))
                .extracting(Document::id).containsExactly("apollo");
    }

    @Test
    void keepsDocumentsContainingAnyTerm() {
        repository.upsert(StoreFixtures.row("approved", "Vacation requests approved in bulk", 1.0f));

        List<SearchHit> hits = fallback.search("was the budget finally approved yesterday", 8);

        assertThat(hits).extracting(hit -> hit.document().id()).containsExactly("budget", "approved");
    }

    @Test
    void termScanHonoursScanLimitAndTopK() {
        TermScanStrategy strategy = new TermScanStrategy(repository, 2);

        assertThat(strategy.find(LexicalQuery.parse("budget"), 8)).isEmpty();
        assertThat(new TermScanStrategy(repository, 100).find(LexicalQuery.parse("of by per"), 1))
                .extracting(Document::id).containsExactly("policy");
    }

    @Test
    void returnsAnyDocumentsAsLastResort() {
        List<SearchHit> hits = fallback.search("xyzzy", 2);

        assertThat(hits).extracting(hit -> hit.document().id()).containsExactly("policy", "apollo");
    }

    @Test
    void continuesWithNextStrategyAfterFailure() {
        List<String> attempted = new ArrayList<>();
        LexicalFallback chain = new LexicalFallback(List.of(
                strategy("broken", attempted, () -> {
                    throw new DataAccessResourceFailureException("timeout");
                }),
                strategy("empty", attempted, List::of),
                strategy("working", attempted, () -> repository.findAll(1))));

        List<SearchHit> hits = chain.search("anything", 8);

        assertThat(attempted).containsExactly("broken", "empty", "working");
        assertThat(hits).extracting(hit -> hit.document().id()).containsExactly("policy");
    }

    @Test
    void failsWhenEveryStrategyFails() {
        LexicalFallback chain = new LexicalFallback(List.of(
                strategy("first", new ArrayList<>(), () -> {
                    throw new DataAccessResourceFailureException("down");
                }),
                strategy("second", new ArrayList<>(), () -> {
                    throw new DataAccessResourceFailureException("still down");
                })));

        assertThatThrownBy(() -> chain.search("anything", 8))
                .isInstanceOf(PersistenceException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void returnsEmptyWhenLaterStrategyReachesEmptyStore() {
        List<String> attempted = new ArrayList<>();
        LexicalFallback chain = new LexicalFallback(List.of(
                strategy("flaky", attempted, () -> {
                    throw new DataAccessResourceFailureException("connection reset");
                }),
                strategy("empty store", attempted, List::of)));

        assertThat(chain.search("anything", 8)).isEmpty();
        assertThat(attempted).containsExactly("flaky", "empty store");
    }

    @Test
    void failsWhenLastStrategyFailsAfterEmptyOnes() {
        LexicalFallback chain = new LexicalFallback(List.of(
                strategy("empty", new ArrayList<>(), List::of),
                strategy("unreachable", new ArrayList<>(), () -> {
                    throw new DataAccessResourceFailureException("connection refused");
                })));

        assertThatThrownBy(() -> chain.search("anything", 8)).isInstanceOf(PersistenceException.class);
    }

    @Test
    void returnsEmptyWhenNothingIsStored() {
        LexicalFallback emptyFallback = LexicalFallback.standard(new InMemoryDocumentRepository(), 100);

        assertThat(emptyFallback.search("remote work", 8)).isEmpty();
    }

    private static LexicalFallbackStrategy strategy(String name, List<String> attempted,
            java.util.function.Supplier<List<Document>> result) {
        return new LexicalFallbackStrategy() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<Document> find(LexicalQuery query, int topK) {
                attempted.add(name);
                return result.get();
            }
        };
    }
}
