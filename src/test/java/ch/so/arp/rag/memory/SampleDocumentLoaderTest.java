package ch.so.arp.rag.memory;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import com.fasterxml.jackson.databind.ObjectMapper;

class SampleDocumentLoaderTest {

    private final DocumentStore store = StoreFixtures.store(new InMemoryDocumentRepository(),
            new DeterministicEmbeddingProvider(StoreFixtures.DIMENSIONS));
    private final SampleDocumentLoader loader = new SampleDocumentLoader(store, new ObjectMapper());

    @Test
    void readsBundledSamples() throws Exception {
        List<DocumentInput> samples = loader.readSamples();

        assertThat(samples).hasSize(6);
        assertThat(samples).extracting(DocumentInput::id).contains("company_mission", "remote_work_policy");
        assertThat(samples.get(1).metadata().path("year").asInt()).isEqualTo(2025);
    }

    @Test
    void seedsStoreAndStaysIdempotent() throws Exception {
        loader.run(new DefaultApplicationArguments());
        loader.run(new DefaultApplicationArguments());

        assertThat(store.count()).isEqualTo(6);
        assertThat(store.search("Remote work policy allows 3 days per week of working from home, "
                + "with core collaboration hours between 10am and 3pm.", 1)).singleElement()
                .satisfies(hit -> assertThat(hit.document().id()).isEqualTo("remote_work_policy"));
    }
}
