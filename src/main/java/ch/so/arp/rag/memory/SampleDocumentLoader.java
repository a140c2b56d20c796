package ch.so.arp.rag.memory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Seeds the store with the bundled sample documents when
 * {@code memory.store.seed-samples} is enabled.
 */
class SampleDocumentLoader implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SampleDocumentLoader.class);

    static final String SAMPLES_LOCATION = "sample-documents.json";

    private final DocumentStore documentStore;
    private final ObjectMapper objectMapper;

    SampleDocumentLoader(DocumentStore documentStore, ObjectMapper objectMapper) {
        this.documentStore = documentStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<DocumentInput> samples = readSamples();
        List<Document> written = documentStore.upsertBatch(samples);
        LOGGER.info("Seeded {} of {} sample documents, store now holds {}", written.size(), samples.size(),
                documentStore.count());
    }

    List<DocumentInput> readSamples() throws IOException {
        try (InputStream input = new ClassPathResource(SAMPLES_LOCATION).getInputStream()) {
            return objectMapper.readValue(input, new TypeReference<List<DocumentInput>>() {
            });
        }
    }
}
