package ch.so.arp.rag.memory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

/**
 * Checks on startup whether the persistence backend is usable and logs the
 * provisioning DDL when it is not. The application keeps running either way so
 * that the schema can be created afterwards.
 */
class SchemaVerifier implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaVerifier.class);

    static final String SCHEMA_LOCATION = "schema.sql";

    private final DocumentRepository repository;
    private final Embedder embedder;

    SchemaVerifier(DocumentRepository repository, Embedder embedder) {
        this.repository = repository;
        this.embedder = embedder;
    }

    @Override
    public void run(ApplicationArguments args) {
        verify();
    }

    boolean verify() {
        if (repository.isReady()) {
            LOGGER.info("Document store ready with {} dimensions using model {}", embedder.dimensions(),
                    embedder.modelName());
            return true;
        }
        LOGGER.warn("Database not set up properly. Run the following statements to create the schema:\n{}",
                provisioningScript());
        return false;
    }

    String provisioningScript() {
        try {
            return StreamUtils.copyToString(new ClassPathResource(SCHEMA_LOCATION).getInputStream(),
                    StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.warn("Unable to read {}: {}", SCHEMA_LOCATION, ex.getMessage());
            return "-- see " + SCHEMA_LOCATION;
        }
    }
}
