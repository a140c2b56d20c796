package ch.so.arp.rag.memory;

import java.util.List;

/**
 * Strategy abstraction over the remote embedding model. Implementations either
 * call an embedding API or compute deterministic placeholders that are suited
 * for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create one embedding per input text.
     *
     * @param texts the texts to embed, never empty
     * @return one vector per input, in input order
     * @throws EmbeddingProviderException if the service fails; the exception
     *                                    tells whether a retry may help
     */
    List<float[]> embed(List<String> texts);

    /**
     * @return identifier of the model producing the vectors
     */
    default String modelName() {
        return getClass().getSimpleName();
    }
}
