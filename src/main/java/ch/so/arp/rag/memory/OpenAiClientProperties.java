package ch.so.arp.rag.memory;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration properties describing how to reach the OpenAI compatible
 * embeddings endpoint.
 */
@ConfigurationProperties(prefix = "memory.store.openai")
public class OpenAiClientProperties implements EnvironmentAware {

    /**
     * API key that authorises requests against the embeddings endpoint.
     */
    private String apiKey;

    /**
     * Base URL for the API. Defaults to the public OpenAI endpoint.
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Name of the embedding model. The default produces 1536 dimensions.
     */
    private String model = "text-embedding-3-small";

    /**
     * Timeout applied to a single embeddings request.
     */
    private Duration timeout = Duration.ofSeconds(30);

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        if (environment == null) {
            return null;
        }
        String springAiKey = environment.getProperty("spring.ai.openai.api-key");
        return StringUtils.hasText(springAiKey) ? springAiKey : environment.getProperty("OPENAI_API_KEY");
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
