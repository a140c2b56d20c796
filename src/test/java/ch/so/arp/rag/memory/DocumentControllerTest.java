package ch.so.arp.rag.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DocumentControllerTest {

    private final DocumentStore store = StoreFixtures.store(new InMemoryDocumentRepository(),
            new DeterministicEmbeddingProvider(StoreFixtures.DIMENSIONS));
    private final DocumentController controller = new DocumentController(store);
    private final MockMvc mockMvc = mockMvc(controller);

    @Test
    void storesAndReturnsDocumentWithoutVector() throws Exception {
        mockMvc.perform(put("/api/documents/remote_work_policy")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"content": "Employees may work remotely up to 3 days per week.",
                         "metadata": {"category": "hr", "year": 2025}}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.document.id").value("remote_work_policy"));

        mockMvc.perform(get("/api/documents/remote_work_policy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.document.content").value("Employees may work remotely up to 3 days per week."))
                .andExpect(jsonPath("$.document.metadata.category").value("hr"))
                .andExpect(jsonPath("$.document.metadata.year").value(2025))
                .andExpect(jsonPath("$.document.vector").doesNotExist());
    }

    @Test
    void answersNotFoundForUnknownDocument() throws Exception {
        mockMvc.perform(get("/api/documents/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("not_found"));
    }

    @Test
    void warnsWhenDeletingUnknownDocument() throws Exception {
        store.upsert("known", "Some content", null);

        mockMvc.perform(delete("/api/documents/known"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));
        mockMvc.perform(delete("/api/documents/known"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("warning"));
    }

    @Test
    void rejectsBlankContent() throws Exception {
        mockMvc.perform(put("/api/documents/blank")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));

        assertThat(store.count()).isZero();
    }

    @Test
    void storesBatchAndCounts() throws Exception {
        mockMvc.perform(post("/api/documents/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        [
                          {"id": "a", "content": "First document"},
                          {"id": "b", "content": ""},
                          {"id": "c", "content": "Third document", "metadata": {"tag": "x"}}
                        ]
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Successfully processed 2 documents"))
                .andExpect(jsonPath("$.count").value(2));

        mockMvc.perform(get("/api/documents/count"))
                .andExpect(jsonPath("$.count").value(2));

        mockMvc.perform(post("/api/documents/batch-delete")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[\"a\", \"c\", \"missing\"]"))
                .andExpect(jsonPath("$.count").value(2));
    }

    @Test
    void searchesWithDefaultsAndReportsMatchSource() throws Exception {
        store.upsert("fact-1", "The capital of France is Paris.", null);
        store.upsert("fact-2", "Water boils at 100 degrees Celsius at sea level.", null);

        mockMvc.perform(post("/api/documents/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"Water boils at 100 degrees Celsius at sea level.\", \"topK\": 1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.hits[0].document.id").value("fact-2"))
                .andExpect(jsonPath("$.hits[0].source").value("VECTOR"));
    }

    @Test
    void rejectsNonPositiveTopK() throws Exception {
        mockMvc.perform(post("/api/documents/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"anything\", \"topK\": 0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void answersServiceUnavailableWhenEmbeddingsFail() throws Exception {
        DocumentStore failing = StoreFixtures.store(new InMemoryDocumentRepository(), texts -> {
            throw new EmbeddingProviderException("provider down", true);
        });

        mockMvc(new DocumentController(failing)).perform(put("/api/documents/doc")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"Some content\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void returnsHitsWhenInvokedDirectly() {
        store.upsertBatch(List.of(
                new DocumentInput("mission", "Our mission is to build useful tools.", null),
                new DocumentInput("roadmap", "The roadmap includes a mobile app.", null)));

        StoreResponse response = controller.search(new SearchRequest("Our mission is to build useful tools.", null,
                null));

        assertThat(response.status()).isEqualTo(StoreResponse.SUCCESS);
        assertThat(response.hits()).hasSize(2);
        assertThat(response.hits().get(0).document().id()).isEqualTo("mission");
    }

    private static MockMvc mockMvc(DocumentController controller) {
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new DocumentApiExceptionHandler())
                .build();
    }
}
