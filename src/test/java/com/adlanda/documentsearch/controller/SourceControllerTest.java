package com.adlanda.documentsearch.controller;

import com.adlanda.documentsearch.exception.DatabaseException;
import com.adlanda.documentsearch.store.VectorStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SourceController.class)
class SourceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VectorStore vectorStore;

    @Test
    void getSources_returnsIndexStats() throws Exception {
        when(vectorStore.listSources()).thenReturn(List.of("docs/a.md", "docs/b.md"));
        when(vectorStore.count()).thenReturn(42L);

        mockMvc.perform(get("/api/v1/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sources[0]").value("docs/a.md"))
                .andExpect(jsonPath("$.sources[1]").value("docs/b.md"))
                .andExpect(jsonPath("$.totalChunks").value(42))
                .andExpect(jsonPath("$.status").value("indexed"));
    }

    @Test
    void getSources_emptyIndex_returnsEmptyStatus() throws Exception {
        when(vectorStore.listSources()).thenReturn(List.of());
        when(vectorStore.count()).thenReturn(0L);

        mockMvc.perform(get("/api/v1/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalChunks").value(0))
                .andExpect(jsonPath("$.status").value("empty"));
    }

    @Test
    void getSources_databaseDown_returnsServiceUnavailable() throws Exception {
        when(vectorStore.listSources()).thenThrow(new DatabaseException("Failed to retrieve indexed sources: down"));

        mockMvc.perform(get("/api/v1/sources"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Failed to retrieve indexed sources: down"));
    }

    @Test
    void deleteSource_unknownSource_reportsSuccess() throws Exception {
        when(vectorStore.deleteBySource("missing.md")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/sources").param("sourceId", "missing.md"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true))
                .andExpect(jsonPath("$.target").value("missing.md"));
    }

    @Test
    void deleteSource_storeFailure_returnsServiceUnavailable() throws Exception {
        when(vectorStore.deleteBySource("docs/a.md")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/sources").param("sourceId", "docs/a.md"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.deleted").value(false));
    }

    @Test
    void deleteAll_clearsStore() throws Exception {
        when(vectorStore.deleteAll()).thenReturn(true);

        mockMvc.perform(delete("/api/v1/sources/all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true))
                .andExpect(jsonPath("$.target").value("all"));
    }
}
