package com.wshg.productsearch.controller;

import com.wshg.productsearch.common.convention.exception.UpstreamException;
import com.wshg.productsearch.dto.ProductSearchResult;
import com.wshg.productsearch.service.SemanticSearchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = SemanticSearchController.class)
class SemanticSearchControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    SemanticSearchService searchService;

    @Test
    void get_returnsResultsWithCount() throws Exception {
        UUID productId = UUID.randomUUID();
        UUID shopId = UUID.randomUUID();
        when(searchService.search("trail shoe", 3, null, shopId)).thenReturn(List.of(
                ProductSearchResult.builder().productId(productId).productName("Trail Runner").relevanceScore(0.9).build()));

        mvc.perform(get("/api/search").param("query", "trail shoe").param("topK", "3")
                        .param("shopId", shopId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("trail shoe"))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.results[0].productId").value(productId.toString()))
                .andExpect(jsonPath("$.results[0].productName").value("Trail Runner"));
    }

    @Test
    void post_acceptsJsonBody() throws Exception {
        when(searchService.search(eq("boots"), eq(5), any(), any())).thenReturn(List.of());

        mvc.perform(post("/api/search").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"boots\",\"topK\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void blankQuery_returnsEmptyResults() throws Exception {
        when(searchService.search(eq("  "), any(), any(), any())).thenReturn(List.of());

        mvc.perform(get("/api/search").param("query", "  "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0))
                .andExpect(jsonPath("$.results").isEmpty());
    }

    @Test
    void postWithoutQuery_returnsEmptyResults() throws Exception {
        when(searchService.search(eq(""), any(), any(), any())).thenReturn(List.of());

        mvc.perform(post("/api/search").contentType(MediaType.APPLICATION_JSON).content("{\"topK\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value(""))
                .andExpect(jsonPath("$.count").value(0));

        verify(searchService).search(eq(""), eq(5), isNull(), isNull());
    }

    @Test
    void missingQuery_isRejected() throws Exception {
        mvc.perform(get("/api/search"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("A0101"));
    }

    @Test
    void upstreamFailure_mapsToBadGateway() throws Exception {
        when(searchService.search(anyString(), any(), any(), any())).thenThrow(new UpstreamException("ollama down"));

        mvc.perform(get("/api/search").param("query", "shoe"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("C0101"));
    }

    @Test
    void similar_returnsResultsForProduct() throws Exception {
        UUID productId = UUID.randomUUID();
        when(searchService.getSimilarProducts(productId, null)).thenReturn(List.of(
                ProductSearchResult.builder().productId(UUID.randomUUID()).build()));

        mvc.perform(get("/api/search/similar/{productId}", productId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.productId").value(productId.toString()))
                .andExpect(jsonPath("$.count").value(1));
    }

    @Test
    void similar_invalidIdIsRejected() throws Exception {
        mvc.perform(get("/api/search/similar/not-a-uuid"))
                .andExpect(status().isBadRequest());
    }
}
