package com.scholary.converthub.api;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.converthub.cache.ConversionCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CacheController.class)
class CacheControllerTest {

  private static final String DIGEST = "a".repeat(64);

  @Autowired private MockMvc mockMvc;

  @MockBean private ConversionCache cache;

  @Test
  void stats_reportsCounters() throws Exception {
    when(cache.stats()).thenReturn(new ConversionCache.CacheStats(3, 8, 2, 0.8, 1));

    mockMvc
        .perform(get("/api/cache/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.size").value(3))
        .andExpect(jsonPath("$.hit_count").value(8))
        .andExpect(jsonPath("$.miss_count").value(2))
        .andExpect(jsonPath("$.hit_rate").value(0.8))
        .andExpect(jsonPath("$.eviction_count").value(1));
  }

  @Test
  void invalidate_dropsEveryConversionOfTheInput() throws Exception {
    when(cache.invalidate("conversion:" + DIGEST + ":")).thenReturn(2L);

    mockMvc
        .perform(delete("/api/cache/" + DIGEST.toUpperCase()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sha256").value(DIGEST))
        .andExpect(jsonPath("$.invalidated").value(2));
  }

  @Test
  void invalidate_rejectsMalformedDigest() throws Exception {
    mockMvc
        .perform(delete("/api/cache/not-a-digest"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Validation Failed"));
    verify(cache, never()).invalidate(anyString());
  }
}
