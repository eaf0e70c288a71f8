package com.dataPlatform.platformFacade.gateway.controller;

import com.dataPlatform.platformFacade.facade.cache.ResponseCache;
import com.dataPlatform.platformFacade.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CacheControllerTest {

    private ResponseCache cache;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cache = new ResponseCache(new MutableClock(Instant.parse("2025-01-15T12:00:00Z")));
        mockMvc = MockMvcBuilders.standaloneSetup(new CacheController(cache)).build();
    }

    @Test
    void statistics_ReportsSizeAndCounters() throws Exception {
        // given
        cache.set("a", "1");
        cache.get("a", Duration.ofMinutes(1));
        cache.get("b", Duration.ofMinutes(1));

        // when / then
        mockMvc.perform(get("/api/v1/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(1))
                .andExpect(jsonPath("$.hits").value(1))
                .andExpect(jsonPath("$.misses").value(1));
    }

    @Test
    void clear_ReturnsRemovedCount() throws Exception {
        // given
        cache.set("a", "1");
        cache.set("b", "2");

        // when / then
        mockMvc.perform(delete("/api/v1/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.entries_removed").value(2));
        assertThat(cache.size()).isZero();
    }
}
