package com.score.reconciliation.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOptionsTest {

    @Test
    @DisplayName("Should provide defaults")
    void defaults() {
        PipelineOptions options = PipelineOptions.defaults();
        assertEquals(10, options.getMissingExampleLimit());
        assertTrue(options.isPerSourceJoins());
        assertEquals(4, options.getParallelism());
        assertEquals(Duration.ofSeconds(60), options.getTimeout());
    }

    @Test
    @DisplayName("Should build custom options")
    void custom() {
        PipelineOptions options = PipelineOptions.builder()
                .missingExampleLimit(25)
                .perSourceJoins(false)
                .parallelism(2)
                .timeout(Duration.ofSeconds(5))
                .build();
        assertEquals(25, options.getMissingExampleLimit());
        assertFalse(options.isPerSourceJoins());
        assertEquals(2, options.getParallelism());
        assertEquals(Duration.ofSeconds(5), options.getTimeout());
        assertTrue(options.toString().contains("missingExampleLimit=25"));
    }

    @Test
    @DisplayName("Should reject invalid values")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().missingExampleLimit(0));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().parallelism(-1));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().timeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().timeout(null));
    }
}
