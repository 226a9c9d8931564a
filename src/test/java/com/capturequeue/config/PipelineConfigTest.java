package com.capturequeue.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        PipelineConfig config = PipelineConfig.builder().build();

        assertEquals(3, config.getMaxRetries());
        assertEquals(1000, config.getBaseDelayMs());
        assertEquals(8000, config.getMaxDelayMs());
        assertEquals(0.25, config.getJitterRatio(), 1e-9);
        assertEquals(60000, config.getPollIntervalMs());
        assertEquals(5, config.getFetchConcurrency());
        assertEquals(30000, config.getFetchTimeoutMs());
        assertEquals(10 * 1024 * 1024, config.getMaxContentBytes());
        assertEquals(10, config.getDbPoolSize());
        assertEquals(8080, config.getStatusPort());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(PipelineConfig.MAX_RETRIES, "5");
        props.setProperty(PipelineConfig.FETCH_CONCURRENCY, " 12 ");
        props.setProperty(PipelineConfig.JITTER_RATIO, "0");
        props.setProperty(PipelineConfig.DB_URL, "jdbc:h2:mem:cfg");

        PipelineConfig config = PipelineConfig.fromProperties(props);

        assertEquals(5, config.getMaxRetries());
        assertEquals(12, config.getFetchConcurrency());
        assertEquals(0.0, config.getJitterRatio(), 1e-9);
        assertEquals("jdbc:h2:mem:cfg", config.getDbUrl());
        assertEquals(1000, config.getBaseDelayMs(), "unset keys keep defaults");
    }

    @Test
    void malformedNumbersAreRejectedWithKeyName() {
        Properties props = new Properties();
        props.setProperty(PipelineConfig.FETCH_TIMEOUT_MS, "soon");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PipelineConfig.fromProperties(props));
        assertTrue(e.getMessage().contains(PipelineConfig.FETCH_TIMEOUT_MS));
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().fetchConcurrency(0).build());
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().fetchConcurrency(51).build());
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().jitterRatio(1.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> PipelineConfig.builder().baseDelayMs(5000).maxDelayMs(1000).build());
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().statusPort(70000).build());
    }

    @Test
    void zeroRetriesIsAllowed() {
        assertEquals(0, PipelineConfig.builder().maxRetries(0).build().getMaxRetries());
    }

    @Test
    void systemPropertiesOverlayClasspathFile() {
        System.setProperty(PipelineConfig.MAX_RETRIES, "7");
        try {
            PipelineConfig config = PipelineConfig.load();
            assertEquals(7, config.getMaxRetries());
            assertEquals(5, config.getFetchConcurrency());
        } finally {
            System.clearProperty(PipelineConfig.MAX_RETRIES);
        }
    }
}
