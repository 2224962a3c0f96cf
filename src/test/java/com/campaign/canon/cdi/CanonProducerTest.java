package com.campaign.canon.cdi;

import com.campaign.canon.api.CampaignCanon;
import com.campaign.canon.api.CanonOptions;
import com.campaign.canon.extract.Extractor;
import com.campaign.canon.narrative.DocumentRenderer;
import com.campaign.canon.narrative.SummaryPlanner;
import com.campaign.canon.narrative.SummaryWriter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CanonProducerTest {

    @Mock
    private Extractor extractor;
    @Mock
    private Instance<SummaryPlanner> planner;
    @Mock
    private Instance<SummaryWriter> writer;
    @Mock
    private Instance<DocumentRenderer> renderer;
    @Mock
    private Instance<MeterRegistry> meterRegistry;

    private CanonProducer producer;

    @BeforeEach
    void setUp() {
        producer = new CanonProducer();
        producer.transcriptsRoot = ".";
        producer.promptVersion = "v2";
        producer.model = "extractor-large";
        producer.maxAttempts = 4;
        producer.initialBackoffMillis = 200;
        producer.backoffMultiplier = 3.0;
        producer.maxBackoffMillis = 5000;
        producer.errorTruncateLength = 1000;
        producer.lockTimeoutMillis = 1000;
        producer.cacheEnabled = false;
        producer.cacheMaxSize = 10;
        producer.cacheTtlSeconds = 60;
        producer.fillMissingOffsets = true;
        producer.confidenceDemotion = 0.25;
    }

    @Test
    @DisplayName("Should build options from configuration properties")
    void testCanonOptions() {
        CanonOptions options = producer.canonOptions();

        assertEquals("v2", options.getPromptVersion());
        assertEquals("extractor-large", options.getModel());
        assertEquals(4, options.getRetryPolicy().maxAttempts());
        assertEquals(Duration.ofMillis(600), options.getRetryPolicy().backoffFor(2));
        assertEquals(1000, options.getLockConfig().timeoutMs());
        assertFalse(options.getCacheConfig().enabled());
        assertTrue(options.getEvidenceOptions().fillMissingOffsets());
        assertEquals(1000, options.getErrorTruncateLength());
    }

    @Test
    @DisplayName("Should leave narrative stages off when a collaborator is missing")
    void testCampaignCanonWithoutNarrative() {
        when(planner.isResolvable()).thenReturn(true);
        when(writer.isResolvable()).thenReturn(false);
        when(meterRegistry.isResolvable()).thenReturn(false);

        CampaignCanon canon = producer.campaignCanon(producer.canonOptions(), extractor,
                planner, writer, renderer, meterRegistry);

        assertEquals("v2", canon.getOptions().getPromptVersion());
        verify(planner, never()).get();
        verifyNoInteractions(renderer);
    }
}
