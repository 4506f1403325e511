package com.salesagent.leads.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.DiscoveryResult;
import com.salesagent.leads.model.SearchRequest;
import com.salesagent.leads.model.SessionStatus;
import com.salesagent.leads.model.VerificationResult;
import com.salesagent.leads.model.WriteReport;
import com.salesagent.leads.pipeline.PipelineOrchestrator;
import com.salesagent.leads.service.LeadDiscoveryService;
import com.salesagent.leads.store.StoreSchema;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineSchedulerTest {

    @Mock
    private StoreSchema storeSchema;

    @Mock
    private LeadDiscoveryService discoveryService;

    @Mock
    private PipelineOrchestrator orchestrator;

    private LeadPipelineProperties properties;
    private PipelineScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new LeadPipelineProperties();
        properties.getScheduling().setQuery("bakeries");
        properties.getScheduling().setLocation("Austin, TX");
        properties.getScheduling().setLimit(5);
        scheduler = new PipelineScheduler(storeSchema, discoveryService, orchestrator, properties);
    }

    @Test
    void completedSessionRunsPipeline() {
        when(discoveryService.discover(any())).thenReturn(result("s-1", SessionStatus.COMPLETED));

        scheduler.runCycle();

        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(discoveryService).discover(request.capture());
        assertThat(request.getValue().query()).isEqualTo("bakeries");
        assertThat(request.getValue().location()).isEqualTo("Austin, TX");
        verify(orchestrator).runSession("s-1", 5);
    }

    @Test
    void failedSessionSkipsPipeline() {
        when(discoveryService.discover(any())).thenReturn(result("s-2", SessionStatus.FAILED));

        scheduler.runCycle();

        verify(orchestrator, never()).runSession(anyString(), anyInt());
    }

    @Test
    void disabledScheduleDoesNothing() {
        scheduler.scheduledCycle();

        verifyNoInteractions(discoveryService, orchestrator);
    }

    @Test
    void schemaFailureDoesNotStopStartup() {
        doThrow(new IllegalStateException("db down")).when(storeSchema).ensureSchema();

        scheduler.onStartup();

        verifyNoInteractions(discoveryService);
    }

    @Test
    void discoveryErrorIsContained() {
        when(discoveryService.discover(any())).thenThrow(new IllegalStateException("boom"));

        scheduler.runCycle();

        verifyNoInteractions(orchestrator);
    }

    private DiscoveryResult result(String sessionId, SessionStatus status) {
        WriteReport report = WriteReport.builder().sessionId(sessionId).status(status).build();
        return new DiscoveryResult(sessionId, Map.of(), report,
            new VerificationResult(status == SessionStatus.COMPLETED, 3, status, false, 1));
    }
}
