package com.salesagent.leads.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesagent.leads.TestDatabase;
import com.salesagent.leads.model.BranchDecision;
import com.salesagent.leads.model.CallStatus;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.PipelineRun;
import com.salesagent.leads.model.PipelineStage;
import com.salesagent.leads.model.StageStatus;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PipelineRunRepositoryTest {

    private PipelineRunRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PipelineRunRepository(TestDatabase.create(), new ObjectMapper());
    }

    @Test
    void savedRunRoundTripsStageStatusesAndOutcome() {
        PipelineRun run = PipelineRun.start("s1", lead());
        run.mark(PipelineStage.RESEARCH, StageStatus.SUCCEEDED);
        run.mark(PipelineStage.CALL, StageStatus.FAILED);
        run.setCallOutcome(CallStatus.ERROR);
        run.setError("call error: provider down");

        repository.save(run);

        List<PipelineRun> stored = repository.findBySession("s1");
        assertThat(stored).hasSize(1);
        PipelineRun loaded = stored.get(0);
        assertThat(loaded.getStageStatuses())
            .containsEntry(PipelineStage.RESEARCH, StageStatus.SUCCEEDED)
            .containsEntry(PipelineStage.CALL, StageStatus.FAILED)
            .containsEntry(PipelineStage.FINALIZE, StageStatus.PENDING);
        assertThat(loaded.getCallOutcome()).isEqualTo(CallStatus.ERROR);
        assertThat(loaded.getError()).isEqualTo("call error: provider down");
        assertThat(loaded.getBranchDecision()).isNull();
    }

    @Test
    void savingAgainUpdatesTheSameRow() {
        PipelineRun run = PipelineRun.start("s1", lead());
        repository.save(run);

        run.setBranchDecision(BranchDecision.INTERESTED);
        run.setBranchNote("proposal email already sent for this lead");
        repository.save(run);

        List<PipelineRun> stored = repository.findByLead("key-1");
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).getBranchDecision()).isEqualTo(BranchDecision.INTERESTED);
        assertThat(stored.get(0).getBranchNote()).isEqualTo("proposal email already sent for this lead");
    }

    private Lead lead() {
        return Lead.builder().identityKey("key-1").name("Blue Door Bakery").address("12 High St").build();
    }
}
