package com.salesagent.leads.pipeline;

import com.salesagent.leads.model.CallResult;
import com.salesagent.leads.model.Classification;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.PipelineRun;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Working state for one lead while it moves through the stages.
 * Confined to the worker running that lead; stage outputs are mirrored onto the run for audit.
 */
@Getter
@Setter
public class LeadContext {

    private final Lead lead;
    private final PipelineRun run;

    private String research;
    private String draft;
    private String proposal;
    private CallResult callResult;
    private Classification classification;

    public LeadContext(Lead lead, PipelineRun run) {
        this.lead = lead;
        this.run = run;
    }

    public void recordResearch(String text) {
        this.research = text;
        run.setResearch(text);
    }

    public void recordDraft(String text) {
        this.draft = text;
        run.setDraft(text);
    }

    public void recordProposal(String text) {
        this.proposal = text;
        run.setProposal(text);
    }

    /** Populated canonical lead fields as {@code key: value} lines. */
    public String describeLead() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", lead.getName());
        fields.put("address", lead.getAddress());
        fields.put("phone", lead.getPhone());
        fields.put("email", lead.getEmail());
        fields.put("website", lead.getWebsite());
        fields.put("category", lead.getCategory());
        fields.put("rating", lead.getRating());
        fields.put("source", lead.getSourceProvider());
        return fields.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }
}
