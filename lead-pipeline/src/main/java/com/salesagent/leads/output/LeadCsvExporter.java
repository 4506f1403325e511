package com.salesagent.leads.output;

import com.opencsv.CSVWriter;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.PipelineRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes a session's leads or pipeline runs as CSV with a header row.
 *
 * Long text columns (research, draft, proposal, transcript) are left out of the run
 * export; they are available through the runs endpoint as JSON.
 */
@Component
@Slf4j
public class LeadCsvExporter {

    static final String[] LEAD_HEADERS = {
            "identity_key", "name", "address", "phone", "email", "website",
            "category", "rating", "source_provider", "session_id",
            "status", "created_at", "updated_at"
    };

    static final String[] RUN_HEADERS = {
            "run_id", "session_id", "lead_id", "lead_name",
            "stage", "stage_status", "branch_decision", "call_outcome",
            "extracted_email", "email_sent",
            "branch_note", "started_at", "completed_at", "error"
    };

    public void writeLeads(List<Lead> leads, Writer out) {
        try (CSVWriter writer = csvWriter(out)) {
            writer.writeNext(LEAD_HEADERS);
            for (Lead l : leads) {
                writer.writeNext(new String[]{
                        str(l.getIdentityKey()),
                        str(l.getName()),
                        str(l.getAddress()),
                        str(l.getPhone()),
                        str(l.getEmail()),
                        str(l.getWebsite()),
                        str(l.getCategory()),
                        str(l.getRating()),
                        str(l.getSourceProvider()),
                        str(l.getSessionId()),
                        str(l.getStatus()),
                        str(l.getCreatedAt()),
                        str(l.getUpdatedAt())
                });
            }
        } catch (IOException e) {
            log.error("Failed to write lead CSV: {}", e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed", e);
        }
        log.debug("Exported {} lead(s) to CSV", leads.size());
    }

    public void writeRuns(List<PipelineRun> runs, Writer out) {
        try (CSVWriter writer = csvWriter(out)) {
            writer.writeNext(RUN_HEADERS);
            for (PipelineRun r : runs) {
                writer.writeNext(new String[]{
                        str(r.getRunId()),
                        str(r.getSessionId()),
                        str(r.getLeadId()),
                        str(r.getLeadName()),
                        str(r.getStage()),
                        str(r.getStageStatus()),
                        str(r.getBranchDecision()),
                        str(r.getCallOutcome()),
                        str(r.getExtractedEmail()),
                        str(r.isEmailSent()),
                        str(r.getBranchNote()),
                        str(r.getStartedAt()),
                        str(r.getCompletedAt()),
                        str(r.getError())
                });
            }
        } catch (IOException e) {
            log.error("Failed to write run CSV: {}", e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed", e);
        }
    }

    public String leadsToCsv(List<Lead> leads) {
        StringWriter out = new StringWriter();
        writeLeads(leads, out);
        return out.toString();
    }

    public String runsToCsv(List<PipelineRun> runs) {
        StringWriter out = new StringWriter();
        writeRuns(runs, out);
        return out.toString();
    }

    private CSVWriter csvWriter(Writer out) {
        return new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
