package com.salesagent.leads.service;

import com.salesagent.leads.model.DiscoveryResult;
import com.salesagent.leads.model.RawRecord;
import com.salesagent.leads.model.SearchRequest;
import com.salesagent.leads.model.VerificationResult;
import com.salesagent.leads.model.WriteReport;
import com.salesagent.leads.search.SearchProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one discovery cycle: every enabled producer, then the writer, then the verifier.
 *
 * Producers are independent. One failing only costs its own records; the session
 * is still written from whatever the others returned.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LeadDiscoveryService {

    private static final DateTimeFormatter SESSION_PREFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final List<SearchProducer> producers;
    private final LeadStoreWriter writer;
    private final WriteVerifier verifier;

    public DiscoveryResult discover(SearchRequest request) {
        return discover(request, null);
    }

    public DiscoveryResult discover(SearchRequest request, String sessionId) {
        String session = sessionId == null || sessionId.isBlank() ? newSessionId() : sessionId;
        log.info("Discovery for session {}: '{}' near {} (radius={}m, limit={})",
                session, request.query(), request.location(), request.radiusMeters(), request.limit());

        Map<String, Integer> producedBySource = new LinkedHashMap<>();
        List<RawRecord> batch = new ArrayList<>();
        for (SearchProducer producer : producers) {
            if (!producer.isEnabled()) {
                log.info("Producer {} disabled, skipping", producer.sourceTag());
                continue;
            }
            try {
                List<RawRecord> records = producer.search(request);
                producedBySource.put(producer.sourceTag(), records.size());
                batch.addAll(records);
            } catch (Exception e) {
                log.warn("Producer {} failed for session {}: {}", producer.sourceTag(), session, e.getMessage());
                producedBySource.put(producer.sourceTag(), 0);
            }
        }

        WriteReport report = writer.upsert(session, batch);
        VerificationResult verification = verifier.waitForSessionReady(session);
        return new DiscoveryResult(session, producedBySource, report, verification);
    }

    public static String newSessionId() {
        return LocalDateTime.now().format(SESSION_PREFIX) + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
