package com.salesagent.leads.service;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.IngestSession;
import com.salesagent.leads.model.SessionStatus;
import com.salesagent.leads.model.VerificationResult;
import com.salesagent.leads.store.LeadStore;
import com.salesagent.leads.store.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocks until a session's leads are visible to readers, or gives up.
 *
 * The lead count is the primary signal. A session whose status update got lost
 * but whose leads are readable is still reported ready once the wait expires.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WriteVerifier {

    private final SessionRepository sessionRepository;
    private final LeadStore leadStore;
    private final LeadPipelineProperties properties;

    public VerificationResult waitForSessionReady(String sessionId) {
        return waitForSessionReady(sessionId, properties.getIngestion().getVerifyMaxWait());
    }

    public VerificationResult waitForSessionReady(String sessionId, Duration maxWait) {
        long pollMs = Math.max(1, properties.getIngestion().getVerifyPollInterval().toMillis());
        long deadline = System.currentTimeMillis() + Math.max(0, maxWait.toMillis());

        int bestCount = 0;
        int polls = 0;
        SessionStatus status = null;

        while (true) {
            polls++;
            try {
                Optional<IngestSession> session = sessionRepository.find(sessionId);
                status = session.map(IngestSession::getStatus).orElse(null);

                if (status == SessionStatus.FAILED) {
                    log.warn("Session {} is FAILED: {}", sessionId, session.get().getLastError());
                    return new VerificationResult(false, bestCount, status, false, polls);
                }

                int count = leadStore.countBySession(sessionId);
                bestCount = Math.max(bestCount, count);

                if (status == SessionStatus.COMPLETED && bestCount > 0) {
                    log.info("Session {} verified after {} poll(s): {} lead(s)", sessionId, polls, bestCount);
                    return new VerificationResult(true, bestCount, status, false, polls);
                }
                if (status == SessionStatus.UPLOADING && count > 0) {
                    log.debug("Session {} still UPLOADING but {} lead(s) already visible", sessionId, count);
                } else if (status == null) {
                    log.debug("Session {} not found yet (poll {})", sessionId, polls);
                }
            } catch (DataAccessException e) {
                log.warn("Verification poll {} for session {} failed: {}", polls, sessionId, e.getMessage());
            }

            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            try {
                Thread.sleep(Math.min(pollMs, remaining));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Verification of session {} interrupted", sessionId);
                return new VerificationResult(false, bestCount, status, false, polls);
            }
        }

        if (bestCount > 0) {
            log.warn("Session {} status is {} after {} poll(s) but {} lead(s) are visible, treating as ready",
                    sessionId, status, polls, bestCount);
            return new VerificationResult(true, bestCount, status, false, polls);
        }
        log.warn("Session {} not verified within {} ({} poll(s), status={})", sessionId, maxWait, polls, status);
        return new VerificationResult(false, 0, status, true, polls);
    }
}
