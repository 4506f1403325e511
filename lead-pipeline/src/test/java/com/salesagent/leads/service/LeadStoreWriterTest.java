package com.salesagent.leads.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.salesagent.leads.TestDatabase;
import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.exception.SessionClosedException;
import com.salesagent.leads.exception.WriteException;
import com.salesagent.leads.model.IngestSession;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.LeadStatus;
import com.salesagent.leads.model.RawRecord;
import com.salesagent.leads.model.SessionStatus;
import com.salesagent.leads.model.WriteReport;
import com.salesagent.leads.store.JdbcLeadStore;
import com.salesagent.leads.store.JdbcSessionRepository;
import com.salesagent.leads.store.LeadStore;
import com.salesagent.leads.store.SessionRepository;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

class LeadStoreWriterTest {

    private JdbcLeadStore leadStore;
    private JdbcSessionRepository sessionRepository;
    private LeadStoreWriter writer;

    @BeforeEach
    void setUp() {
        JdbcTemplate jdbcTemplate = TestDatabase.create();
        leadStore = new JdbcLeadStore(jdbcTemplate);
        sessionRepository = new JdbcSessionRepository(jdbcTemplate);
        writer = newWriter(leadStore, sessionRepository);
    }

    @Test
    void sameRecordTwiceInOneBatchBecomesOneLead() {
        RawRecord record = record("Blue Door Bakery", "12 High St", "map_search").phone("555-0100").build();

        WriteReport report = writer.upsert("s1", List.of(record, record));

        assertThat(report.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(report.getDuplicatesCollapsed()).isEqualTo(1);
        assertThat(report.getInsertedCount()).isEqualTo(1);
        assertThat(report.getVerifiedCount()).isEqualTo(1);
        assertThat(leadStore.countBySession("s1")).isEqualTo(1);
    }

    @Test
    void rewriteInLaterSessionUpdatesInsteadOfDuplicating() {
        writer.upsert("s1", List.of(record("Blue Door Bakery", "12 High St", "map_search").phone("555-0100").build()));

        WriteReport second = writer.upsert("s2",
            List.of(record("Blue Door Bakery", "12 High St", "cluster_search").website("bluedoor.example").build()));

        assertThat(second.getInsertedCount()).isZero();
        assertThat(second.getUpdatedCount()).isEqualTo(1);
        Lead lead = leadStore.findByKey(IdentityKeys.identityKey("Blue Door Bakery", "12 High St")).orElseThrow();
        assertThat(lead.getSessionId()).isEqualTo("s2");
        assertThat(lead.getPhone()).isEqualTo("555-0100");
        assertThat(lead.getWebsite()).isEqualTo("bluedoor.example");
        assertThat(lead.getVersion()).isEqualTo(1);
        assertThat(leadStore.countBySession("s1")).isZero();
    }

    @Test
    void differentProducersForSamePlaceUnionTheirFields() {
        RawRecord fromMap = record("Corner Deli", "5 Elm Rd", "map_search").phone("555-2222").build();
        RawRecord fromCluster = record("corner deli", "5 elm rd.", "cluster_search").email("hi@cornerdeli.example").build();

        WriteReport report = writer.upsert("s1", List.of(fromMap, fromCluster));

        assertThat(report.getInsertedCount()).isEqualTo(1);
        List<Lead> leads = leadStore.findBySession("s1", false, 10);
        assertThat(leads).hasSize(1);
        assertThat(leads.get(0).getPhone()).isEqualTo("555-2222");
        assertThat(leads.get(0).getEmail()).isEqualTo("hi@cornerdeli.example");
    }

    @Test
    void joesCafeVariantsCollapseToOneLeadAndFetchReturnsIt() {
        RawRecord fromMap = record("Joe's Cafe", "1 Main St", "map_search").build();
        RawRecord fromCluster = record("joe's cafe", "1 Main St", "cluster_search").phone("555-1111").build();

        WriteReport report = writer.upsert("S1", List.of(fromMap, fromCluster));

        assertThat(report.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(report.getVerifiedCount()).isEqualTo(1);
        List<Lead> fetched = new LeadRetriever(leadStore, new LeadPipelineProperties()).fetchSessionLeads("S1", 10);
        assertThat(fetched).hasSize(1);
        assertThat(fetched.get(0).getPhone()).isEqualTo("555-1111");
        assertThat(fetched.get(0).getSessionId()).isEqualTo("S1");
        assertThat(fetched.get(0).getIdentityKey()).isEqualTo(IdentityKeys.identityKey("Joe's Cafe", "1 Main St"));
    }

    @Test
    void invalidRecordsAreReportedWithoutAbortingBatch() {
        RawRecord good = record("Good Place", "2 Side St", "map_search").build();
        RawRecord noName = record(null, "3 Side St", "map_search").build();
        RawRecord badRating = record("Rated Place", "4 Side St", "map_search").rating("11").build();

        WriteReport report = writer.upsert("s1", List.of(good, noName, badRating));

        assertThat(report.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(report.getAcceptedCount()).isEqualTo(1);
        assertThat(report.getValidationErrors()).hasSize(2);
        assertThat(report.getValidationErrors().get(0).index()).isEqualTo(1);
        assertThat(report.getValidationErrors().get(0).reason()).contains("name");
        assertThat(report.getValidationErrors().get(1).reason()).contains("rating");
    }

    @Test
    void batchWithNothingValidEndsFailed() {
        WriteReport report = writer.upsert("s1", List.of(record("", "", "map_search").build()));

        assertThat(report.getStatus()).isEqualTo(SessionStatus.FAILED);
        IngestSession session = sessionRepository.find("s1").orElseThrow();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(session.getLastError()).isEqualTo(LeadStoreWriter.NO_LEADS_VISIBLE);
    }

    @Test
    void completedSessionRejectsFurtherWrites() {
        writer.upsert("s1", List.of(record("Blue Door Bakery", "12 High St", "map_search").build()));

        assertThatThrownBy(() -> writer.upsert("s1", List.of(record("Other", "9 Road", "map_search").build())))
            .isInstanceOf(SessionClosedException.class);
        assertThat(leadStore.countBySession("s1")).isEqualTo(1);
    }

    @Test
    void unreachableStoreAbortsBatchAndMarksSessionFailed() {
        LeadStore brokenStore = mock(LeadStore.class);
        SessionRepository sessions = mock(SessionRepository.class);
        when(sessions.open(anyString(), anyInt())).thenReturn(IngestSession.builder().sessionId("s1").build());
        when(brokenStore.findByKey(anyString())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        LeadStoreWriter brokenWriter = newWriter(brokenStore, sessions);

        assertThatThrownBy(() -> brokenWriter.upsert("s1", List.of(record("A", "1 St", "map_search").build())))
            .isInstanceOf(WriteException.class)
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        verify(sessions).fail(any(IngestSession.class), eq("store unreachable: connection refused"));
    }

    @Test
    void mergeKeepsExistingValuesWhenIncomingIsNull() {
        LocalDateTime created = LocalDateTime.of(2024, 1, 1, 9, 0);
        Lead current = Lead.builder()
            .identityKey("k").name("A").address("1 St").phone("555").email("a@example.com")
            .sourceProvider("map_search").sessionId("old").createdAt(created).status(LeadStatus.NEW).version(3)
            .build();
        Lead incoming = Lead.builder().identityKey("k").name("A").address("1 St").website("a.example")
            .sourceProvider("cluster_search").build();

        Lead merged = LeadStoreWriter.merge(current, incoming, "new", created.plusDays(1));

        assertThat(merged.getPhone()).isEqualTo("555");
        assertThat(merged.getEmail()).isEqualTo("a@example.com");
        assertThat(merged.getWebsite()).isEqualTo("a.example");
        assertThat(merged.getSourceProvider()).isEqualTo("cluster_search");
        assertThat(merged.getSessionId()).isEqualTo("new");
        assertThat(merged.getCreatedAt()).isEqualTo(created);
        assertThat(merged.getStatus()).isEqualTo(LeadStatus.NEW);
        assertThat(merged.getVersion()).isEqualTo(3);
    }

    private LeadStoreWriter newWriter(LeadStore store, SessionRepository sessions) {
        return new LeadStoreWriter(store, sessions, new LeadRecordNormalizer(), new LeadDeduplicator(),
            new LeadPipelineProperties());
    }

    private RawRecord.RawRecordBuilder record(String name, String address, String provider) {
        return RawRecord.builder().name(name).address(address).sourceProvider(provider);
    }
}
