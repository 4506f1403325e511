package com.salesagent.leads.store;

import com.salesagent.leads.model.Meeting;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.salesagent.leads.store.JdbcLeadStore.toLocal;
import static com.salesagent.leads.store.JdbcLeadStore.ts;

@Repository
@RequiredArgsConstructor
public class MeetingRepository {

    private final JdbcTemplate jdbcTemplate;

    public void insert(Meeting meeting) {
        jdbcTemplate.update("""
                INSERT INTO meetings
                (meeting_id, lead_id, attendee_email, title, start_at, end_at, status, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                meeting.getMeetingId(),
                meeting.getLeadId(),
                meeting.getAttendeeEmail(),
                meeting.getTitle(),
                ts(meeting.getStartAt()),
                ts(meeting.getEndAt()),
                meeting.getStatus(),
                ts(meeting.getCreatedAt()));
    }

    public List<Meeting> findByLead(String leadId) {
        return jdbcTemplate.query(
                "SELECT * FROM meetings WHERE lead_id = ? ORDER BY start_at",
                (rs, rowNum) -> Meeting.builder()
                        .meetingId(rs.getString("meeting_id"))
                        .leadId(rs.getString("lead_id"))
                        .attendeeEmail(rs.getString("attendee_email"))
                        .title(rs.getString("title"))
                        .startAt(toLocal(rs.getTimestamp("start_at")))
                        .endAt(toLocal(rs.getTimestamp("end_at")))
                        .status(rs.getString("status"))
                        .createdAt(toLocal(rs.getTimestamp("created_at")))
                        .build(),
                leadId);
    }
}
