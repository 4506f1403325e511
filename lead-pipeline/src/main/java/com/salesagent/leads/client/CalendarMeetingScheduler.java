package com.salesagent.leads.client;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.Meeting;
import com.salesagent.leads.store.MeetingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * Books meetings into the local calendar table at the next business-day slot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CalendarMeetingScheduler implements MeetingScheduler {

    public static final String STATUS_SCHEDULED = "SCHEDULED";

    private final MeetingRepository meetingRepository;
    private final LeadPipelineProperties properties;

    @Override
    public Meeting schedule(String leadId, String attendeeEmail, String title) {
        if (attendeeEmail == null || attendeeEmail.isBlank()) {
            throw new IllegalArgumentException("attendee email is required to schedule a meeting");
        }
        LeadPipelineProperties.Meeting config = properties.getMeeting();
        ZoneId zone = ZoneId.of(config.getZone());
        LocalDateTime start = nextSlot(ZonedDateTime.now(zone), config.getStartHour());

        Meeting meeting = Meeting.builder()
                .meetingId(UUID.randomUUID().toString())
                .leadId(leadId)
                .attendeeEmail(attendeeEmail)
                .title(title)
                .startAt(start)
                .endAt(start.plusMinutes(config.getDurationMinutes()))
                .status(STATUS_SCHEDULED)
                .createdAt(LocalDateTime.now())
                .build();
        meetingRepository.insert(meeting);
        log.info("Meeting {} booked with {} at {} {}", meeting.getMeetingId(), attendeeEmail, start, zone);
        return meeting;
    }

    /** Next weekday strictly after today, at {@code hour}:00. */
    static LocalDateTime nextSlot(ZonedDateTime now, int hour) {
        ZonedDateTime day = now.plusDays(1);
        while (day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY) {
            day = day.plusDays(1);
        }
        return day.toLocalDate().atTime(hour, 0);
    }
}
