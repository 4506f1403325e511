package com.salesagent.leads.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Meeting {

    private String meetingId;
    private String leadId;          // identity key, or sender email for inbound replies
    private String attendeeEmail;
    private String title;
    private LocalDateTime startAt;
    private LocalDateTime endAt;
    private String status;          // SCHEDULED | CANCELLED
    private LocalDateTime createdAt;
}
