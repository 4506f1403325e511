package com.salesagent.leads.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class WriteReport {

    private String sessionId;
    private SessionStatus status;
    private int requestedCount;
    private int acceptedCount;
    private int duplicatesCollapsed;
    private int insertedCount;
    private int updatedCount;
    private int failedCount;
    private int verifiedCount;

    @Builder.Default
    private List<RecordError> validationErrors = new ArrayList<>();

    @Builder.Default
    private List<RecordError> recordErrors = new ArrayList<>();
}
