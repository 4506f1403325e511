package com.salesagent.leads.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MeetingQualifierTest {

    @ParameterizedTest
    @CsvSource({
        "true, true, true",
        "true, false, false",
        "false, true, false",
        "false, false, false"
    })
    void schedulesOnlyWhenHotAndRequested(boolean hotLead, boolean meetingRequest, boolean expected) {
        assertThat(MeetingQualifier.shouldSchedule(hotLead, meetingRequest)).isEqualTo(expected);
    }
}
