package com.salesagent.leads.pipeline;

/**
 * Meeting qualification rule shared by the outreach pipeline and the reply flow:
 * a meeting is booked only for a hot lead that also asked for one.
 */
public final class MeetingQualifier {

    private MeetingQualifier() {
    }

    public static boolean shouldSchedule(boolean hotLead, boolean meetingRequest) {
        return hotLead && meetingRequest;
    }
}
