package com.salesagent.leads.client;

import com.salesagent.leads.model.Meeting;

public interface MeetingScheduler {

    Meeting schedule(String leadId, String attendeeEmail, String title);
}
