package com.salesagent.leads.model;

/**
 * @param fallbackUsed true when the keyword heuristic replaced an unusable model reply
 */
public record ReplyAnalysis(boolean hotLead, boolean meetingRequest, double confidence,
                            String note, boolean fallbackUsed) {}
