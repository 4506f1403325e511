package com.salesagent.leads.model;

import java.util.Map;

/**
 * @param producedBySource raw record count per producer tag, before validation
 */
public record DiscoveryResult(String sessionId, Map<String, Integer> producedBySource,
                              WriteReport report, VerificationResult verification) {}
