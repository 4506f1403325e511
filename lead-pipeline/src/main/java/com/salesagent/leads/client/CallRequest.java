package com.salesagent.leads.client;

/**
 * @param phoneNumber E.164 number to dial
 * @param scriptText  talking points handed to the voice agent
 */
public record CallRequest(String phoneNumber, String scriptText, String leadName) {}
