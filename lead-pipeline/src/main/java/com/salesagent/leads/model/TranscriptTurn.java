package com.salesagent.leads.model;

public record TranscriptTurn(String role, String text) {}
