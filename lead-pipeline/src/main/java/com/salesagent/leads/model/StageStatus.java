package com.salesagent.leads.model;

public enum StageStatus {
    PENDING, RUNNING, SUCCEEDED, SKIPPED, FAILED
}
