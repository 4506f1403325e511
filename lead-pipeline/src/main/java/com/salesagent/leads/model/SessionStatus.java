package com.salesagent.leads.model;

public enum SessionStatus {
    UPLOADING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this != UPLOADING;
    }
}
