package com.salesagent.leads.model;

public enum CallStatus {
    DONE, NO_ANSWER, FAILED, ERROR
}
