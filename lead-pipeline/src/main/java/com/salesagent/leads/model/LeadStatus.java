package com.salesagent.leads.model;

/**
 * Lifecycle marker on a stored lead. Ingestion inserts NEW and a merge never changes it.
 */
public enum LeadStatus {
    NEW
}
