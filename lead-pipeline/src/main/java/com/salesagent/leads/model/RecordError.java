package com.salesagent.leads.model;

/**
 * Why a single raw record was rejected or could not be written.
 *
 * @param index          position in the submitted batch
 * @param sourceProvider producer tag as submitted (may be null)
 * @param identityKey    null when the record never got far enough to have one
 * @param reason         human readable cause
 */
public record RecordError(int index, String sourceProvider, String identityKey, String reason) {}
