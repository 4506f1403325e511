package com.salesagent.leads.client;

import com.salesagent.leads.model.CallResult;

/**
 * Outbound voice-call collaborator. Blocks until the call reaches a final state.
 */
public interface CallingClient {

    /**
     * @return never null; transport failures are reported as {@link com.salesagent.leads.model.CallStatus#ERROR}
     */
    CallResult placeCall(CallRequest request);
}
