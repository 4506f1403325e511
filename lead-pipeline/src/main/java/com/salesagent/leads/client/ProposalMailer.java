package com.salesagent.leads.client;

public interface ProposalMailer {

    /**
     * @return provider message id
     */
    String send(String to, String subject, String body);
}
