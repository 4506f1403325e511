package com.salesagent.leads.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, LeadPipelineProperties properties) {
        return builder
                .setConnectTimeout(properties.getHttp().getConnectTimeout())
                .setReadTimeout(properties.getHttp().getReadTimeout())
                .build();
    }

    /** One worker per concurrently processed lead. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(LeadPipelineProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getPipeline().getFanOut()));
    }

    // stage calls run here so the lead worker can enforce a deadline on them
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageExecutor() {
        return Executors.newCachedThreadPool();
    }
}
