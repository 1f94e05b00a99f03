package com.delta.siteextract.config;

import com.delta.siteextract.crawl.aggregate.PageAuthorityTable;
import com.delta.siteextract.crawl.discovery.PageTypeRules;
import com.delta.siteextract.crawl.model.FieldSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExtractorConfig {

    // Sized per run by BatchSessionService, which gates launches on the run's batch concurrency.
    @Bean(name = "siteExecutor", destroyMethod = "shutdown")
    public ExecutorService siteExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ExtractorProperties properties) {
        int size = Math.max(4, properties.getBatchConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    // Runs started through BatchSessionService.start; each holds one thread until it completes.
    @Bean(name = "batchRunExecutor", destroyMethod = "shutdown")
    public ExecutorService batchRunExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public FieldSchema defaultFieldSchema() {
        return FieldSchema.restaurant();
    }

    @Bean
    public PageTypeRules pageTypeRules() {
        return PageTypeRules.restaurantDefaults();
    }

    @Bean
    public PageAuthorityTable pageAuthorityTable() {
        return PageAuthorityTable.restaurantDefaults();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
