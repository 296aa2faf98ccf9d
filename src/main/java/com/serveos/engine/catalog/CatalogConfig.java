package com.serveos.engine.catalog;

import com.serveos.engine.workflow.WorkflowCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CatalogConfig {

    @Bean
    public QuestionCatalog questionCatalog(CatalogLoader loader, CatalogProperties properties) {
        return loader.loadQuestionCatalog(properties.questionsLocation());
    }

    @Bean
    public WorkflowCatalog workflowCatalog(CatalogLoader loader, CatalogProperties properties) {
        return loader.loadWorkflowCatalog(properties.workflowLocation());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
