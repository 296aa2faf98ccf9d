package com.serveos.engine.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.serveos.engine.catalog.CatalogModels.CatalogIssue;
import com.serveos.engine.catalog.CatalogModels.QuestionCatalogDocument;
import com.serveos.engine.exception.CatalogConfigurationException;
import com.serveos.engine.workflow.WorkflowCatalog;
import com.serveos.engine.workflow.WorkflowModels.WorkflowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads catalog JSON from a Spring resource location, validates it and builds the immutable
 * catalogs. Any problem surfaces as {@link CatalogConfigurationException}, so a bad bundle stops
 * the application at startup instead of at scoring time.
 */
@Component
public class CatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final CatalogValidator validator;

    public CatalogLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader, CatalogValidator validator) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.validator = validator;
    }

    public QuestionCatalog loadQuestionCatalog(String location) {
        QuestionCatalogDocument document = read(location, QuestionCatalogDocument.class);
        QuestionCatalog catalog = questionCatalog(location, document);
        log.info("Loaded question catalog v{} from {}: {} questions, {} follow-ups, {} categories",
                catalog.version(), location, catalog.questions().size(), catalog.followUps().size(), catalog.categories().size());
        return catalog;
    }

    public WorkflowCatalog loadWorkflowCatalog(String location) {
        WorkflowDocument document = read(location, WorkflowDocument.class);
        WorkflowCatalog catalog = workflowCatalog(location, document);
        log.info("Loaded workflow catalog from {}: {} stations, {} templates",
                location, catalog.stations().size(), catalog.templates().size());
        return catalog;
    }

    public QuestionCatalog questionCatalog(String source, QuestionCatalogDocument document) {
        List<CatalogIssue> issues = validator.validate(document);
        if (!issues.isEmpty()) {
            throw new CatalogConfigurationException(source, issues);
        }
        return QuestionCatalog.of(document);
    }

    public WorkflowCatalog workflowCatalog(String source, WorkflowDocument document) {
        List<CatalogIssue> issues = validator.validate(document);
        if (!issues.isEmpty()) {
            throw new CatalogConfigurationException(source, issues);
        }
        return WorkflowCatalog.of(document);
    }

    private <T> T read(String location, Class<T> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogConfigurationException(location,
                    List.of(new CatalogIssue("NOT_FOUND", "Catalog resource does not exist", location)));
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new CatalogConfigurationException(location, e);
        }
    }
}
