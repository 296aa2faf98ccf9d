package com.serveos.engine.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Locations of the bundled catalogs.
 *
 * @param questionsLocation resource holding intake categories, questions and follow-ups
 * @param workflowLocation resource holding templates, stations and pathway stages
 */
@ConfigurationProperties(prefix = "engine.catalog")
public record CatalogProperties(
        @DefaultValue("classpath:catalog/intake-questions.json") String questionsLocation,
        @DefaultValue("classpath:catalog/workflow.json") String workflowLocation) {}
