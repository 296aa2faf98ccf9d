package com.serveos.engine.exception;

import com.serveos.engine.catalog.CatalogModels.CatalogIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A question catalog, workflow catalog or weight override failed validation. Carries every issue
 * found, not only the first.
 */
public class CatalogConfigurationException extends RuntimeException {
    private final List<CatalogIssue> issues;

    public CatalogConfigurationException(String source, List<CatalogIssue> issues) {
        super("Invalid catalog configuration in " + source + ": " + describe(issues));
        this.issues = List.copyOf(issues);
    }

    public CatalogConfigurationException(String source, Throwable cause) {
        super("Unreadable catalog configuration in " + source + ": " + cause.getMessage(), cause);
        this.issues = List.of(new CatalogIssue("UNREADABLE", cause.getMessage(), source));
    }

    public List<CatalogIssue> getIssues() {
        return issues;
    }

    private static String describe(List<CatalogIssue> issues) {
        return issues.stream()
                .map(i -> i.code() + (i.node() == null ? "" : "[" + i.node() + "]"))
                .collect(Collectors.joining(", "));
    }
}
