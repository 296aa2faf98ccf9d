package com.serveos.engine.catalog;

import com.serveos.engine.catalog.CatalogModels.CatalogIssue;
import com.serveos.engine.catalog.CatalogModels.CategoryDefinition;
import com.serveos.engine.catalog.CatalogModels.CategoryWeight;
import com.serveos.engine.catalog.CatalogModels.FollowUpQuestion;
import com.serveos.engine.catalog.CatalogModels.Question;
import com.serveos.engine.catalog.CatalogModels.QuestionCatalogDocument;
import com.serveos.engine.catalog.CatalogModels.QuestionOption;
import com.serveos.engine.catalog.CatalogModels.QuestionWeight;
import com.serveos.engine.catalog.CatalogModels.WeightConfiguration;
import com.serveos.engine.domain.DomainModels.ServicePathway;
import com.serveos.engine.workflow.WorkflowModels.PathwayWorkflow;
import com.serveos.engine.workflow.WorkflowModels.StationRequirement;
import com.serveos.engine.workflow.WorkflowModels.WorkflowDocument;
import com.serveos.engine.workflow.WorkflowModels.WorkflowStage;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reference and range checks for catalog documents. Every problem is collected; nothing is thrown
 * here.
 */
@Component
public class CatalogValidator {
    public static final int MIN_QUESTION_WEIGHT = 1;
    public static final int MAX_QUESTION_WEIGHT = 5;
    public static final double MIN_CATEGORY_OVERRIDE = 0.1;
    public static final double MAX_CATEGORY_OVERRIDE = 2.0;

    public List<CatalogIssue> validate(QuestionCatalogDocument doc) {
        List<CatalogIssue> issues = new ArrayList<>();

        duplicate(doc.categories().stream().map(c -> new Row(c.id(), "category")).toList(), "DUPLICATE_CATEGORY", issues);
        duplicate(Stream.concat(doc.questions().stream(), doc.followUps().stream().map(FollowUpQuestion::question).filter(Objects::nonNull))
                .map(q -> new Row(q.id(), "question")).toList(), "DUPLICATE_QUESTION", issues);

        doc.categories().forEach(c -> {
            if (!(c.weight() > 0)) {
                issues.add(new CatalogIssue("INVALID_WEIGHT", "Category weight must be positive: " + c.weight(), c.id()));
            }
        });

        Set<String> categories = doc.categories().stream().map(CategoryDefinition::id).collect(Collectors.toSet());
        Set<String> followUpIds = doc.followUps().stream()
                .map(f -> f.question() == null ? null : f.question().id())
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        doc.questions().forEach(q -> validateQuestion(q, categories, followUpIds, issues));

        Map<String, Question> mainQuestions = doc.questions().stream()
                .collect(Collectors.toMap(Question::id, q -> q, (a, b) -> a));
        doc.followUps().forEach(f -> {
            if (f.question() == null) {
                issues.add(new CatalogIssue("MISSING_QUESTION", "Follow-up has no question body", f.parentQuestionId()));
                return;
            }
            validateQuestion(f.question(), categories, Set.of(), issues);
            Question parent = mainQuestions.get(f.parentQuestionId());
            if (parent == null) {
                issues.add(new CatalogIssue("PARENT_NOT_FOUND", "Follow-up references unknown parent question: " + f.parentQuestionId(), f.id()));
            } else if (parent.option(f.triggerOptionValue()).isEmpty()) {
                issues.add(new CatalogIssue("TRIGGER_NOT_FOUND", "Parent question has no option with value: " + f.triggerOptionValue(), f.id()));
            }
        });

        return issues;
    }

    public List<CatalogIssue> validate(WorkflowDocument doc) {
        List<CatalogIssue> issues = new ArrayList<>();

        duplicate(doc.templates().stream().map(t -> new Row(t.id(), "template")).toList(), "DUPLICATE_TEMPLATE", issues);
        duplicate(doc.stations().stream().map(s -> new Row(s.stationId(), "station")).toList(), "DUPLICATE_STATION", issues);

        Set<String> templateIds = doc.templates().stream().map(t -> t.id()).collect(Collectors.toSet());
        Set<String> stationIds = doc.stations().stream().map(StationRequirement::stationId).collect(Collectors.toSet());

        for (StationRequirement station : doc.stations()) {
            Stream.of(station.requiredArtifacts(), station.optionalArtifacts(), station.outputArtifacts())
                    .flatMap(List::stream)
                    .filter(t -> !templateIds.contains(t))
                    .distinct()
                    .forEach(t -> issues.add(new CatalogIssue("TEMPLATE_NOT_FOUND", "Station references unknown template: " + t, station.stationId())));
            if (station.previousStation() != null && !stationIds.contains(station.previousStation())) {
                issues.add(new CatalogIssue("STATION_NOT_FOUND", "Station references unknown predecessor: " + station.previousStation(), station.stationId()));
            }
        }

        Set<ServicePathway> covered = EnumSet.noneOf(ServicePathway.class);
        for (PathwayWorkflow workflow : doc.pathways()) {
            if (workflow.pathway() == null) {
                issues.add(new CatalogIssue("PATHWAY_MISSING", "Workflow declares no pathway", null));
                continue;
            }
            if (!covered.add(workflow.pathway())) {
                issues.add(new CatalogIssue("DUPLICATE_PATHWAY", "Pathway declared twice", workflow.pathway().value()));
            }
            validateStages(workflow, templateIds, stationIds, issues);
        }
        for (ServicePathway pathway : ServicePathway.values()) {
            if (!covered.contains(pathway)) {
                issues.add(new CatalogIssue("PATHWAY_MISSING", "No workflow defined for pathway", pathway.value()));
            }
        }

        Map<String, String> predecessors = new HashMap<>();
        doc.stations().stream()
                .filter(s -> s.previousStation() != null)
                .forEach(s -> predecessors.put(s.stationId(), s.previousStation()));
        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String station : stationIds) {
            if (hasCycle(station, predecessors, visiting, visited)) {
                issues.add(new CatalogIssue("CYCLE_DETECTED", "Cycle detected in station predecessor chain", station));
                break;
            }
        }

        return issues;
    }

    /** Checks administrator overrides against the catalog they are applied to. */
    public List<CatalogIssue> validate(WeightConfiguration configuration, QuestionCatalog catalog) {
        List<CatalogIssue> issues = new ArrayList<>();
        if (configuration == null) return issues;

        for (QuestionWeight w : configuration.questionWeights()) {
            if (catalog.question(w.questionId()).isEmpty() && catalog.followUp(w.questionId()).isEmpty()) {
                issues.add(new CatalogIssue("QUESTION_NOT_FOUND", "Weight override references unknown question: " + w.questionId(), w.questionId()));
            }
            if (w.weight() < MIN_QUESTION_WEIGHT || w.weight() > MAX_QUESTION_WEIGHT) {
                issues.add(new CatalogIssue("INVALID_WEIGHT", "Question weight must be between 1 and 5: " + w.weight(), w.questionId()));
            }
        }
        for (CategoryWeight w : configuration.categoryWeights()) {
            if (!catalog.hasCategory(w.category())) {
                issues.add(new CatalogIssue("UNKNOWN_CATEGORY", "Weight override references unknown category: " + w.category(), w.category()));
            }
            if (w.weight() < MIN_CATEGORY_OVERRIDE || w.weight() > MAX_CATEGORY_OVERRIDE) {
                issues.add(new CatalogIssue("INVALID_WEIGHT", "Category weight must be between 0.1 and 2.0: " + w.weight(), w.category()));
            }
        }
        return issues;
    }

    private void validateQuestion(Question q, Set<String> categories, Set<String> followUpIds, List<CatalogIssue> issues) {
        if (q.type() == null) {
            issues.add(new CatalogIssue("MISSING_TYPE", "Question has no type", q.id()));
        }
        if (!categories.contains(q.category())) {
            issues.add(new CatalogIssue("UNKNOWN_CATEGORY", "Question references unknown category: " + q.category(), q.id()));
        }
        if (q.weight() < MIN_QUESTION_WEIGHT || q.weight() > MAX_QUESTION_WEIGHT) {
            issues.add(new CatalogIssue("INVALID_WEIGHT", "Question weight must be between 1 and 5: " + q.weight(), q.id()));
        }
        duplicate(q.options().stream().map(o -> new Row(o.value(), "option")).toList(), "DUPLICATE_OPTION", issues);
        for (QuestionOption option : q.options()) {
            if (option.score() < 0 || option.score() > 100) {
                issues.add(new CatalogIssue("INVALID_SCORE", "Option score must be between 0 and 100: " + option.score(), q.id() + "/" + option.value()));
            }
            option.triggersFollowUp().stream()
                    .filter(id -> !followUpIds.contains(id))
                    .forEach(id -> issues.add(new CatalogIssue("FOLLOW_UP_NOT_FOUND", "Option triggers unknown follow-up: " + id, q.id() + "/" + option.value())));
        }
    }

    private void validateStages(PathwayWorkflow workflow, Set<String> templateIds, Set<String> stationIds, List<CatalogIssue> issues) {
        String pathway = workflow.pathway().value();
        if (workflow.stages().isEmpty()) {
            issues.add(new CatalogIssue("STAGE_SEQUENCE", "Pathway has no stages", pathway));
        }
        for (int i = 0; i < workflow.stages().size(); i++) {
            WorkflowStage stage = workflow.stages().get(i);
            String node = pathway + "#" + stage.stage();
            if (stage.stage() != i + 1) {
                issues.add(new CatalogIssue("STAGE_SEQUENCE", "Stages must be numbered 1..n in order, found " + stage.stage() + " at position " + (i + 1), node));
            }
            stage.stations().stream()
                    .filter(s -> !stationIds.contains(s))
                    .forEach(s -> issues.add(new CatalogIssue("STATION_NOT_FOUND", "Stage references unknown station: " + s, node)));
            Stream.concat(stage.requiredArtifacts().stream(), stage.outputArtifacts().stream())
                    .filter(t -> !templateIds.contains(t))
                    .distinct()
                    .forEach(t -> issues.add(new CatalogIssue("TEMPLATE_NOT_FOUND", "Stage references unknown template: " + t, node)));
        }
    }

    private boolean hasCycle(String node, Map<String, String> predecessors, Set<String> visiting, Set<String> visited) {
        if (node == null || visited.contains(node)) return false;
        if (visiting.contains(node)) return true;

        visiting.add(node);
        if (hasCycle(predecessors.get(node), predecessors, visiting, visited)) return true;
        visiting.remove(node);
        visited.add(node);
        return false;
    }

    private void duplicate(List<Row> rows, String code, List<CatalogIssue> issues) {
        Map<String, Long> counts = rows.stream()
                .filter(r -> r.id() != null)
                .collect(Collectors.groupingBy(Row::id, Collectors.counting()));
        counts.forEach((id, count) -> {
            if (count > 1) {
                String block = rows.stream().filter(r -> id.equals(r.id())).findFirst().map(Row::block).orElse("entry");
                issues.add(new CatalogIssue(code, "Duplicate " + block + " id: " + id, id));
            }
        });
        rows.stream()
                .filter(r -> r.id() == null)
                .findFirst()
                .ifPresent(r -> issues.add(new CatalogIssue("MISSING_ID", "A " + r.block() + " has no id", null)));
    }

    private record Row(String id, String block) {}
}
