package com.serveos.engine.workflow;

import com.serveos.engine.domain.DomainModels.ServicePathway;
import com.serveos.engine.workflow.WorkflowModels.PathwayWorkflow;
import com.serveos.engine.workflow.WorkflowModels.StationRequirement;
import com.serveos.engine.workflow.WorkflowModels.TemplateMetadata;
import com.serveos.engine.workflow.WorkflowModels.WorkflowDocument;
import com.serveos.engine.workflow.WorkflowModels.WorkflowStage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable station requirements, template metadata and per-pathway stage lists.
 */
public final class WorkflowCatalog {
    private final Map<String, TemplateMetadata> templates;
    private final Map<String, StationRequirement> stations;
    private final Map<ServicePathway, List<WorkflowStage>> stagesByPathway;

    private WorkflowCatalog(Map<String, TemplateMetadata> templates,
                            Map<String, StationRequirement> stations,
                            Map<ServicePathway, List<WorkflowStage>> stagesByPathway) {
        this.templates = Collections.unmodifiableMap(templates);
        this.stations = Collections.unmodifiableMap(stations);
        this.stagesByPathway = Collections.unmodifiableMap(stagesByPathway);
    }

    /**
     * Indexes an already validated document. Use {@link com.serveos.engine.catalog.CatalogLoader}
     * to validate first.
     */
    public static WorkflowCatalog of(WorkflowDocument document) {
        Map<String, TemplateMetadata> templates = new LinkedHashMap<>();
        document.templates().forEach(t -> templates.putIfAbsent(t.id(), t));

        Map<String, StationRequirement> stations = new LinkedHashMap<>();
        document.stations().forEach(s -> stations.putIfAbsent(s.stationId(), s));

        Map<ServicePathway, List<WorkflowStage>> stages = new EnumMap<>(ServicePathway.class);
        for (PathwayWorkflow workflow : document.pathways()) {
            stages.putIfAbsent(workflow.pathway(), workflow.stages());
        }
        return new WorkflowCatalog(templates, stations, stages);
    }

    public Optional<StationRequirement> station(String stationId) {
        return Optional.ofNullable(stations.get(stationId));
    }

    public Map<String, StationRequirement> stations() {
        return stations;
    }

    public Optional<TemplateMetadata> template(String templateId) {
        return Optional.ofNullable(templates.get(templateId));
    }

    public Map<String, TemplateMetadata> templates() {
        return templates;
    }

    public String templateName(String templateId) {
        return template(templateId).map(TemplateMetadata::name).orElse(templateId);
    }

    public List<WorkflowStage> stages(ServicePathway pathway) {
        return stagesByPathway.getOrDefault(pathway, List.of());
    }
}
