package com.serveos.engine.workflow;

import com.serveos.engine.domain.DomainModels.ArtifactScope;
import com.serveos.engine.domain.DomainModels.ServicePathway;
import com.serveos.engine.workflow.WorkflowModels.ArtifactInput;
import com.serveos.engine.workflow.WorkflowModels.StationAvailability;
import com.serveos.engine.workflow.WorkflowModels.StationInput;
import com.serveos.engine.workflow.WorkflowModels.StationRequirement;
import com.serveos.engine.workflow.WorkflowModels.ValidationResult;
import com.serveos.engine.workflow.WorkflowModels.WorkflowStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Decides whether a station may run given the artifacts and station runs that exist right now.
 * Side-effect free, so it is safe to call just to render a disabled control.
 */
@Service
public class WorkflowGraphService {
    private static final Logger log = LoggerFactory.getLogger(WorkflowGraphService.class);

    private final WorkflowCatalog catalog;

    public WorkflowGraphService(WorkflowCatalog catalog) {
        this.catalog = catalog;
    }

    public ValidationResult validateStationPrerequisites(String stationId,
                                                         List<ArtifactInput> existingArtifacts,
                                                         List<StationInput> completedStations) {
        Optional<StationRequirement> requirement = catalog.station(stationId);
        if (requirement.isEmpty()) {
            return new ValidationResult(false, List.of(), List.of(String.valueOf(stationId)),
                    List.of("Unknown station: " + stationId));
        }
        StationRequirement station = requirement.get();
        Set<String> present = activeTemplates(existingArtifacts);

        List<String> missingArtifacts = new ArrayList<>();
        List<String> missingStations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (String templateId : station.requiredArtifacts()) {
            if (present.contains(templateId)) continue;
            missingArtifacts.add(templateId);
            catalog.template(templateId)
                    .filter(t -> t.scope() == ArtifactScope.CLIENT)
                    .ifPresent(t -> warnings.add(t.name() + " should be created at the Client level"));
        }

        String previous = station.previousStation();
        if (previous != null && !finishedStations(completedStations).contains(previous)) {
            missingStations.add(previous);
            catalog.station(previous)
                    .filter(s -> s.scope() == ArtifactScope.CLIENT)
                    .ifPresent(s -> warnings.add(s.name() + " must be run at the Client level first"));
        }

        for (String templateId : station.optionalArtifacts()) {
            if (!present.contains(templateId)) {
                warnings.add("Optional: " + catalog.templateName(templateId) + " (" + templateId + ") not found - output may be less detailed");
            }
        }

        boolean canRun = missingArtifacts.isEmpty() && missingStations.isEmpty();
        log.debug("Station {} canRun={} missingArtifacts={} missingStations={}", stationId, canRun, missingArtifacts, missingStations);
        return new ValidationResult(canRun, List.copyOf(missingArtifacts), List.copyOf(missingStations), List.copyOf(warnings));
    }

    /** Every station used by the pathway's stages, once, in first-appearance order. */
    public List<StationAvailability> availableStations(ServicePathway pathway,
                                                       List<ArtifactInput> existingArtifacts,
                                                       List<StationInput> completedStations) {
        Set<String> stations = new LinkedHashSet<>();
        for (WorkflowStage stage : catalog.stages(pathway)) {
            stations.addAll(stage.stations());
        }
        return stations.stream()
                .map(stationId -> {
                    ValidationResult validation = validateStationPrerequisites(stationId, existingArtifacts, completedStations);
                    return new StationAvailability(stationId, validation.canRun(), validation);
                })
                .toList();
    }

    static Set<String> activeTemplates(List<ArtifactInput> artifacts) {
        if (artifacts == null) return Set.of();
        return artifacts.stream()
                .filter(Objects::nonNull)
                .filter(ArtifactInput::satisfiesRequirement)
                .map(ArtifactInput::templateId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private Set<String> finishedStations(List<StationInput> stations) {
        if (stations == null) return Set.of();
        return stations.stream()
                .filter(Objects::nonNull)
                .filter(StationInput::satisfiesPredecessor)
                .map(StationInput::stationId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }
}
