package com.serveos.engine.workflow;

import com.serveos.engine.domain.DomainModels.ArtifactScope;
import com.serveos.engine.domain.DomainModels.ArtifactStatus;
import com.serveos.engine.domain.DomainModels.ServicePathway;
import com.serveos.engine.domain.DomainModels.StationRunStatus;

import java.util.List;

public class WorkflowModels {

    public record TemplateMetadata(String id,
                                   String name,
                                   String stage,
                                   String tier,
                                   ArtifactScope scope,
                                   String description) {}

    public record StationRequirement(String stationId,
                                     String name,
                                     String description,
                                     ArtifactScope scope,
                                     List<String> requiredArtifacts,
                                     List<String> optionalArtifacts,
                                     List<String> outputArtifacts,
                                     String previousStation) {
        public StationRequirement {
            requiredArtifacts = requiredArtifacts == null ? List.of() : List.copyOf(requiredArtifacts);
            optionalArtifacts = optionalArtifacts == null ? List.of() : List.copyOf(optionalArtifacts);
            outputArtifacts = outputArtifacts == null ? List.of() : List.copyOf(outputArtifacts);
        }
    }

    public record WorkflowStage(int stage,
                                String name,
                                String description,
                                List<String> stations,
                                List<String> requiredArtifacts,
                                List<String> outputArtifacts) {
        public WorkflowStage {
            stations = stations == null ? List.of() : List.copyOf(stations);
            requiredArtifacts = requiredArtifacts == null ? List.of() : List.copyOf(requiredArtifacts);
            outputArtifacts = outputArtifacts == null ? List.of() : List.copyOf(outputArtifacts);
        }
    }

    public record PathwayWorkflow(ServicePathway pathway, List<WorkflowStage> stages) {
        public PathwayWorkflow {
            stages = stages == null ? List.of() : List.copyOf(stages);
        }
    }

    /** Raw shape of the workflow JSON, before validation. */
    public record WorkflowDocument(List<TemplateMetadata> templates,
                                   List<StationRequirement> stations,
                                   List<PathwayWorkflow> pathways) {
        public WorkflowDocument {
            templates = templates == null ? List.of() : List.copyOf(templates);
            stations = stations == null ? List.of() : List.copyOf(stations);
            pathways = pathways == null ? List.of() : List.copyOf(pathways);
        }
    }

    /** An artifact the engagement holds. Any other property a caller sends is ignored. */
    public record ArtifactInput(String templateId, ArtifactStatus status) {
        public boolean satisfiesRequirement() {
            return status != null && status.isActive();
        }
    }

    public record StationInput(String stationId, StationRunStatus status) {
        public boolean satisfiesPredecessor() {
            return status != null && status.isFinished();
        }
    }

    public record ValidationResult(boolean canRun,
                                   List<String> missingArtifacts,
                                   List<String> missingStations,
                                   List<String> warnings) {}

    public record StageInfo(int currentStage,
                            String stageName,
                            List<String> completedArtifacts,
                            List<String> nextArtifacts) {}

    public record StationAvailability(String stationId, boolean canRun, ValidationResult validation) {}
}
