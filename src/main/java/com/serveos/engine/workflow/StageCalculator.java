package com.serveos.engine.workflow;

import com.serveos.engine.domain.DomainModels.ServicePathway;
import com.serveos.engine.workflow.WorkflowModels.ArtifactInput;
import com.serveos.engine.workflow.WorkflowModels.StageInfo;
import com.serveos.engine.workflow.WorkflowModels.WorkflowStage;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Places an engagement within its pathway's stages from the artifacts that currently exist.
 */
@Service
public class StageCalculator {
    private final WorkflowCatalog catalog;

    public StageCalculator(WorkflowCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Scans stages from last to first; the first one whose non-empty requirements are all met
     * makes the stage after it current, capped at the final stage. Later work is credited even
     * when intermediate documents were skipped.
     */
    public StageInfo currentStage(ServicePathway pathway, List<ArtifactInput> existingArtifacts) {
        List<WorkflowStage> stages = catalog.stages(pathway);
        Set<String> completed = WorkflowGraphService.activeTemplates(existingArtifacts);
        if (stages.isEmpty()) {
            return new StageInfo(1, "Unknown", List.copyOf(completed), List.of());
        }

        int currentStage = 1;
        for (int i = stages.size() - 1; i >= 0; i--) {
            WorkflowStage stage = stages.get(i);
            if (!stage.requiredArtifacts().isEmpty() && completed.containsAll(stage.requiredArtifacts())) {
                currentStage = Math.min(stage.stage() + 1, stages.size());
                break;
            }
        }

        WorkflowStage current = stages.get(currentStage - 1);
        return new StageInfo(currentStage, current.name(), List.copyOf(completed), current.outputArtifacts());
    }
}
