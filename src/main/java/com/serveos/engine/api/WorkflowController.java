package com.serveos.engine.api;

import com.serveos.engine.domain.DomainModels.ServicePathway;
import com.serveos.engine.workflow.StageCalculator;
import com.serveos.engine.workflow.WorkflowGraphService;
import com.serveos.engine.workflow.WorkflowModels;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/workflow")
public class WorkflowController {
    private final WorkflowGraphService graphService;
    private final StageCalculator stageCalculator;

    public WorkflowController(WorkflowGraphService graphService, StageCalculator stageCalculator) {
        this.graphService = graphService;
        this.stageCalculator = stageCalculator;
    }

    @PostMapping("/stations/{stationId}/validate")
    public ResponseEntity<WorkflowModels.ValidationResult> validateStation(@PathVariable String stationId,
                                                                          @RequestBody StateRequest request) {
        return ResponseEntity.ok(graphService.validateStationPrerequisites(
                stationId, request.artifacts(), request.completedStations()));
    }

    @PostMapping("/stage")
    public ResponseEntity<WorkflowModels.StageInfo> stage(@Valid @RequestBody PathwayStateRequest request) {
        return ResponseEntity.ok(stageCalculator.currentStage(request.pathway(), request.artifacts()));
    }

    @PostMapping("/stations")
    public ResponseEntity<List<WorkflowModels.StationAvailability>> stations(@Valid @RequestBody PathwayStateRequest request) {
        return ResponseEntity.ok(graphService.availableStations(
                request.pathway(), request.artifacts(), request.completedStations()));
    }

    public record StateRequest(List<WorkflowModels.ArtifactInput> artifacts,
                               List<WorkflowModels.StationInput> completedStations) {}

    public record PathwayStateRequest(@NotNull ServicePathway pathway,
                                      List<WorkflowModels.ArtifactInput> artifacts,
                                      List<WorkflowModels.StationInput> completedStations) {}
}
