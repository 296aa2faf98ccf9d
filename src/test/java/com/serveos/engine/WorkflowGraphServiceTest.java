package com.serveos.engine;

import com.serveos.engine.domain.DomainModels.ArtifactStatus;
import com.serveos.engine.domain.DomainModels.ServicePathway;
import com.serveos.engine.domain.DomainModels.StationRunStatus;
import com.serveos.engine.workflow.WorkflowGraphService;
import com.serveos.engine.workflow.WorkflowModels.StationAvailability;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.serveos.engine.CatalogFixtures.artifact;
import static com.serveos.engine.CatalogFixtures.station;
import static org.junit.jupiter.api.Assertions.*;

class WorkflowGraphServiceTest {
    private final WorkflowGraphService service = new WorkflowGraphService(CatalogFixtures.workflowCatalog());

    @Test
    void reportsMissingArtifactAndPredecessor() {
        var result = service.validateStationPrerequisites("S-02",
                List.of(artifact("TPL-01", ArtifactStatus.APPROVED)), List.of());

        assertFalse(result.canRun());
        assertEquals(List.of("TPL-02"), result.missingArtifacts());
        assertEquals(List.of("S-01"), result.missingStations());
        assertEquals(List.of(
                "Current State Map should be created at the Client level",
                "Discovery Station must be run at the Client level first"), result.warnings());
    }

    @Test
    void runsWhenRequirementsMetAndWarnsAboutOptionalArtifacts() {
        var result = service.validateStationPrerequisites("S-03",
                List.of(artifact("TPL-03", ArtifactStatus.DRAFT), artifact("TPL-05", ArtifactStatus.PENDING_REVIEW)),
                List.of(station("S-02", StationRunStatus.COMPLETE)));

        assertTrue(result.canRun());
        assertTrue(result.missingArtifacts().isEmpty());
        assertTrue(result.missingStations().isEmpty());
        assertEquals(List.of(
                "Optional: ROI Calculator (TPL-09) not found - output may be less detailed",
                "Optional: Client Handoff (TPL-10) not found - output may be less detailed"), result.warnings());
    }

    @Test
    void archivedAndRejectedArtifactsDoNotCount() {
        var result = service.validateStationPrerequisites("S-01",
                List.of(artifact("TPL-01", ArtifactStatus.ARCHIVED), artifact("TPL-01", ArtifactStatus.REJECTED)),
                List.of());

        assertFalse(result.canRun());
        assertEquals(List.of("TPL-01"), result.missingArtifacts());
    }

    @Test
    void onlyFinishedPredecessorRunsCount() {
        var approved = service.validateStationPrerequisites("S-02",
                List.of(artifact("TPL-01", ArtifactStatus.APPROVED), artifact("TPL-02", ArtifactStatus.DRAFT)),
                List.of(station("S-01", StationRunStatus.APPROVED)));
        var awaiting = service.validateStationPrerequisites("S-02",
                List.of(artifact("TPL-01", ArtifactStatus.APPROVED), artifact("TPL-02", ArtifactStatus.DRAFT)),
                List.of(station("S-01", StationRunStatus.AWAITING_APPROVAL)));

        assertTrue(approved.canRun());
        assertFalse(awaiting.canRun());
        assertEquals(List.of("S-01"), awaiting.missingStations());
    }

    @Test
    void unknownStatusesNeverSatisfyRequirements() {
        var result = service.validateStationPrerequisites("S-02",
                List.of(artifact("TPL-01", null), artifact("TPL-02", ArtifactStatus.fromValue("shredded"))),
                List.of(station("S-01", StationRunStatus.fromValue("done"))));

        assertFalse(result.canRun());
        assertEquals(List.of("TPL-01", "TPL-02"), result.missingArtifacts());
        assertEquals(List.of("S-01"), result.missingStations());
    }

    @Test
    void unknownStationCannotRun() {
        var result = service.validateStationPrerequisites("S-99", List.of(), List.of());

        assertFalse(result.canRun());
        assertEquals(List.of("S-99"), result.missingStations());
        assertEquals(List.of("Unknown station: S-99"), result.warnings());
    }

    @Test
    void toleratesNullInputLists() {
        var result = service.validateStationPrerequisites("S-01", null, null);

        assertFalse(result.canRun());
        assertEquals(List.of("TPL-01"), result.missingArtifacts());
    }

    @Test
    void listsPathwayStationsInStageOrder() {
        List<StationAvailability> stations = service.availableStations(ServicePathway.KNOWLEDGE_SPINE,
                List.of(artifact("TPL-01", ArtifactStatus.APPROVED)), List.of());

        assertEquals(List.of("S-01", "S-02", "S-03"), stations.stream().map(StationAvailability::stationId).toList());
        assertTrue(stations.get(0).canRun());
        assertFalse(stations.get(1).canRun());
        assertFalse(stations.get(2).canRun());
        assertEquals(stations.get(1).canRun(), stations.get(1).validation().canRun());
    }

    @Test
    void pathwayWithoutWorkflowHasNoStations() {
        assertTrue(service.availableStations(ServicePathway.ROI_AUDIT, List.of(), List.of()).isEmpty());
    }
}
