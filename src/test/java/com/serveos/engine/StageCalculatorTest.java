package com.serveos.engine;

import com.serveos.engine.domain.DomainModels.ArtifactStatus;
import com.serveos.engine.domain.DomainModels.ServicePathway;
import com.serveos.engine.workflow.StageCalculator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.serveos.engine.CatalogFixtures.artifact;
import static org.junit.jupiter.api.Assertions.*;

class StageCalculatorTest {
    private final StageCalculator calculator = new StageCalculator(CatalogFixtures.workflowCatalog());

    @Test
    void startsAtFirstStageWithoutArtifacts() {
        var info = calculator.currentStage(ServicePathway.KNOWLEDGE_SPINE, List.of());

        assertEquals(1, info.currentStage());
        assertEquals("Intake & Discovery", info.stageName());
        assertEquals(List.of("TPL-01"), info.nextArtifacts());
        assertTrue(info.completedArtifacts().isEmpty());
    }

    @Test
    void stageAfterLastSatisfiedOneIsCurrent() {
        var info = calculator.currentStage(ServicePathway.KNOWLEDGE_SPINE, List.of(
                artifact("TPL-01", ArtifactStatus.APPROVED),
                artifact("TPL-02", ArtifactStatus.DRAFT)));

        assertEquals(4, info.currentStage());
        assertEquals("Review", info.stageName());
        assertEquals(List.of("TPL-10"), info.nextArtifacts());
        assertEquals(List.of("TPL-01", "TPL-02"), info.completedArtifacts());
    }

    @Test
    void creditsLaterWorkWhenEarlierDocumentsWereSkipped() {
        var info = calculator.currentStage(ServicePathway.KNOWLEDGE_SPINE, List.of(
                artifact("TPL-03", ArtifactStatus.APPROVED),
                artifact("TPL-05", ArtifactStatus.APPROVED)));

        assertEquals(5, info.currentStage());
    }

    @Test
    void capsAtFinalStage() {
        var info = calculator.currentStage(ServicePathway.KNOWLEDGE_SPINE, List.of(
                artifact("TPL-10", ArtifactStatus.APPROVED)));

        assertEquals(5, info.currentStage());
        assertEquals("Handoff", info.stageName());
    }

    @Test
    void inactiveArtifactsAreNotCompleted() {
        var info = calculator.currentStage(ServicePathway.KNOWLEDGE_SPINE, List.of(
                artifact("TPL-01", ArtifactStatus.ARCHIVED)));

        assertEquals(1, info.currentStage());
        assertTrue(info.completedArtifacts().isEmpty());
    }

    @Test
    void pathwayWithoutStagesIsUnknown() {
        var info = calculator.currentStage(ServicePathway.WORKFLOW_SPRINT, List.of());

        assertEquals(1, info.currentStage());
        assertEquals("Unknown", info.stageName());
    }
}
