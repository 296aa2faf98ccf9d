package com.serveos.engine;

import com.serveos.engine.assessment.AnswerSheet;
import com.serveos.engine.assessment.AssessmentModels.Answer;
import com.serveos.engine.assessment.RiskProfiler;
import com.serveos.engine.catalog.CatalogModels.Question;
import com.serveos.engine.catalog.QuestionCatalog;
import com.serveos.engine.domain.DomainModels.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskProfilerTest {
    private final RiskProfiler profiler = new RiskProfiler();
    private final QuestionCatalog catalog = CatalogFixtures.questionCatalog();

    private List<Question> withFollowUp() {
        List<Question> questions = new ArrayList<>(catalog.questions());
        questions.add(catalog.followUp("q1_follow").orElseThrow().question());
        return questions;
    }

    @Test
    void twoHighRiskAnswersStayMedium() {
        var profile = profiler.assess(AnswerSheet.of(List.of(
                Answer.of("q1", "low"),
                Answer.of("q3", "weak"))), withFollowUp());

        assertEquals(RiskLevel.MEDIUM, profile.level());
        assertEquals(List.of("alpha: Low", "beta: Weak"), profile.factors());
    }

    @Test
    void thirdHighRiskAnswerEscalatesToHigh() {
        var profile = profiler.assess(AnswerSheet.of(List.of(
                Answer.of("q1", "low"),
                Answer.of("q3", "weak"),
                Answer.of("q1_follow", "later"))), withFollowUp());

        assertEquals(RiskLevel.HIGH, profile.level());
        assertEquals(3, profile.factors().size());
    }

    @Test
    void anyCriticalSelectionIsCritical() {
        var profile = profiler.assess(AnswerSheet.of(List.of(
                Answer.of("q1", "top"),
                Answer.of("q2", List.of("x", "z")))), catalog.questions());

        assertEquals(RiskLevel.CRITICAL, profile.level());
        assertEquals(List.of("CRITICAL - alpha: Z"), profile.factors());
    }

    @Test
    void mediumAndLowOptionsAddNoFactors() {
        var profile = profiler.assess(AnswerSheet.of(List.of(
                Answer.of("q1", "mid"),
                Answer.of("q3", "ok"))), catalog.questions());

        assertEquals(RiskLevel.LOW, profile.level());
        assertTrue(profile.factors().isEmpty());
    }

    @Test
    void answersOutsideApplicableQuestionsAreIgnored() {
        var profile = profiler.assess(AnswerSheet.of(List.of(
                Answer.of("q1_follow", "later"),
                Answer.of("ghost", "weak"))), catalog.questions());

        assertEquals(RiskLevel.LOW, profile.level());
        assertTrue(profile.factors().isEmpty());
    }

    @Test
    void levelEscalationBoundaries() {
        assertEquals(RiskLevel.LOW, profiler.levelFor(0, 0));
        assertEquals(RiskLevel.MEDIUM, profiler.levelFor(1, 0));
        assertEquals(RiskLevel.MEDIUM, profiler.levelFor(2, 0));
        assertEquals(RiskLevel.HIGH, profiler.levelFor(3, 0));
        assertEquals(RiskLevel.CRITICAL, profiler.levelFor(0, 1));
        assertEquals(RiskLevel.CRITICAL, profiler.levelFor(5, 1));
    }
}
