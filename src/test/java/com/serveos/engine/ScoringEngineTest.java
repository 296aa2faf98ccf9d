package com.serveos.engine;

import com.serveos.engine.assessment.AnswerSheet;
import com.serveos.engine.assessment.AssessmentModels.Answer;
import com.serveos.engine.assessment.AssessmentModels.AnswerValue;
import com.serveos.engine.assessment.AssessmentModels.AssessmentScores;
import com.serveos.engine.assessment.AssessmentModels.CategoryScore;
import com.serveos.engine.assessment.RiskProfiler;
import com.serveos.engine.assessment.ScoringEngine;
import com.serveos.engine.assessment.SelectionScoreStrategy;
import com.serveos.engine.catalog.CatalogModels.Question;
import com.serveos.engine.catalog.QuestionCatalog;
import com.serveos.engine.domain.DomainModels.ReadinessPathway;
import com.serveos.engine.domain.DomainModels.RiskLevel;
import com.serveos.engine.recommendation.PathwayRecommender;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoringEngineTest {
    private final QuestionCatalog catalog = CatalogFixtures.questionCatalog();
    private final ScoringEngine engine = engine(SelectionScoreStrategy.AVERAGE);

    private static ScoringEngine engine(SelectionScoreStrategy strategy) {
        return new ScoringEngine(new RiskProfiler(), new PathwayRecommender(), strategy);
    }

    private static Answer scale(String questionId, double value) {
        return new Answer(questionId, AnswerValue.number(value), null, null);
    }

    private static int category(AssessmentScores scores, String category) {
        return scores.categoryScores().stream()
                .filter(c -> c.category().equals(category))
                .mapToInt(CategoryScore::score)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void scoresStrongAnswersIntoAcceleratedPathway() {
        var scores = engine.score(List.of(
                Answer.of("q1", "top"),
                Answer.of("q2", List.of("y")),
                Answer.of("q3", "strong"),
                scale("q4", 7)), catalog);

        assertEquals(93, category(scores, "alpha"));
        assertEquals(100, category(scores, "beta"));
        assertEquals(98, scores.overallScore());
        assertEquals(RiskLevel.LOW, scores.riskProfile().level());
        assertEquals(ReadinessPathway.ACCELERATED, scores.pathwayRecommendation().pathway());
        assertEquals(4, scores.answeredQuestions());
        assertEquals(4, scores.totalQuestions());
        assertEquals(100, scores.completionPercentage());
    }

    @Test
    void emptyAnswersScoreZeroWithoutFailing() {
        var scores = engine.score(List.of(), catalog);

        assertEquals(0, scores.overallScore());
        assertEquals(0, scores.answeredQuestions());
        assertEquals(4, scores.totalQuestions());
        assertEquals(0, scores.completionPercentage());
        assertEquals(RiskLevel.LOW, scores.riskProfile().level());
        assertTrue(scores.categoryScores().stream().allMatch(c -> c.score() == 0 && c.maxScore() == 100));
    }

    @Test
    void scoresStayWithinRange() {
        List<List<Answer>> sheets = List.of(
                List.of(Answer.of("q1", "low"), Answer.of("q3", "weak")),
                List.of(Answer.of("q2", List.of("x", "y", "z"))),
                List.of(Answer.of("q1", "top"), Answer.of("q1_follow", "soon"), Answer.of("q3", "ok")),
                List.of(Answer.of("q1", "bogus"), Answer.of("unknown", "top")));

        for (List<Answer> answers : sheets) {
            var scores = engine.score(answers, catalog);
            assertTrue(scores.overallScore() >= 0 && scores.overallScore() <= 100);
            scores.categoryScores().forEach(c -> assertTrue(c.score() >= 0 && c.score() <= 100));
            assertTrue(scores.completionPercentage() >= 0 && scores.completionPercentage() <= 100);
        }
    }

    @Test
    void sameAnswersGiveSameScores() {
        List<Answer> answers = List.of(Answer.of("q1", "low"), Answer.of("q1_follow", "later"), Answer.of("q3", "ok"));

        assertEquals(engine.score(answers, catalog), engine.score(answers, catalog));
    }

    @Test
    void betterOptionNeverLowersScore() {
        int previousCategory = -1;
        int previousOverall = -1;
        for (String value : List.of("weak", "ok", "strong")) {
            var scores = engine.score(List.of(Answer.of("q1", "top"), Answer.of("q3", value)), catalog);
            assertTrue(category(scores, "beta") >= previousCategory);
            assertTrue(scores.overallScore() >= previousOverall);
            previousCategory = category(scores, "beta");
            previousOverall = scores.overallScore();
        }
    }

    @Test
    void triggeredFollowUpJoinsApplicableQuestions() {
        var triggered = engine.score(List.of(Answer.of("q1", "low"), Answer.of("q1_follow", "soon")), catalog);

        assertEquals(5, triggered.totalQuestions());
        assertEquals(2, triggered.answeredQuestions());
        assertEquals(28, category(triggered, "alpha"));
    }

    @Test
    void followUpDisappearsWhenTriggerAnswerChanges() {
        var untriggered = engine.score(List.of(Answer.of("q1", "mid"), Answer.of("q1_follow", "soon")), catalog);

        assertEquals(4, untriggered.totalQuestions());
        assertEquals(1, untriggered.answeredQuestions());
        assertEquals(40, category(untriggered, "alpha"));

        List<Question> applicable = engine.applicableQuestions(
                AnswerSheet.of(List.of(Answer.of("q1", "mid"))), catalog);
        assertTrue(applicable.stream().noneMatch(q -> q.id().equals("q1_follow")));
    }

    @Test
    void laterAnswerForSameQuestionWins() {
        var scores = engine.score(List.of(Answer.of("q3", "weak"), Answer.of("q3", "strong")), catalog);

        assertEquals(100, category(scores, "beta"));
        assertEquals(1, scores.answeredQuestions());
        assertEquals(RiskLevel.LOW, scores.riskProfile().level());
    }

    @Test
    void unknownQuestionsAndOptionsAreIgnored() {
        var scores = engine.score(List.of(Answer.of("nope", "top"), Answer.of("q1", "bogus")), catalog);

        assertEquals(1, scores.answeredQuestions());
        assertEquals(0, category(scores, "alpha"));
    }

    @Test
    void scaleAnswersCountTowardCompletionOnly() {
        var scores = engine.score(List.of(scale("q4", 9)), catalog);

        assertEquals(1, scores.answeredQuestions());
        assertEquals(25, scores.completionPercentage());
        assertEquals(0, category(scores, "beta"));
    }

    @Test
    void multiSelectAnswersUseConfiguredStrategy() {
        List<Answer> answers = List.of(Answer.of("q2", List.of("x", "y")));

        // alpha max possible: q1 100 * 2 + q2 100 * 1 = 300
        assertEquals(20, category(engine(SelectionScoreStrategy.AVERAGE).score(answers, catalog), "alpha"));
        assertEquals(27, category(engine(SelectionScoreStrategy.MAX).score(answers, catalog), "alpha"));
        assertEquals(33, category(engine(SelectionScoreStrategy.CAPPED_SUM).score(answers, catalog), "alpha"));
    }

    @Test
    void averagingDividesByEverySelectedValue() {
        var scores = engine.score(List.of(Answer.of("q2", List.of("x", "missing"))), catalog);

        assertEquals(7, category(scores, "alpha"));
    }

    @Test
    void missingStrategyFallsBackToAverage() {
        List<Answer> answers = List.of(Answer.of("q2", List.of("x", "y")));

        assertEquals(engine.score(answers, catalog), engine(null).score(answers, catalog));
    }

    @Test
    void doesNotMutateCallerAnswers() {
        List<Answer> answers = new ArrayList<>(List.of(Answer.of("q1", "low"), Answer.of("q3", "ok")));
        List<Answer> copy = List.copyOf(answers);

        engine.score(answers, catalog);

        assertEquals(copy, answers);
    }
}
