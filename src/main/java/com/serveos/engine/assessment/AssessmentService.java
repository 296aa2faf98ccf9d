package com.serveos.engine.assessment;

import com.serveos.engine.assessment.AssessmentModels.Answer;
import com.serveos.engine.assessment.AssessmentModels.AnswerValidation;
import com.serveos.engine.assessment.AssessmentModels.AssessmentScores;
import com.serveos.engine.assessment.AssessmentModels.RiskProfile;
import com.serveos.engine.catalog.CatalogModels.CatalogIssue;
import com.serveos.engine.catalog.CatalogModels.FollowUpQuestion;
import com.serveos.engine.catalog.CatalogModels.Question;
import com.serveos.engine.catalog.CatalogModels.WeightConfiguration;
import com.serveos.engine.catalog.CatalogValidator;
import com.serveos.engine.catalog.QuestionCatalog;
import com.serveos.engine.domain.DomainModels.ReadinessPathway;
import com.serveos.engine.exception.CatalogConfigurationException;
import com.serveos.engine.recommendation.PathwayRecommender;
import com.serveos.engine.recommendation.RecommendationModels.PathwayOverride;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for callers working with intake answers against the bundled question catalog.
 */
@Service
public class AssessmentService {
    private final QuestionCatalog catalog;
    private final ScoringEngine scoringEngine;
    private final PathwayRecommender pathwayRecommender;
    private final CatalogValidator validator;
    private final Clock clock;

    public AssessmentService(QuestionCatalog catalog,
                             ScoringEngine scoringEngine,
                             PathwayRecommender pathwayRecommender,
                             CatalogValidator validator,
                             Clock clock) {
        this.catalog = catalog;
        this.scoringEngine = scoringEngine;
        this.pathwayRecommender = pathwayRecommender;
        this.validator = validator;
        this.clock = clock;
    }

    public AssessmentScores calculateAssessmentScore(List<Answer> answers) {
        return scoringEngine.score(answers, catalog);
    }

    /**
     * Scores against the catalog with administrator weight overrides applied.
     *
     * @throws CatalogConfigurationException when an override names an unknown question or category
     *     or its weight is out of range
     */
    public AssessmentScores calculateAssessmentScore(List<Answer> answers, WeightConfiguration weights) {
        return scoringEngine.score(answers, reweighted(weights));
    }

    public boolean isAssessmentComplete(List<Answer> answers) {
        return nextQuestion(answers).isEmpty();
    }

    /**
     * The first unanswered main question in catalog order, then the first unanswered triggered
     * follow-up.
     */
    public Optional<Question> nextQuestion(List<Answer> answers) {
        AnswerSheet sheet = AnswerSheet.of(answers);

        for (Question question : catalog.questions()) {
            if (!sheet.isAnswered(question.id())) return Optional.of(question);
        }
        return scoringEngine.applicableFollowUps(sheet, catalog).stream()
                .map(FollowUpQuestion::question)
                .filter(q -> !sheet.isAnswered(q.id()))
                .findFirst();
    }

    public AnswerValidation validateAnswers(List<Answer> answers) {
        AnswerSheet sheet = AnswerSheet.of(answers);
        List<String> missing = catalog.questions().stream()
                .map(Question::id)
                .filter(id -> !sheet.isAnswered(id))
                .toList();
        return new AnswerValidation(missing.isEmpty(), missing);
    }

    public List<Question> questionsByCategory(String category) {
        return catalog.questionsByCategory(category);
    }

    public QuestionCatalog catalog() {
        return catalog;
    }

    /** Scores of an assessment nobody has started yet. */
    public AssessmentScores initialScores() {
        return new AssessmentScores(0, List.of(), RiskProfile.none(), pathwayRecommender.pending(),
                0, catalog.questions().size(), 0);
    }

    public PathwayOverride overridePathway(AssessmentScores scores,
                                           ReadinessPathway newPathway,
                                           String justification,
                                           String overriddenBy) {
        return pathwayRecommender.override(scores.pathwayRecommendation().pathway(), newPathway,
                justification, overriddenBy, clock.instant());
    }

    private QuestionCatalog reweighted(WeightConfiguration weights) {
        if (weights == null || weights.isEmpty()) return catalog;

        List<CatalogIssue> issues = validator.validate(weights, catalog);
        if (!issues.isEmpty()) {
            throw new CatalogConfigurationException("weight overrides", issues);
        }
        return catalog.withWeights(weights);
    }
}
