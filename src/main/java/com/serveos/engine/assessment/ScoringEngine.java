package com.serveos.engine.assessment;

import com.serveos.engine.assessment.AssessmentModels.Answer;
import com.serveos.engine.assessment.AssessmentModels.AssessmentScores;
import com.serveos.engine.assessment.AssessmentModels.CategoryScore;
import com.serveos.engine.assessment.AssessmentModels.RiskProfile;
import com.serveos.engine.catalog.CatalogModels.FollowUpQuestion;
import com.serveos.engine.catalog.CatalogModels.Question;
import com.serveos.engine.catalog.CatalogModels.QuestionOption;
import com.serveos.engine.catalog.QuestionCatalog;
import com.serveos.engine.recommendation.PathwayRecommender;
import com.serveos.engine.recommendation.RecommendationModels.PathwayRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Stream;

/**
 * Weighted, normalized readiness scoring. Stateless: every call works only on the answers and the
 * catalog it is given.
 */
@Component
public class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    public static final int MAX_SCORE = 100;

    private final RiskProfiler riskProfiler;
    private final PathwayRecommender pathwayRecommender;
    private final SelectionScoreStrategy multiSelectStrategy;

    @Autowired
    public ScoringEngine(RiskProfiler riskProfiler, PathwayRecommender pathwayRecommender, ScoringProperties properties) {
        this(riskProfiler, pathwayRecommender, properties.multiSelectStrategy());
    }

    public ScoringEngine(RiskProfiler riskProfiler, PathwayRecommender pathwayRecommender, SelectionScoreStrategy multiSelectStrategy) {
        this.riskProfiler = riskProfiler;
        this.pathwayRecommender = pathwayRecommender;
        this.multiSelectStrategy = multiSelectStrategy == null ? SelectionScoreStrategy.AVERAGE : multiSelectStrategy;
    }

    public AssessmentScores score(List<Answer> answers, QuestionCatalog catalog) {
        AnswerSheet sheet = AnswerSheet.of(answers);
        List<Question> applicable = applicableQuestions(sheet, catalog);

        List<CategoryScore> categoryScores = categoryScores(sheet, applicable, catalog);
        int overallScore = overallScore(categoryScores);
        RiskProfile riskProfile = riskProfiler.assess(sheet, applicable);
        PathwayRecommendation recommendation = pathwayRecommender.recommend(overallScore, riskProfile, categoryScores);

        int answered = (int) applicable.stream().filter(q -> sheet.isAnswered(q.id())).count();
        int total = applicable.size();
        int completion = total == 0 ? 0 : (int) Math.round(answered * 100.0 / total);

        log.debug("Scored {}/{} answered questions: overall={}, risk={}, pathway={}",
                answered, total, overallScore, riskProfile.level(), recommendation.pathway());
        return new AssessmentScores(overallScore, categoryScores, riskProfile, recommendation, answered, total, completion);
    }

    /** Main catalog questions followed by the currently triggered follow-ups. */
    public List<Question> applicableQuestions(AnswerSheet sheet, QuestionCatalog catalog) {
        return Stream.concat(
                catalog.questions().stream(),
                applicableFollowUps(sheet, catalog).stream().map(FollowUpQuestion::question)
        ).toList();
    }

    /**
     * Follow-ups triggered by the selected options of main-question answers, each at most once, in
     * trigger order.
     */
    public List<FollowUpQuestion> applicableFollowUps(AnswerSheet sheet, QuestionCatalog catalog) {
        Map<String, FollowUpQuestion> applicable = new LinkedHashMap<>();

        for (Answer answer : sheet.answers()) {
            Optional<Question> question = catalog.question(answer.questionId());
            if (question.isEmpty() || !question.get().hasOptions()) continue;

            for (String value : answer.selectedValues()) {
                Optional<QuestionOption> option = question.get().option(value);
                if (option.isEmpty() || option.get().triggersFollowUp().isEmpty()) continue;

                catalog.followUps().stream()
                        .filter(f -> option.get().triggersFollowUp().contains(f.id()))
                        .filter(f -> question.get().id().equals(f.parentQuestionId()))
                        .forEach(f -> applicable.putIfAbsent(f.id(), f));
            }
        }
        return List.copyOf(applicable.values());
    }

    public List<CategoryScore> categoryScores(AnswerSheet sheet, List<Question> questions, QuestionCatalog catalog) {
        Map<String, List<Question>> byCategory = new LinkedHashMap<>();
        for (Question question : questions) {
            byCategory.computeIfAbsent(question.category(), k -> new ArrayList<>()).add(question);
        }

        List<CategoryScore> scores = new ArrayList<>();
        for (var entry : byCategory.entrySet()) {
            double weightedSum = 0.0;
            double maxPossible = 0.0;
            int answeredCount = 0;

            for (Question question : entry.getValue()) {
                Optional<Answer> answer = sheet.answer(question.id());
                if (answer.isPresent()) {
                    answeredCount++;
                    if (question.hasOptions()) {
                        weightedSum += answerScore(answer.get(), question) * question.weight();
                    }
                }
                if (question.hasOptions()) {
                    maxPossible += question.maxOptionScore() * question.weight();
                }
            }

            int normalized = maxPossible > 0
                    ? (int) Math.min(MAX_SCORE, Math.round(weightedSum / maxPossible * 100))
                    : 0;
            scores.add(new CategoryScore(entry.getKey(), normalized, catalog.categoryWeight(entry.getKey()),
                    MAX_SCORE, answeredCount, entry.getValue().size()));
        }
        return List.copyOf(scores);
    }

    public int overallScore(List<CategoryScore> categoryScores) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (CategoryScore category : categoryScores) {
            weightedSum += category.score() * category.weight();
            totalWeight += category.weight();
        }
        return totalWeight > 0 ? (int) Math.round(weightedSum / totalWeight) : 0;
    }

    double answerScore(Answer answer, Question question) {
        List<String> selected = answer.selectedValues();
        List<Integer> matched = selected.stream()
                .map(question::option)
                .flatMap(Optional::stream)
                .map(QuestionOption::score)
                .toList();

        if (answer.multiValued()) {
            return multiSelectStrategy.aggregate(matched, selected.size());
        }
        return matched.stream().mapToInt(Integer::intValue).sum();
    }
}
