package com.serveos.engine.assessment;

import com.serveos.engine.assessment.AssessmentModels.Answer;
import com.serveos.engine.assessment.AssessmentModels.RiskProfile;
import com.serveos.engine.catalog.CatalogModels.Question;
import com.serveos.engine.catalog.CatalogModels.QuestionOption;
import com.serveos.engine.domain.DomainModels.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Collects high and critical option annotations from the selected answers and escalates them into
 * one risk level.
 */
@Component
public class RiskProfiler {
    public static final int HIGH_RISK_ESCALATION_COUNT = 3;

    public RiskProfile assess(AnswerSheet answers, List<Question> applicableQuestions) {
        Map<String, Question> byId = applicableQuestions.stream()
                .collect(Collectors.toMap(Question::id, Function.identity(), (a, b) -> a));

        List<String> factors = new ArrayList<>();
        int highCount = 0;
        int criticalCount = 0;

        for (Answer answer : answers.answers()) {
            Question question = byId.get(answer.questionId());
            if (question == null || !question.hasOptions()) continue;

            for (String value : answer.selectedValues()) {
                Optional<QuestionOption> option = question.option(value);
                if (option.isEmpty()) continue;

                RiskLevel risk = option.get().riskLevel();
                if (risk == RiskLevel.HIGH) {
                    highCount++;
                    factors.add(question.category() + ": " + option.get().label());
                } else if (risk == RiskLevel.CRITICAL) {
                    criticalCount++;
                    factors.add("CRITICAL - " + question.category() + ": " + option.get().label());
                }
            }
        }

        return new RiskProfile(levelFor(highCount, criticalCount), List.copyOf(factors));
    }

    /** First match wins: any critical, then three or more high, then any high. */
    public RiskLevel levelFor(int highCount, int criticalCount) {
        if (criticalCount > 0) return RiskLevel.CRITICAL;
        if (highCount >= HIGH_RISK_ESCALATION_COUNT) return RiskLevel.HIGH;
        if (highCount >= 1) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }
}
