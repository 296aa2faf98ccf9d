package com.serveos.engine.assessment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.serveos.engine.domain.DomainModels.RiskLevel;
import com.serveos.engine.recommendation.RecommendationModels.PathwayRecommendation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class AssessmentModels {

    /**
     * What a respondent gave for one question: a single option value, several option values, or a
     * number. On the wire it is a plain string, array of strings or number.
     */
    public record AnswerValue(List<String> selections, Double number, boolean multiple) {
        public AnswerValue {
            selections = selections == null ? List.of() : List.copyOf(selections);
        }

        public static AnswerValue single(String value) {
            return new AnswerValue(value == null ? List.of() : List.of(value), null, false);
        }

        public static AnswerValue multiple(List<String> values) {
            return new AnswerValue(values, null, true);
        }

        public static AnswerValue number(double value) {
            return new AnswerValue(List.of(), value, false);
        }

        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static AnswerValue fromJson(JsonNode node) {
            if (node == null || node.isNull()) return single(null);
            if (node.isNumber()) return number(node.asDouble());
            if (node.isArray()) {
                List<String> values = new ArrayList<>();
                node.forEach(element -> {
                    if (!element.isNull()) values.add(element.asText());
                });
                return multiple(values);
            }
            return single(node.asText());
        }

        @JsonValue
        public Object toJson() {
            if (number != null) return number;
            if (multiple) return selections;
            return selections.isEmpty() ? null : selections.get(0);
        }
    }

    public record Answer(String questionId, AnswerValue value, String notes, Instant answeredAt) {
        public static Answer of(String questionId, String value) {
            return new Answer(questionId, AnswerValue.single(value), null, null);
        }

        public static Answer of(String questionId, List<String> values) {
            return new Answer(questionId, AnswerValue.multiple(values), null, null);
        }

        public List<String> selectedValues() {
            return value == null ? List.of() : value.selections();
        }

        public boolean multiValued() {
            return value != null && value.multiple();
        }
    }

    public record CategoryScore(String category,
                                int score,
                                double weight,
                                int maxScore,
                                int answeredCount,
                                int totalQuestions) {}

    public record RiskProfile(RiskLevel level, List<String> factors) {
        public static RiskProfile none() {
            return new RiskProfile(RiskLevel.LOW, List.of());
        }
    }

    public record AssessmentScores(int overallScore,
                                   List<CategoryScore> categoryScores,
                                   RiskProfile riskProfile,
                                   PathwayRecommendation pathwayRecommendation,
                                   int answeredQuestions,
                                   int totalQuestions,
                                   int completionPercentage) {}

    public record AnswerValidation(boolean valid, List<String> missingQuestions) {}
}
