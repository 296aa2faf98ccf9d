package com.serveos.engine.catalog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.serveos.engine.domain.DomainModels.QuestionType;
import com.serveos.engine.domain.DomainModels.RiskLevel;

import java.util.List;
import java.util.Optional;

public class CatalogModels {

    public record QuestionOption(String id,
                                 String label,
                                 String value,
                                 int score,
                                 String description,
                                 RiskLevel riskLevel,
                                 List<String> triggersFollowUp) {
        public QuestionOption {
            triggersFollowUp = triggersFollowUp == null ? List.of() : List.copyOf(triggersFollowUp);
        }
    }

    public record Question(String id,
                           String text,
                           QuestionType type,
                           String category,
                           int weight,
                           boolean required,
                           int order,
                           String helpText,
                           Integer scaleMin,
                           Integer scaleMax,
                           List<QuestionOption> options) {
        public Question {
            options = options == null ? List.of() : List.copyOf(options);
        }

        public boolean hasOptions() {
            return !options.isEmpty();
        }

        public Optional<QuestionOption> option(String value) {
            return options.stream().filter(o -> value != null && value.equals(o.value())).findFirst();
        }

        public int maxOptionScore() {
            return options.stream().mapToInt(QuestionOption::score).max().orElse(0);
        }

        public Question withWeight(int newWeight) {
            return new Question(id, text, type, category, newWeight, required, order, helpText, scaleMin, scaleMax, options);
        }
    }

    /**
     * A question surfaced only while its parent question is answered with {@code triggerOptionValue}.
     */
    public record FollowUpQuestion(String parentQuestionId,
                                   String triggerOptionValue,
                                   double impactMultiplier,
                                   Question question) {
        public String id() {
            return question.id();
        }

        public FollowUpQuestion withQuestion(Question replacement) {
            return new FollowUpQuestion(parentQuestionId, triggerOptionValue, impactMultiplier, replacement);
        }
    }

    public record CategoryDefinition(String id, String name, double weight) {
        public CategoryDefinition withWeight(double newWeight) {
            return new CategoryDefinition(id, name, newWeight);
        }
    }

    /** Raw shape of the question catalog JSON, before validation. */
    public record QuestionCatalogDocument(int version,
                                          List<CategoryDefinition> categories,
                                          List<Question> questions,
                                          List<FollowUpQuestion> followUps) {
        public QuestionCatalogDocument {
            categories = categories == null ? List.of() : List.copyOf(categories);
            questions = questions == null ? List.of() : List.copyOf(questions);
            followUps = followUps == null ? List.of() : List.copyOf(followUps);
        }
    }

    public record CatalogIssue(String code, String message, String node) {}

    /** Administrator weight overrides applied on top of the bundled catalog. */
    public record WeightConfiguration(List<QuestionWeight> questionWeights, List<CategoryWeight> categoryWeights) {
        public WeightConfiguration {
            questionWeights = questionWeights == null ? List.of() : List.copyOf(questionWeights);
            categoryWeights = categoryWeights == null ? List.of() : List.copyOf(categoryWeights);
        }

        @JsonIgnore
        public boolean isEmpty() {
            return questionWeights.isEmpty() && categoryWeights.isEmpty();
        }
    }

    /** Admin payloads send the flag as {@code isActive}. */
    public record QuestionWeight(String questionId, int weight, @JsonAlias("isActive") Boolean active) {
        public boolean applies() {
            return active == null || active;
        }
    }

    public record CategoryWeight(String category, double weight) {}
}
