package com.serveos.engine.catalog;

import com.serveos.engine.catalog.CatalogModels.CategoryDefinition;
import com.serveos.engine.catalog.CatalogModels.CategoryWeight;
import com.serveos.engine.catalog.CatalogModels.FollowUpQuestion;
import com.serveos.engine.catalog.CatalogModels.Question;
import com.serveos.engine.catalog.CatalogModels.QuestionCatalogDocument;
import com.serveos.engine.catalog.CatalogModels.QuestionWeight;
import com.serveos.engine.catalog.CatalogModels.WeightConfiguration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, indexed view of the intake questions, their follow-ups and the category weights.
 * Instances are shared freely between threads.
 */
public final class QuestionCatalog {
    private final int version;
    private final List<CategoryDefinition> categories;
    private final List<Question> questions;
    private final List<FollowUpQuestion> followUps;
    private final Map<String, CategoryDefinition> categoriesById;
    private final Map<String, Question> questionsById;

    private QuestionCatalog(int version,
                            List<CategoryDefinition> categories,
                            List<Question> questions,
                            List<FollowUpQuestion> followUps) {
        this.version = version;
        this.categories = List.copyOf(categories);
        this.questions = List.copyOf(questions);
        this.followUps = List.copyOf(followUps);

        Map<String, CategoryDefinition> byCategory = new LinkedHashMap<>();
        this.categories.forEach(c -> byCategory.putIfAbsent(c.id(), c));
        this.categoriesById = Collections.unmodifiableMap(byCategory);

        Map<String, Question> byId = new LinkedHashMap<>();
        this.questions.forEach(q -> byId.putIfAbsent(q.id(), q));
        this.questionsById = Collections.unmodifiableMap(byId);
    }

    /**
     * Indexes an already validated document. Use {@link CatalogLoader} to validate first.
     */
    public static QuestionCatalog of(QuestionCatalogDocument document) {
        return new QuestionCatalog(document.version(), document.categories(), document.questions(), document.followUps());
    }

    public int version() {
        return version;
    }

    public List<CategoryDefinition> categories() {
        return categories;
    }

    public List<Question> questions() {
        return questions;
    }

    public List<FollowUpQuestion> followUps() {
        return followUps;
    }

    /** Looks up a main question; follow-ups are not included. */
    public Optional<Question> question(String questionId) {
        return Optional.ofNullable(questionsById.get(questionId));
    }

    public Optional<FollowUpQuestion> followUp(String followUpId) {
        return followUps.stream().filter(f -> f.id().equals(followUpId)).findFirst();
    }

    public boolean hasCategory(String category) {
        return categoriesById.containsKey(category);
    }

    public double categoryWeight(String category) {
        CategoryDefinition definition = categoriesById.get(category);
        return definition == null ? 1.0 : definition.weight();
    }

    public List<Question> questionsByCategory(String category) {
        return questions.stream().filter(q -> q.category().equals(category)).toList();
    }

    /**
     * Returns a copy with the given weights applied. Inactive question overrides are skipped; the
     * caller is expected to have validated the configuration.
     */
    public QuestionCatalog withWeights(WeightConfiguration configuration) {
        if (configuration == null || configuration.isEmpty()) return this;

        Map<String, Integer> questionWeights = new LinkedHashMap<>();
        for (QuestionWeight w : configuration.questionWeights()) {
            if (w.applies()) questionWeights.put(w.questionId(), w.weight());
        }
        Map<String, Double> categoryWeights = new LinkedHashMap<>();
        for (CategoryWeight w : configuration.categoryWeights()) {
            categoryWeights.put(w.category(), w.weight());
        }

        List<CategoryDefinition> reweightedCategories = categories.stream()
                .map(c -> categoryWeights.containsKey(c.id()) ? c.withWeight(categoryWeights.get(c.id())) : c)
                .toList();
        List<Question> reweightedQuestions = questions.stream()
                .map(q -> questionWeights.containsKey(q.id()) ? q.withWeight(questionWeights.get(q.id())) : q)
                .toList();
        List<FollowUpQuestion> reweightedFollowUps = followUps.stream()
                .map(f -> questionWeights.containsKey(f.id())
                        ? f.withQuestion(f.question().withWeight(questionWeights.get(f.id())))
                        : f)
                .toList();

        return new QuestionCatalog(version, reweightedCategories, reweightedQuestions, reweightedFollowUps);
    }
}
