package com.serveos.engine.assessment;

import com.serveos.engine.assessment.AssessmentModels.Answer;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers keyed by question id in first-answered order. A later answer for the same question
 * replaces the earlier one in place; entries without a question id are dropped.
 */
public final class AnswerSheet {
    private final Map<String, Answer> byQuestion;

    private AnswerSheet(Map<String, Answer> byQuestion) {
        this.byQuestion = Collections.unmodifiableMap(byQuestion);
    }

    public static AnswerSheet of(List<Answer> answers) {
        Map<String, Answer> byQuestion = new LinkedHashMap<>();
        if (answers != null) {
            for (Answer answer : answers) {
                if (answer == null || answer.questionId() == null) continue;
                byQuestion.put(answer.questionId(), answer);
            }
        }
        return new AnswerSheet(byQuestion);
    }

    public Optional<Answer> answer(String questionId) {
        return Optional.ofNullable(byQuestion.get(questionId));
    }

    public boolean isAnswered(String questionId) {
        return byQuestion.containsKey(questionId);
    }

    public Collection<Answer> answers() {
        return byQuestion.values();
    }
}
