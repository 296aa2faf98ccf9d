package com.serveos.engine.api;

import com.serveos.engine.assessment.AssessmentModels;
import com.serveos.engine.assessment.AssessmentService;
import com.serveos.engine.catalog.CatalogModels;
import com.serveos.engine.domain.DomainModels.ReadinessPathway;
import com.serveos.engine.recommendation.RecommendationModels;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/assessment")
public class AssessmentController {
    private final AssessmentService assessmentService;

    public AssessmentController(AssessmentService assessmentService) {
        this.assessmentService = assessmentService;
    }

    @PostMapping("/score")
    public ResponseEntity<AssessmentModels.AssessmentScores> score(@Valid @RequestBody ScoreRequest request) {
        return ResponseEntity.ok(assessmentService.calculateAssessmentScore(request.answers(), request.weights()));
    }

    @PostMapping("/complete")
    public ResponseEntity<CompletionResponse> complete(@Valid @RequestBody AnswersRequest request) {
        return ResponseEntity.ok(new CompletionResponse(assessmentService.isAssessmentComplete(request.answers())));
    }

    @PostMapping("/next-question")
    public ResponseEntity<CatalogModels.Question> nextQuestion(@Valid @RequestBody AnswersRequest request) {
        return assessmentService.nextQuestion(request.answers())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/validate")
    public ResponseEntity<AssessmentModels.AnswerValidation> validate(@Valid @RequestBody AnswersRequest request) {
        return ResponseEntity.ok(assessmentService.validateAnswers(request.answers()));
    }

    @GetMapping("/questions")
    public ResponseEntity<List<CatalogModels.Question>> questions(@RequestParam(required = false) String category) {
        if (category == null || category.isBlank()) {
            return ResponseEntity.ok(assessmentService.catalog().questions());
        }
        return ResponseEntity.ok(assessmentService.questionsByCategory(category));
    }

    @GetMapping("/initial")
    public ResponseEntity<AssessmentModels.AssessmentScores> initial() {
        return ResponseEntity.ok(assessmentService.initialScores());
    }

    @PostMapping("/override")
    public ResponseEntity<RecommendationModels.PathwayOverride> override(@Valid @RequestBody OverrideRequest request) {
        var scores = assessmentService.calculateAssessmentScore(request.answers());
        return ResponseEntity.ok(assessmentService.overridePathway(
                scores, request.pathway(), request.justification(), request.overriddenBy()));
    }

    public record AnswersRequest(@NotNull List<AssessmentModels.Answer> answers) {}

    public record ScoreRequest(@NotNull List<AssessmentModels.Answer> answers,
                               CatalogModels.WeightConfiguration weights) {}

    public record OverrideRequest(@NotNull List<AssessmentModels.Answer> answers,
                                  @NotNull ReadinessPathway pathway,
                                  @NotBlank String justification,
                                  @NotBlank String overriddenBy) {}

    public record CompletionResponse(boolean complete) {}
}
