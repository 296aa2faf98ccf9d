package com.serveos.engine.recommendation;

import com.serveos.engine.domain.DomainModels.ReadinessPathway;

import java.time.Instant;
import java.util.List;

public class RecommendationModels {
    public record EstimatedDuration(int weeks, String label) {}

    public record PathwayRecommendation(ReadinessPathway pathway,
                                        int confidence,
                                        String rationale,
                                        EstimatedDuration estimatedDuration,
                                        List<String> focusAreas) {}

    public record PathwayOverride(ReadinessPathway originalPathway,
                                  ReadinessPathway newPathway,
                                  String justification,
                                  String overriddenBy,
                                  Instant overriddenAt) {}
}
