package com.serveos.engine.recommendation;

import com.serveos.engine.assessment.AssessmentModels.CategoryScore;
import com.serveos.engine.assessment.AssessmentModels.RiskProfile;
import com.serveos.engine.domain.DomainModels.ReadinessPathway;
import com.serveos.engine.domain.DomainModels.RiskLevel;
import com.serveos.engine.exception.InvalidPathwayOverrideException;
import com.serveos.engine.recommendation.RecommendationModels.EstimatedDuration;
import com.serveos.engine.recommendation.RecommendationModels.PathwayOverride;
import com.serveos.engine.recommendation.RecommendationModels.PathwayRecommendation;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the overall score and risk profile into a delivery pathway. Critical risk always forces the
 * extended pathway; otherwise the risk-adjusted score is compared against fixed thresholds.
 */
@Service
public class PathwayRecommender {
    public static final int ACCELERATED_THRESHOLD = 75;
    public static final int STANDARD_THRESHOLD = 50;
    public static final int FOCUS_AREA_THRESHOLD = 60;
    public static final int MIN_JUSTIFICATION_LENGTH = 10;

    private static final Map<RiskLevel, Double> RISK_WEIGHTS = new EnumMap<>(Map.of(
            RiskLevel.LOW, 1.0,
            RiskLevel.MEDIUM, 0.85,
            RiskLevel.HIGH, 0.7,
            RiskLevel.CRITICAL, 0.5
    ));

    private static final Map<ReadinessPathway, EstimatedDuration> DURATIONS = new EnumMap<>(Map.of(
            ReadinessPathway.ACCELERATED, new EstimatedDuration(8, "6-8 weeks"),
            ReadinessPathway.STANDARD, new EstimatedDuration(12, "10-14 weeks"),
            ReadinessPathway.EXTENDED, new EstimatedDuration(20, "16-24 weeks")
    ));

    public PathwayRecommendation recommend(int overallScore, RiskProfile riskProfile, List<CategoryScore> categoryScores) {
        RiskLevel level = riskProfile == null || riskProfile.level() == null ? RiskLevel.LOW : riskProfile.level();
        int adjustedScore = adjustedScore(overallScore, level);

        List<String> focusAreas = categoryScores.stream()
                .sorted(Comparator.comparingInt(CategoryScore::score))
                .limit(2)
                .filter(c -> c.score() < FOCUS_AREA_THRESHOLD)
                .map(CategoryScore::category)
                .toList();

        ReadinessPathway pathway;
        String rationale;
        if (level == RiskLevel.CRITICAL) {
            pathway = ReadinessPathway.EXTENDED;
            rationale = "Critical risk factors require extended timeline for proper mitigation";
        } else if (adjustedScore >= ACCELERATED_THRESHOLD) {
            pathway = ReadinessPathway.ACCELERATED;
            rationale = "Strong readiness across all categories supports accelerated implementation";
        } else if (adjustedScore >= STANDARD_THRESHOLD) {
            pathway = ReadinessPathway.STANDARD;
            rationale = "Moderate readiness suggests standard implementation timeline";
        } else {
            pathway = ReadinessPathway.EXTENDED;
            rationale = "Lower readiness scores indicate need for extended preparation";
        }

        if (!focusAreas.isEmpty() && pathway != ReadinessPathway.ACCELERATED) {
            rationale += ". Focus areas: " + String.join(", ", focusAreas);
        }

        return new PathwayRecommendation(pathway, confidence(categoryScores), rationale, duration(pathway), focusAreas);
    }

    public int adjustedScore(int overallScore, RiskLevel level) {
        return (int) Math.round(overallScore * RISK_WEIGHTS.get(level));
    }

    /** Low dispersion across category scores means high confidence. */
    public int confidence(List<CategoryScore> categoryScores) {
        if (categoryScores.isEmpty()) return 0;

        double mean = categoryScores.stream().mapToInt(CategoryScore::score).average().orElse(0.0);
        double variance = categoryScores.stream()
                .mapToDouble(c -> Math.pow(c.score() - mean, 2))
                .sum() / categoryScores.size();
        double stdDev = Math.sqrt(variance);
        return (int) Math.round(Math.max(0, Math.min(100, 100 - stdDev * 2)));
    }

    public EstimatedDuration duration(ReadinessPathway pathway) {
        return DURATIONS.get(pathway);
    }

    public PathwayRecommendation pending() {
        return new PathwayRecommendation(ReadinessPathway.STANDARD, 0, "Assessment not yet complete",
                duration(ReadinessPathway.STANDARD), List.of());
    }

    /**
     * Records a consultant's decision to replace the recommended pathway.
     *
     * @throws InvalidPathwayOverrideException when the pathway is missing or the justification is
     *     shorter than {@value #MIN_JUSTIFICATION_LENGTH} characters
     */
    public PathwayOverride override(ReadinessPathway recommended,
                                    ReadinessPathway newPathway,
                                    String justification,
                                    String overriddenBy,
                                    Instant at) {
        if (newPathway == null) {
            throw new InvalidPathwayOverrideException("A replacement pathway is required");
        }
        String trimmed = justification == null ? "" : justification.trim();
        if (trimmed.length() < MIN_JUSTIFICATION_LENGTH) {
            throw new InvalidPathwayOverrideException("Justification must be at least " + MIN_JUSTIFICATION_LENGTH + " characters");
        }
        if (overriddenBy == null || overriddenBy.isBlank()) {
            throw new InvalidPathwayOverrideException("The consultant making the override must be named");
        }
        return new PathwayOverride(recommended, newPathway, trimmed, overriddenBy, at);
    }
}
