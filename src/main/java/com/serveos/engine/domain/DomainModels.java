package com.serveos.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Set;

/**
 * Wire vocabularies shared by the assessment and workflow sides. Every constant serializes to the
 * lowercase value existing catalog data and callers already use.
 */
public class DomainModels {

    public enum QuestionType {
        SINGLE_CHOICE("single_choice"),
        MULTIPLE_CHOICE("multiple_choice"),
        SCALE("scale"),
        TEXT("text"),
        NUMBER("number");

        private final String value;

        QuestionType(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        @JsonCreator
        public static QuestionType fromValue(String value) {
            return Arrays.stream(values())
                    .filter(t -> t.value.equals(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown question type: " + value));
        }
    }

    public enum RiskLevel {
        LOW("low"),
        MEDIUM("medium"),
        HIGH("high"),
        CRITICAL("critical");

        private final String value;

        RiskLevel(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        @JsonCreator
        public static RiskLevel fromValue(String value) {
            return Arrays.stream(values())
                    .filter(l -> l.value.equals(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown risk level: " + value));
        }
    }

    /** Delivery pathway produced by readiness scoring. */
    public enum ReadinessPathway {
        ACCELERATED("accelerated"),
        STANDARD("standard"),
        EXTENDED("extended");

        private final String value;

        ReadinessPathway(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        @JsonCreator
        public static ReadinessPathway fromValue(String value) {
            return Arrays.stream(values())
                    .filter(p -> p.value.equals(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown readiness pathway: " + value));
        }
    }

    /**
     * Service offering whose workflow stages drive station execution. Kept apart from
     * {@link ReadinessPathway}: no mapping between the two exists.
     */
    public enum ServicePathway {
        KNOWLEDGE_SPINE("knowledge_spine"),
        ROI_AUDIT("roi_audit"),
        WORKFLOW_SPRINT("workflow_sprint");

        private final String value;

        ServicePathway(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        @JsonCreator
        public static ServicePathway fromValue(String value) {
            return Arrays.stream(values())
                    .filter(p -> p.value.equals(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown service pathway: " + value));
        }
    }

    public enum ArtifactScope {
        CLIENT("client"),
        ENGAGEMENT("engagement");

        private final String value;

        ArtifactScope(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        @JsonCreator
        public static ArtifactScope fromValue(String value) {
            return Arrays.stream(values())
                    .filter(s -> s.value.equals(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown scope: " + value));
        }
    }

    /**
     * Artifact lifecycle status. Unknown wire values bind to {@code null} so a caller's stray
     * status never satisfies a requirement and never fails a request.
     */
    public enum ArtifactStatus {
        DRAFT("draft"),
        APPROVED("approved"),
        PENDING_REVIEW("pending_review"),
        ARCHIVED("archived"),
        REJECTED("rejected");

        private static final Set<ArtifactStatus> ACTIVE = Set.of(DRAFT, APPROVED, PENDING_REVIEW);

        private final String value;

        ArtifactStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        public boolean isActive() {
            return ACTIVE.contains(this);
        }

        @JsonCreator
        public static ArtifactStatus fromValue(String value) {
            return Arrays.stream(values())
                    .filter(s -> s.value.equals(value))
                    .findFirst()
                    .orElse(null);
        }
    }

    /** Station run status. Unknown wire values bind to {@code null}. */
    public enum StationRunStatus {
        PENDING("pending"),
        RUNNING("running"),
        COMPLETE("complete"),
        AWAITING_APPROVAL("awaiting_approval"),
        APPROVED("approved"),
        REJECTED("rejected"),
        FAILED("failed");

        private final String value;

        StationRunStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        public boolean isFinished() {
            return this == APPROVED || this == COMPLETE;
        }

        @JsonCreator
        public static StationRunStatus fromValue(String value) {
            return Arrays.stream(values())
                    .filter(s -> s.value.equals(value))
                    .findFirst()
                    .orElse(null);
        }
    }
}
