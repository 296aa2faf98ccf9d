package com.serveos.engine.assessment;

import java.util.List;

/**
 * How the option scores of a multi-value answer collapse into one raw score. Single-value answers
 * always score their one option.
 */
public enum SelectionScoreStrategy {
    /** Sum of matched option scores divided by the number of selected values. */
    AVERAGE {
        @Override
        public double aggregate(List<Integer> matchedScores, int selectedCount) {
            if (selectedCount == 0) return 0.0;
            return matchedScores.stream().mapToInt(Integer::intValue).sum() / (double) selectedCount;
        }
    },
    MAX {
        @Override
        public double aggregate(List<Integer> matchedScores, int selectedCount) {
            return matchedScores.stream().mapToInt(Integer::intValue).max().orElse(0);
        }
    },
    CAPPED_SUM {
        @Override
        public double aggregate(List<Integer> matchedScores, int selectedCount) {
            return Math.min(100, matchedScores.stream().mapToInt(Integer::intValue).sum());
        }
    };

    public abstract double aggregate(List<Integer> matchedScores, int selectedCount);
}
