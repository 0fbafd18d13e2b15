package com.titan.prepress.report;

/**
 * score = clamp(100 - (10 * BLOCKER + 2 * WARNING + 0.5 * INFO), 0, 100)
 */
public final class ScoreCalculator {

    private ScoreCalculator() {
    }

    public static double score(IssueCounts counts) {
        double penalties = counts.getBlocker() * 10.0
                + counts.getWarning() * 2.0
                + counts.getInfo() * 0.5;
        return Math.max(0, Math.min(100, 100 - penalties));
    }

    public static double score(Issues issues) {
        return score(issues.counts());
    }
}
