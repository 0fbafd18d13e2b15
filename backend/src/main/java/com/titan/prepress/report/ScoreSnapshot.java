package com.titan.prepress.report;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreSnapshot {
    private double score;
    private IssueCounts counts;

    public static ScoreSnapshot of(Issues issues) {
        IssueCounts counts = issues.counts();
        return new ScoreSnapshot(ScoreCalculator.score(counts), counts);
    }
}
