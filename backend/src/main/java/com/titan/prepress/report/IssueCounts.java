package com.titan.prepress.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueCounts {

    @JsonProperty("BLOCKER")
    private int blocker;

    @JsonProperty("WARNING")
    private int warning;

    @JsonProperty("INFO")
    private int info;

    public static IssueCounts of(Iterable<Issue> issues) {
        IssueCounts counts = new IssueCounts();
        for (Issue issue : issues) {
            switch (issue.getSeverity()) {
                case BLOCKER -> counts.blocker++;
                case WARNING -> counts.warning++;
                case INFO -> counts.info++;
            }
        }
        return counts;
    }
}
