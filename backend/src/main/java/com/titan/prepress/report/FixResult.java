package com.titan.prepress.report;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FixResult {
    private ScoreSnapshot before;
    private ScoreSnapshot after;
    private List<String> applied;
}
