package com.surveillance.baseline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentDeviation {

    // z-score of the current slot against the same hour on other days
    private double score;
    private DeviationInterpretation interpretation;

    @Builder.Default
    private List<String> contributingFactors = new ArrayList<>();
}
