package com.microsoft.finops.governance;

import com.microsoft.finops.domain.model.TimeWindow;

/**
 * @param duplicatesSkipped violating pairs that already had a violation in the window
 */
public record EvaluationReport(
        TimeWindow window,
        int policiesEvaluated,
        int subjectsEvaluated,
        int violationsCreated,
        int duplicatesSkipped
) {
}
