package com.verolang.core.transpiler;

import java.util.List;
import java.util.Objects;

/**
 * Generated script plus the counts callers need to tell "nothing matched" from "nothing there".
 *
 * @param code Playwright Test source
 * @param totalScenarios scenarios in the program before selection
 * @param selectedScenarios scenarios that survived selection
 * @param tests generated tests in emission order, one per scenario and combination
 */
public record TranspileResult(String code, int totalScenarios, int selectedScenarios, List<GeneratedTest> tests) {

    public TranspileResult {
        Objects.requireNonNull(code, "code must not be null");
        tests = tests == null ? List.of() : List.copyOf(tests);
    }

    /**
     * Whether a selection ran over existing scenarios and kept none of them.
     */
    public boolean isEmptySelection() {
        return totalScenarios > 0 && selectedScenarios == 0;
    }
}
