package com.modeling.dae.balance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Equation and unknown counts of a model. A diagnostic only; an unbalanced
 * result is never an error by itself.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BalanceCheckResult(int numEquations, int numUnknowns, int numStates, int numAlgebraic,
        int numParameters, int numInputs, boolean balanced) {

    public static BalanceCheckResult of(int numEquations, int numUnknowns, int numStates, int numParameters,
            int numInputs) {
        return new BalanceCheckResult(numEquations, numUnknowns, numStates, numUnknowns - numStates,
                numParameters, numInputs, numEquations == numUnknowns);
    }

    /** Equations minus unknowns: positive is over-determined, negative under-determined. */
    @JsonProperty("difference")
    public int difference() {
        return numEquations - numUnknowns;
    }

    @JsonProperty("statusMessage")
    public String statusMessage() {
        int d = difference();
        if (d == 0)
            return String.format("Model is balanced: %d equations, %d unknowns (%d states, %d algebraic)",
                    numEquations, numUnknowns, numStates, numAlgebraic);
        if (d > 0)
            return String.format("Model is over-determined: %d equations, %d unknowns (%d extra equations)",
                    numEquations, numUnknowns, d);
        return String.format("Model is under-determined: %d equations, %d unknowns (%d missing equations)",
                numEquations, numUnknowns, -d);
    }

    @Override
    public String toString() {
        return statusMessage();
    }
}
