package fr.lapetina.lineplanner.domain.model;

import java.util.Objects;

/**
 * An operation paired with the number of machines needed to meet takt time.
 * Recomputed on every layout generation.
 */
public record BalancedOperation(Operation operation, int requiredMachines) {
    public BalancedOperation {
        Objects.requireNonNull(operation, "Operation is required");
        if (requiredMachines < 1) {
            throw new IllegalArgumentException("requiredMachines must be >= 1, got " + requiredMachines);
        }
    }
}
