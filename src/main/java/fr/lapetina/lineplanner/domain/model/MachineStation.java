package fr.lapetina.lineplanner.domain.model;

import java.util.Objects;

/**
 * A production station running one instance of an operation.
 */
public record MachineStation(Operation operation) implements EntitySource {

    public MachineStation {
        Objects.requireNonNull(operation, "Operation is required");
    }

    @Override
    public String label() {
        return operation.opName().isBlank() ? operation.opNo() : operation.opName();
    }

    @Override
    public boolean isMachine() {
        return true;
    }
}
