package fr.lapetina.lineplanner.domain.balancing;

import fr.lapetina.lineplanner.domain.exception.MalformedOperationException;
import fr.lapetina.lineplanner.domain.model.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Boundary check for operations handed over by the ingestion side.
 *
 * Validates:
 * - Operation is not null
 * - Operation number is present
 * - Machine type is present
 * - SMV is a finite, non-negative number
 *
 * Machine types are free text and are not checked against a vocabulary.
 */
public final class OperationValidator {

    private static final Logger log = LoggerFactory.getLogger(OperationValidator.class);

    /**
     * Validates every operation, failing on the first malformed one.
     *
     * @throws MalformedOperationException if any operation is malformed
     */
    public void validateAll(List<Operation> operations) {
        if (operations == null) {
            throw new MalformedOperationException(-1, "Operation list is null");
        }
        for (int i = 0; i < operations.size(); i++) {
            validate(i, operations.get(i));
        }
    }

    void validate(int index, Operation operation) {
        String reason = findProblem(operation);
        if (reason != null) {
            log.warn("Operation rejected: index={}, opNo={}, reason={}",
                    index, operation != null ? operation.opNo() : "null", reason);
            throw new MalformedOperationException(index, reason);
        }
    }

    private String findProblem(Operation operation) {
        if (operation == null) {
            return "Operation is null";
        }
        if (operation.opNo() == null || operation.opNo().isBlank()) {
            return "Operation number is required";
        }
        if (operation.machineType() == null || operation.machineType().isBlank()) {
            return "Machine type is required for operation " + operation.opNo();
        }
        double smv = operation.smv();
        if (Double.isNaN(smv) || Double.isInfinite(smv)) {
            return "SMV must be a finite number for operation " + operation.opNo();
        }
        if (smv < 0) {
            return "SMV must not be negative for operation " + operation.opNo();
        }
        return null;
    }
}
