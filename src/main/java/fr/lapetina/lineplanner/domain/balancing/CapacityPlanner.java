package fr.lapetina.lineplanner.domain.balancing;

import fr.lapetina.lineplanner.domain.exception.InvalidDemandException;
import fr.lapetina.lineplanner.domain.exception.MalformedOperationException;
import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line balancing: sizes the number of parallel machines per operation so
 * that no station is slower than takt time.
 *
 * <pre>
 * taktTime         = workingMinutesPerDay / targetOutputPerDay
 * requiredMachines = ceil(smv / taktTime) = ceil(smv * target / workingMinutes)
 * </pre>
 *
 * An operation without timing data still gets one machine. Input order is
 * preserved and nothing is merged or dropped. An operation needing more than
 * {@link #DEFAULT_MAX_MACHINES_PER_OPERATION} machines (or the configured
 * limit) is rejected, since each machine becomes a placed entity.
 */
public final class CapacityPlanner {

    private static final Logger log = LoggerFactory.getLogger(CapacityPlanner.class);

    /** Absorbs floating point noise such as 1.0000000000000002 before rounding up. */
    static final double ROUNDING_TOLERANCE = 1e-9;

    public static final int DEFAULT_MAX_MACHINES_PER_OPERATION = 10_000;

    private final OperationValidator validator;
    private final int maxMachinesPerOperation;

    public CapacityPlanner() {
        this(new OperationValidator(), DEFAULT_MAX_MACHINES_PER_OPERATION);
    }

    public CapacityPlanner(OperationValidator validator, int maxMachinesPerOperation) {
        if (maxMachinesPerOperation < 1) {
            throw new IllegalArgumentException("maxMachinesPerOperation must be at least 1");
        }
        this.validator = validator;
        this.maxMachinesPerOperation = maxMachinesPerOperation;
    }

    /**
     * Computes the machine count for every operation.
     *
     * @param operations           operations in bulletin order
     * @param targetOutputPerDay   units to produce per day, must be positive
     * @param workingMinutesPerDay available minutes per day, must be positive
     * @return balanced operations in input order
     * @throws InvalidDemandException if the demand is not strictly positive
     * @throws MalformedOperationException if an operation is malformed or needs too many machines
     */
    public List<BalancedOperation> plan(
            List<Operation> operations,
            double targetOutputPerDay,
            double workingMinutesPerDay
    ) {
        double taktTime = taktTime(targetOutputPerDay, workingMinutesPerDay);
        validator.validateAll(operations);

        List<BalancedOperation> balanced = new ArrayList<>(operations.size());
        long totalMachines = 0;
        for (int i = 0; i < operations.size(); i++) {
            Operation operation = operations.get(i);
            long count = requiredMachines(operation.smv(), targetOutputPerDay, workingMinutesPerDay);
            if (count > maxMachinesPerOperation) {
                log.warn("Operation {} needs {} machines, limit is {}", operation.opNo(), count, maxMachinesPerOperation);
                throw new MalformedOperationException(i, "Operation " + operation.opNo() + " needs " + count
                        + " machines, more than the limit of " + maxMachinesPerOperation);
            }
            balanced.add(new BalancedOperation(operation, (int) count));
            totalMachines += count;
        }

        log.debug("Balanced {} operations: taktTime={} min, machines={}",
                operations.size(), taktTime, totalMachines);
        return Collections.unmodifiableList(balanced);
    }

    /**
     * Per-unit time budget in minutes.
     *
     * @throws InvalidDemandException if either argument is not strictly positive
     */
    public static double taktTime(double targetOutputPerDay, double workingMinutesPerDay) {
        if (!isPositive(targetOutputPerDay) || !isPositive(workingMinutesPerDay)) {
            throw new InvalidDemandException(targetOutputPerDay, workingMinutesPerDay);
        }
        return workingMinutesPerDay / targetOutputPerDay;
    }

    /**
     * Saturates at {@link Long#MAX_VALUE} when the product overflows a double.
     */
    static long requiredMachines(double smv, double targetOutputPerDay, double workingMinutesPerDay) {
        if (smv <= 0) {
            return 1;
        }
        double raw = smv * targetOutputPerDay / workingMinutesPerDay;
        long count = (long) Math.ceil(raw - ROUNDING_TOLERANCE);
        return Math.max(1, count);
    }

    public int getMaxMachinesPerOperation() {
        return maxMachinesPerOperation;
    }

    private static boolean isPositive(double value) {
        return value > 0 && !Double.isInfinite(value);
    }
}
