package fr.lapetina.lineplanner.domain.exception;

import fr.lapetina.lineplanner.domain.model.LayoutErrorType;

/**
 * Thrown when the production target cannot yield a takt time.
 */
public final class InvalidDemandException extends LayoutException {

    private final double targetOutputPerDay;
    private final double workingMinutesPerDay;

    public InvalidDemandException(double targetOutputPerDay, double workingMinutesPerDay) {
        super(LayoutErrorType.INVALID_DEMAND,
                "Invalid demand: target output and working minutes must be positive (target="
                        + targetOutputPerDay + ", workingMinutes=" + workingMinutesPerDay + ")");
        this.targetOutputPerDay = targetOutputPerDay;
        this.workingMinutesPerDay = workingMinutesPerDay;
    }

    public double getTargetOutputPerDay() {
        return targetOutputPerDay;
    }

    public double getWorkingMinutesPerDay() {
        return workingMinutesPerDay;
    }
}
