package fr.lapetina.lineplanner.domain.model;

/**
 * A single sewing operation from an operation bulletin.
 * Immutable; produced by the ingestion side and never mutated here.
 *
 * @param opNo        operation number, unique within the bulletin
 * @param opName      display name
 * @param machineType free-text machine type label (e.g. "SNLS", "Iron Table")
 * @param smv         standard minute value, minutes per unit
 * @param section     garment section label, may be blank
 */
public record Operation(
        String opNo,
        String opName,
        String machineType,
        double smv,
        String section
) {
    public Operation {
        if (opName == null) {
            opName = "";
        }
        if (section == null) {
            section = "";
        }
    }

    /**
     * Creates an operation whose display name equals its number.
     */
    public static Operation of(String opNo, String machineType, double smv, String section) {
        return new Operation(opNo, opNo, machineType, smv, section);
    }
}
