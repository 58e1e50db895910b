package fr.lapetina.lineplanner.domain.model;

/**
 * Kinds of non-production fixtures placed by layout policy.
 */
public enum FixtureType {
    SECTION_BOARD("Board"),
    INSPECTION_TABLE("Inspection"),
    TROLLEY("Trolley"),
    SUPERMARKET_CABINET("Supermarket Cabinet"),
    TABLE_AND_CHAIR("Table and Chair");

    private final String displayName;

    FixtureType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
