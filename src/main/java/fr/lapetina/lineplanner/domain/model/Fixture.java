package fr.lapetina.lineplanner.domain.model;

import java.util.Objects;

/**
 * A fixture that is not a timed production station.
 *
 * @param type  fixture kind
 * @param label text shown on the fixture, e.g. the section name on a board
 */
public record Fixture(FixtureType type, String label) implements EntitySource {

    public Fixture {
        Objects.requireNonNull(type, "Fixture type is required");
        if (label == null || label.isBlank()) {
            label = type.getDisplayName();
        }
    }

    @Override
    public boolean isMachine() {
        return false;
    }
}
