package fr.lapetina.lineplanner.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * An entity placed on the floor: a machine instance or a fixture.
 * Immutable; a whole layout is discarded and rebuilt on regeneration.
 *
 * @param id            identifier, unique within one layout
 * @param source        machine station or fixture
 * @param lane          lane the entity is attached to
 * @param position      x along the line, y height, z lane offset
 * @param rotation      only the y component (yaw) is ever non-zero
 * @param section       section the entity belongs to
 * @param sequenceIndex ordinal within its operation's run, {@link #NO_SEQUENCE} for fixtures
 */
public record PlacedEntity(
        String id,
        EntitySource source,
        Lane lane,
        Vector3 position,
        Vector3 rotation,
        String section,
        int sequenceIndex
) {
    public static final int NO_SEQUENCE = -1;

    public PlacedEntity {
        Objects.requireNonNull(id, "Entity id is required");
        Objects.requireNonNull(source, "Entity source is required");
        Objects.requireNonNull(lane, "Lane is required");
        Objects.requireNonNull(position, "Position is required");
        Objects.requireNonNull(rotation, "Rotation is required");
    }

    public boolean isMachine() {
        return source.isMachine();
    }

    public boolean isInspection() {
        return isFixture(FixtureType.INSPECTION_TABLE);
    }

    public boolean isTrolley() {
        return isFixture(FixtureType.TROLLEY);
    }

    public boolean isBoard() {
        return isFixture(FixtureType.SECTION_BOARD);
    }

    public double yaw() {
        return rotation.y();
    }

    /**
     * Source operation, present only for machine stations.
     */
    public Optional<Operation> operation() {
        if (source instanceof MachineStation station) {
            return Optional.of(station.operation());
        }
        return Optional.empty();
    }

    /**
     * Fixture type, present only for fixtures.
     */
    public Optional<FixtureType> fixtureType() {
        if (source instanceof Fixture fixture) {
            return Optional.of(fixture.type());
        }
        return Optional.empty();
    }

    private boolean isFixture(FixtureType type) {
        return source instanceof Fixture fixture && fixture.type() == type;
    }
}
