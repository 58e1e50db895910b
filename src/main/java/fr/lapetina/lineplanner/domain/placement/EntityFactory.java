package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.Facing;
import fr.lapetina.lineplanner.domain.model.Fixture;
import fr.lapetina.lineplanner.domain.model.FixtureType;
import fr.lapetina.lineplanner.domain.model.Lane;
import fr.lapetina.lineplanner.domain.model.LaneGroup;
import fr.lapetina.lineplanner.domain.model.MachineStation;
import fr.lapetina.lineplanner.domain.model.Operation;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;
import fr.lapetina.lineplanner.domain.model.Vector3;

import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds placed entities from layout settings.
 * Only identifiers carry a random component; coordinates are deterministic.
 */
public final class EntityFactory {

    private final LayoutSettings settings;
    private final StationRules stationRules;
    private final Supplier<String> uniqueSuffix;

    public EntityFactory(LayoutSettings settings, StationRules stationRules) {
        this(settings, stationRules, () -> UUID.randomUUID().toString());
    }

    EntityFactory(LayoutSettings settings, StationRules stationRules, Supplier<String> uniqueSuffix) {
        this.settings = settings;
        this.stationRules = stationRules;
        this.uniqueSuffix = uniqueSuffix;
    }

    /**
     * A machine using the lane's facing, or the machine type's forced facing.
     */
    public PlacedEntity machine(Operation operation, Lane lane, double x, int sequenceIndex, String section) {
        return machine(operation, lane, x, sequenceIndex, section,
                stationRules.facingFor(lane, operation.machineType()));
    }

    /**
     * A machine with an explicit facing.
     */
    public PlacedEntity machine(
            Operation operation,
            Lane lane,
            double x,
            int sequenceIndex,
            String section,
            Facing facing
    ) {
        return new PlacedEntity(
                operation.opNo() + "-" + sequenceIndex + "-" + uniqueSuffix.get(),
                new MachineStation(operation),
                lane,
                new Vector3(x, 0, settings.lanes().of(lane)),
                yaw(facing),
                section,
                sequenceIndex
        );
    }

    /**
     * A floating section board. The lane is derived from the board's side of the aisle.
     */
    public PlacedEntity sectionBoard(String section, double x, double z) {
        return new PlacedEntity(
                "board-" + section + "-" + uniqueSuffix.get(),
                new Fixture(FixtureType.SECTION_BOARD, section),
                z < 0 ? Lane.A : Lane.C,
                new Vector3(x, settings.spacing().boardHeight(), z),
                yaw(Facing.FRONT),
                section,
                PlacedEntity.NO_SEQUENCE
        );
    }

    public PlacedEntity inspectionTable(String section, LaneGroup group, double x) {
        Lane inner = group.inner();
        double z = settings.lanes().of(inner)
                + group.outwardSign() * settings.spacing().inspectionAcrossOffset();
        return fixture("inspect-" + section, FixtureType.INSPECTION_TABLE, section,
                inner, new Vector3(x, 0, z), Facing.FRONT);
    }

    /**
     * A material trolley, aligned with the line rather than facing an operator.
     */
    public PlacedEntity trolley(String section, LaneGroup group, double x) {
        Lane inner = group.inner();
        double z = settings.lanes().of(inner)
                + group.outwardSign() * settings.spacing().trolleyAcrossOffset();
        return fixture("trolley-" + section, FixtureType.TROLLEY, section,
                inner, new Vector3(x, 0, z), Facing.RIGHT);
    }

    /**
     * A fixture sitting on the floor of a lane.
     */
    public PlacedEntity laneFixture(FixtureType type, String section, Lane lane, double x) {
        return fixture(type.name().toLowerCase(Locale.ROOT) + "-" + uniqueSuffix.get(), type, section,
                lane, new Vector3(x, 0, settings.lanes().of(lane)), Facing.FRONT);
    }

    private PlacedEntity fixture(
            String id,
            FixtureType type,
            String section,
            Lane lane,
            Vector3 position,
            Facing facing
    ) {
        return new PlacedEntity(
                id,
                new Fixture(type, type.getDisplayName()),
                lane,
                position,
                yaw(facing),
                section,
                PlacedEntity.NO_SEQUENCE
        );
    }

    private Vector3 yaw(Facing facing) {
        return Vector3.yaw(settings.facing().of(facing));
    }
}
