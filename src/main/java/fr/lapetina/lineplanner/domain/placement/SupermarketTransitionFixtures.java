package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.FixtureType;
import fr.lapetina.lineplanner.domain.model.LaneCursors;
import fr.lapetina.lineplanner.domain.model.LaneGroup;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;

import java.util.List;

/**
 * Closes parts preparation with a supermarket cabinet at the end of lanes
 * A/B and a table with chair at the end of lanes C/D.
 */
public final class SupermarketTransitionFixtures implements TransitionFixturePolicy {

    static final String SECTION = "Parts Preparation";

    private final LayoutSettings.Spacing spacing;
    private final EntityFactory entities;

    public SupermarketTransitionFixtures(LayoutSettings settings, EntityFactory entities) {
        this.spacing = settings.spacing();
        this.entities = entities;
    }

    @Override
    public SectionResult beforeAssembly(LaneCursors cursors) {
        double abX = cursors.max(LaneGroup.AB) + spacing.transitionFixtureOffset();
        double cdX = cursors.max(LaneGroup.CD) + spacing.transitionFixtureOffset();

        List<PlacedEntity> placed = List.of(
                entities.laneFixture(FixtureType.SUPERMARKET_CABINET, SECTION, LaneGroup.AB.inner(), abX),
                entities.laneFixture(FixtureType.TABLE_AND_CHAIR, SECTION, LaneGroup.CD.inner(), cdX)
        );

        LaneCursors next = cursors
                .syncGroup(LaneGroup.AB, abX + spacing.transitionFixtureClearance())
                .syncGroup(LaneGroup.CD, cdX + spacing.transitionFixtureClearance());
        return new SectionResult(placed, next);
    }
}
