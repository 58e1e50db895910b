package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.LaneCursors;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Walks grouped sections in first-seen order and places every machine
 * instance and fixture on the four-lane floor.
 *
 * <p>Each section is classified ({@link SectionClassifier}) and handed to
 * the matching {@link SectionPlacement}. The lane cursors are an immutable
 * value threaded from one section to the next and discarded at the end of
 * the call, so one placer can serve concurrent callers.
 */
public final class LanePlacer {

    private static final Logger log = LoggerFactory.getLogger(LanePlacer.class);

    private final SectionClassifier classifier;
    private final Map<SectionKind, SectionPlacement> placements;
    private final TransitionFixturePolicy transitionFixtures;

    public LanePlacer(LayoutSettings settings) {
        this(settings, new EntityFactory(settings, new StationRules(settings.keywords())));
    }

    LanePlacer(LayoutSettings settings, EntityFactory entities) {
        StationRules stationRules = new StationRules(settings.keywords());
        this.classifier = new SectionClassifier(settings.keywords());
        this.placements = new EnumMap<>(SectionKind.class);
        for (SectionKind kind : SectionKind.values()) {
            placements.put(kind, kind.isAssembly()
                    ? new AssemblyPlacement(settings, stationRules, entities)
                    : new PartsPreparationPlacement(kind.getGroup(), settings, entities));
        }
        this.transitionFixtures = settings.transitionFixtures()
                ? new SupermarketTransitionFixtures(settings, entities)
                : TransitionFixturePolicy.NONE;
    }

    /**
     * Places all sections.
     *
     * @param sections balanced operations grouped by section, in first-seen order
     * @return flat list of placed entities; empty when there is nothing to place
     */
    public List<PlacedEntity> place(Map<String, List<BalancedOperation>> sections) {
        return placeAll(sections).entities();
    }

    /**
     * Places all sections and also returns the final lane cursors.
     */
    public SectionResult placeAll(Map<String, List<BalancedOperation>> sections) {
        List<PlacedEntity> layout = new ArrayList<>();
        LaneCursors cursors = LaneCursors.START;
        boolean preparationPlaced = false;
        boolean transitionPlaced = false;

        for (Map.Entry<String, List<BalancedOperation>> entry : sections.entrySet()) {
            String section = entry.getKey();
            SectionKind kind = classifier.classify(section);

            if (kind.isAssembly() && preparationPlaced && !transitionPlaced) {
                SectionResult transition = transitionFixtures.beforeAssembly(cursors);
                layout.addAll(transition.entities());
                cursors = transition.cursors();
                transitionPlaced = true;
            }

            SectionResult result = placements.get(kind).place(section, entry.getValue(), cursors);
            layout.addAll(result.entities());
            cursors = result.cursors();
            preparationPlaced |= !kind.isAssembly();

            log.debug("Section '{}' placed as {}: entities={}, cursors={}",
                    section, kind, result.entities().size(), cursors);
        }

        return new SectionResult(Collections.unmodifiableList(layout), cursors);
    }
}
