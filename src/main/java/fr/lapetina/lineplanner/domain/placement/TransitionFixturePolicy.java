package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.LaneCursors;

/**
 * Extension point for fixtures placed once parts preparation is complete,
 * between the last preparation section and the assembly section.
 */
public interface TransitionFixturePolicy {

    /** Places nothing and leaves the cursors untouched. */
    TransitionFixturePolicy NONE = cursors -> SectionResult.empty(cursors);

    /**
     * Called once, right before the first assembly section, and only when
     * at least one preparation section has been placed.
     *
     * @param cursors lane cursors after the last preparation section
     * @return fixtures placed and the advanced cursors
     */
    SectionResult beforeAssembly(LaneCursors cursors);
}
