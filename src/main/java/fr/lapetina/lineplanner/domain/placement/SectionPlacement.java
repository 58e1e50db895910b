package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.LaneCursors;

import java.util.List;

/**
 * Strategy for laying out one section.
 *
 * Implementations are stateless: the lane cursors come in as an argument
 * and the advanced cursors go out in the result.
 */
public interface SectionPlacement {

    /**
     * Places every machine of the section plus its fixtures.
     *
     * @param section    section label
     * @param operations balanced operations of the section, in input order
     * @param cursors    lane cursors before the section
     * @return placed entities and the cursors after the section
     */
    SectionResult place(String section, List<BalancedOperation> operations, LaneCursors cursors);
}
