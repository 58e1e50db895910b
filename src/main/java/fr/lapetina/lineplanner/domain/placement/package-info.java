/**
 * Deterministic placement of machines and fixtures on the four-lane floor.
 *
 * <p>{@link fr.lapetina.lineplanner.domain.placement.LanePlacer} walks sections in order and
 * delegates each one to a {@link fr.lapetina.lineplanner.domain.placement.SectionPlacement}
 * strategy chosen by {@link fr.lapetina.lineplanner.domain.placement.SectionClassifier}.
 *
 * <h2>Strategies</h2>
 * <table border="1">
 *   <tr><th>Section kind</th><th>Strategy</th><th>Lanes</th></tr>
 *   <tr><td>{@code AB}</td><td>{@code PartsPreparationPlacement}</td><td>A, B alternating per operation</td></tr>
 *   <tr><td>{@code CD}</td><td>{@code PartsPreparationPlacement}</td><td>C, D alternating per operation</td></tr>
 *   <tr><td>{@code ASSEMBLY}</td><td>{@code AssemblyPlacement}</td><td>A, B, C round-robin; D for buttoning</td></tr>
 * </table>
 *
 * <h2>Classification</h2>
 * <p>Keyword lookups are {@link fr.lapetina.lineplanner.domain.placement.ClassificationTable}s:
 * ordered (predicate, outcome) rules where the first match wins.
 *
 * @see fr.lapetina.lineplanner.domain.placement.LayoutSettings
 */
package fr.lapetina.lineplanner.domain.placement;
