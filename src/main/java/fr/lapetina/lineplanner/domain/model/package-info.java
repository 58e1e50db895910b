/**
 * Domain model of a sewing line layout.
 *
 * <p>All types in this package are immutable values.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.lineplanner.domain.model.Operation} - One operation of the bulletin</li>
 *   <li>{@link fr.lapetina.lineplanner.domain.model.BalancedOperation} - Operation with its machine count</li>
 *   <li>{@link fr.lapetina.lineplanner.domain.model.PlacedEntity} - Machine or fixture placed on the floor</li>
 *   <li>{@link fr.lapetina.lineplanner.domain.model.EntitySource} - Machine station or fixture variant</li>
 *   <li>{@link fr.lapetina.lineplanner.domain.model.LaneCursors} - Per-lane placement state</li>
 * </ul>
 *
 * <h2>Floor Topology</h2>
 * <p>Four lanes run along the X axis. Lanes A/B and C/D are paired and face
 * each other across a narrow aisle; A and C sit next to the centre aisle.
 */
package fr.lapetina.lineplanner.domain.model;
