/**
 * Line Planner - floor layout generation for garment sewing lines.
 *
 * <p>Given an operation bulletin and a daily production target, the planner sizes the number
 * of machines per operation and places every machine on a fixed four-lane floor, together with
 * section boards, inspection tables and material trolleys.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.lineplanner.engine.LayoutGenerator} - Balancing, grouping and placement in one call</li>
 *   <li>{@link fr.lapetina.lineplanner.LinePlannerFactory} - Generator wired from YAML configuration</li>
 *   <li>{@link fr.lapetina.lineplanner.LinePlannerApplication} - Standalone HTTP service</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * LayoutGenerator generator = new LayoutGenerator(LayoutSettings.defaults());
 * List<PlacedEntity> layout = generator.generate(List.of(
 *         new Operation("10", "Attach cuff", "SNLS", 0.8, "Cuff"),
 *         new Operation("20", "Press cuff", "Iron", 0.4, "Cuff")
 * ), 1200, 480);
 * }</pre>
 *
 * @see fr.lapetina.lineplanner.engine.LayoutGenerator
 * @see fr.lapetina.lineplanner.domain.placement.LanePlacer
 */
package fr.lapetina.lineplanner;
