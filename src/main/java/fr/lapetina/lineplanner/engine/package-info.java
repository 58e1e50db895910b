/**
 * Layout engine wiring balancing, grouping and placement into one call.
 *
 * @see fr.lapetina.lineplanner.engine.LayoutGenerator
 */
package fr.lapetina.lineplanner.engine;
