/**
 * Line balancing: machine counts per operation from a daily production target.
 *
 * @see fr.lapetina.lineplanner.domain.balancing.CapacityPlanner
 */
package fr.lapetina.lineplanner.domain.balancing;
