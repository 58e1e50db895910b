/**
 * Ordered grouping of balanced operations by garment section.
 */
package fr.lapetina.lineplanner.domain.grouping;
