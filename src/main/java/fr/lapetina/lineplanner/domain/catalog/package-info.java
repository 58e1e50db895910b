/**
 * Machine type catalogue: category and floor footprint per free-text machine type.
 */
package fr.lapetina.lineplanner.domain.catalog;
