/**
 * Exceptions that abort layout generation.
 *
 * <p>Every exception extends {@link fr.lapetina.lineplanner.domain.exception.LayoutException}
 * and carries a {@link fr.lapetina.lineplanner.domain.model.LayoutErrorType}.
 */
package fr.lapetina.lineplanner.domain.exception;
