package fr.lapetina.lineplanner.domain.model;

/**
 * What a placed entity stands for: a real machine station derived from an
 * operation, or a fixture inserted by layout policy.
 */
public interface EntitySource {

    /**
     * Label shown for the entity.
     */
    String label();

    /**
     * True only for production stations backed by an {@link Operation}.
     */
    boolean isMachine();
}
