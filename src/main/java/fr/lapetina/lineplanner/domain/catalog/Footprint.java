package fr.lapetina.lineplanner.domain.catalog;

/**
 * Floor footprint in metres.
 *
 * @param length along-line extent
 * @param width  across-line extent
 */
public record Footprint(double length, double width) {

    static final double FEET_TO_METRES = 0.3048;

    public static Footprint ofFeet(double lengthFt, double widthFt) {
        return new Footprint(lengthFt * FEET_TO_METRES, widthFt * FEET_TO_METRES);
    }

    public double area() {
        return length * width;
    }
}
