package fr.lapetina.lineplanner.domain.model;

/**
 * Plain 3D vector in metres (positions) or radians (rotations).
 */
public record Vector3(double x, double y, double z) {

    public static Vector3 yaw(double radians) {
        return new Vector3(0, radians, 0);
    }
}
