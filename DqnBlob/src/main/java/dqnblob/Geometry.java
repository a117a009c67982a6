package dqnblob;

// Angle and distance helpers shared by both environments
public final class Geometry {

    private Geometry() {
    }

    // atan2(sin, cos) keeps the result in [-pi, pi]
    public static double wrapAngle(double angle) {
        return Math.atan2(Math.sin(angle), Math.cos(angle));
    }

    public static double distance(double x1, double y1, double x2, double y2) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public static double relativeBearing(double fromX, double fromY, double heading, double toX, double toY) {
        double angleTo = Math.atan2(toY - fromY, toX - fromX);
        return wrapAngle(angleTo - heading);
    }

    // Coordinate wrapped onto [0, size)
    public static double wrap(double value, double size) {
        double wrapped = value % size;
        if (wrapped < 0) {
            wrapped += size;
        }
        // -tiny % size + size can round up to size itself
        return wrapped >= size ? 0.0 : wrapped;
    }
}
