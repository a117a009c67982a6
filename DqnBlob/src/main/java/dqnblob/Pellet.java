package dqnblob;

// A food pellet. Pellets never move; a collected one is replaced by a new instance.
public final class Pellet {
    private final double x;
    private final double y;

    public Pellet(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double distanceTo(Blob blob) {
        return Geometry.distance(blob.getX(), blob.getY(), x, y);
    }

    @Override
    public String toString() {
        return String.format("Pellet(%.2f, %.2f)", x, y);
    }
}
