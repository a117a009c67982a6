package dqnblob;

public class Blob {
    // Absorbs the drift of repeated decay so the starvation floor is inclusive
    static final double MASS_TOLERANCE = 1e-9;

    private double x;
    private double y;
    private double angle;
    private double mass;
    private int pickups;
    private double massStolen;

    void place(double x, double y, double angle, double mass) {
        this.x = x;
        this.y = y;
        this.angle = angle;
        this.mass = mass;
        this.pickups = 0;
        this.massStolen = 0.0;
    }

    void steer(Action action, double turnRate) {
        if (action == Action.LEFT) {
            angle += turnRate;
        } else {
            angle -= turnRate;
        }
        angle = Geometry.wrapAngle(angle);
    }

    void moveForward(double speed, double mapSize) {
        x = Geometry.wrap(x + speed * Math.cos(angle), mapSize);
        y = Geometry.wrap(y + speed * Math.sin(angle), mapSize);
    }

    void decay(double rate) {
        mass -= rate;
    }

    void eat(double gain) {
        mass += gain;
        pickups++;
    }

    void transferMass(double amount) {
        mass += amount;
        if (amount > 0) {
            massStolen += amount;
        }
    }

    public boolean isStarved(double minMass) {
        return mass <= minMass + MASS_TOLERANCE;
    }

    public double distanceTo(Blob other) {
        return Geometry.distance(x, y, other.x, other.y);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getAngle() {
        return angle;
    }

    public double getMass() {
        return mass;
    }

    public int getPickups() {
        return pickups;
    }

    public double getMassStolen() {
        return massStolen;
    }

    @Override
    public String toString() {
        return String.format("Blob(x=%.2f, y=%.2f, angle=%.3f, mass=%.3f)", x, y, angle, mass);
    }
}
