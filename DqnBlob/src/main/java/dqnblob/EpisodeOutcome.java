package dqnblob;

import java.util.Arrays;

// Winner is 1 or 2 only when that blob outlived the other; 0 otherwise
public final class EpisodeOutcome {
    public static final int DRAW = 0;

    private final int winner;
    private final double[] masses;
    private final int[] pickups;
    private final double[] massStolen;

    EpisodeOutcome(int winner, Blob... blobs) {
        this.winner = winner;
        this.masses = new double[blobs.length];
        this.pickups = new int[blobs.length];
        this.massStolen = new double[blobs.length];
        for (int i = 0; i < blobs.length; i++) {
            masses[i] = blobs[i].getMass();
            pickups[i] = blobs[i].getPickups();
            massStolen[i] = blobs[i].getMassStolen();
        }
    }

    public int getWinner() {
        return winner;
    }

    public int agentCount() {
        return masses.length;
    }

    // Agents are numbered from 1, matching the winner field

    public double getMass(int agent) {
        return masses[agent - 1];
    }

    public int getPickups(int agent) {
        return pickups[agent - 1];
    }

    public double getMassStolen(int agent) {
        return massStolen[agent - 1];
    }

    @Override
    public String toString() {
        return "EpisodeOutcome(winner=" + winner
                + ", masses=" + Arrays.toString(masses)
                + ", pickups=" + Arrays.toString(pickups)
                + ", massStolen=" + Arrays.toString(massStolen) + ")";
    }
}
