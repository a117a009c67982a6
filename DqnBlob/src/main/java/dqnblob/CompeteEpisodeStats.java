package dqnblob;

// Per-blob arrays: index 0 is blob 1
public final class CompeteEpisodeStats {
    public final int episode;
    public final int length;
    public final double[] rewards;
    public final int[] pickups;
    public final double[] massStolen;
    public final int winner;
    public final double epsilon;

    public CompeteEpisodeStats(int episode, int length, double[] rewards, EpisodeOutcome outcome, double epsilon) {
        this.episode = episode;
        this.length = length;
        this.rewards = rewards.clone();
        this.pickups = new int[]{outcome.getPickups(1), outcome.getPickups(2)};
        this.massStolen = new double[]{outcome.getMassStolen(1), outcome.getMassStolen(2)};
        this.winner = outcome.getWinner();
        this.epsilon = epsilon;
    }

    @Override
    public String toString() {
        return String.format("Episode %d: length=%d winner=%d rewards=(%.2f, %.2f) pickups=(%d, %d) stolen=(%.2f, %.2f) epsilon=%.3f",
                episode, length, winner, rewards[0], rewards[1], pickups[0], pickups[1], massStolen[0], massStolen[1], epsilon);
    }
}
