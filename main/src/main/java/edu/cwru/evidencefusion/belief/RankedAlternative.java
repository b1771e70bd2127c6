package edu.cwru.evidencefusion.belief;

public final class RankedAlternative {

	private final int rank;
	private final BeliefInterval interval;
	private final double score;

	public RankedAlternative(int rank, BeliefInterval interval, double score) {
		this.rank = rank;
		this.interval = interval;
		this.score = score;
	}

	/**
	 * 1 for the preferred alternative.
	 */
	public int getRank() {
		return this.rank;
	}

	public String getAlternative() {
		return this.interval.getAlternative();
	}

	public BeliefInterval getInterval() {
		return this.interval;
	}

	public double getBelief() {
		return this.interval.getBelief();
	}

	public double getPlausibility() {
		return this.interval.getPlausibility();
	}

	public double getScore() {
		return this.score;
	}

	@Override
	public String toString() {
		return String.format("%d. %s score=%.6f", this.rank, this.interval, this.score);
	}
}
