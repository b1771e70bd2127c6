package edu.cwru.evidencefusion.belief;

/**
 * [Bel, Pl] of one alternative.
 */
public final class BeliefInterval {

	private final String alternative;
	private final double belief;
	private final double plausibility;

	public BeliefInterval(String alternative, double belief, double plausibility) {
		this.alternative = alternative;
		this.belief = belief;
		this.plausibility = plausibility;
	}

	public String getAlternative() {
		return this.alternative;
	}

	public double getBelief() {
		return this.belief;
	}

	public double getPlausibility() {
		return this.plausibility;
	}

	/**
	 * Pl - Bel, the uncommitted mass around this alternative.
	 */
	public double width() {
		return this.plausibility - this.belief;
	}

	@Override
	public String toString() {
		return String.format("%s[%.6f, %.6f]", this.alternative, this.belief, this.plausibility);
	}
}
