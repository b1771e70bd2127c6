package edu.cwru.evidencefusion.belief;

import com.google.common.base.Preconditions;

/**
 * Reduces a belief interval to the single score alternatives are ranked by.
 */
public interface RankingScalarization {

	double score(BeliefInterval interval);

	String name();

	/**
	 * (Bel + Pl) / 2.
	 */
	static RankingScalarization midpoint() {
		return new RankingScalarization() {
			@Override
			public double score(BeliefInterval interval) {
				return (interval.getBelief() + interval.getPlausibility()) / 2.0;
			}

			@Override
			public String name() {
				return "midpoint";
			}
		};
	}

	/**
	 * Hurwicz-style score γ·Bel + (1 - γ)·Pl. γ = 1 is fully pessimistic
	 * (belief only), γ = 0 fully optimistic (plausibility only).
	 */
	static RankingScalarization pessimism(double gamma) {
		Preconditions.checkArgument(gamma >= 0 && gamma <= 1, "pessimism coefficient must be in [0, 1], got %s",
				gamma);
		return new RankingScalarization() {
			@Override
			public double score(BeliefInterval interval) {
				return gamma * interval.getBelief() + (1 - gamma) * interval.getPlausibility();
			}

			@Override
			public String name() {
				return "pessimism(" + gamma + ")";
			}
		};
	}

	static RankingScalarization belief() {
		return pessimism(1.0);
	}

	static RankingScalarization plausibility() {
		return pessimism(0.0);
	}
}
