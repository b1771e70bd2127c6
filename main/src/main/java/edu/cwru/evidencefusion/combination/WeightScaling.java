package edu.cwru.evidencefusion.combination;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.utilities.Utility;

/**
 * Conversion of importance weights into discount factors in [0, 1].
 */
public enum WeightScaling {

	/** Weights are used as they are and must already lie in [0, 1]. */
	NONE {
		@Override
		public double[] toDiscountFactors(double[] weights) {
			Preconditions.checkArgument(weights.length > 0, "no weights");
			for (double w : weights)
				Preconditions.checkArgument(w >= 0 && w <= 1, "weight must be in [0, 1], got %s", w);
			return weights.clone();
		}
	},

	/** w_i / Σ w. */
	SUM {
		@Override
		public double[] toDiscountFactors(double[] weights) {
			return Utility.normalizeBySum(weights);
		}
	},

	/** w_i / max w, so the most important source is not discounted at all. */
	MAX {
		@Override
		public double[] toDiscountFactors(double[] weights) {
			return Utility.normalizeByMax(weights);
		}
	};

	public abstract double[] toDiscountFactors(double[] weights);
}
