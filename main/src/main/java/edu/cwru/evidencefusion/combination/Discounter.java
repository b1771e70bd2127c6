package edu.cwru.evidencefusion.combination;

import java.util.Map;
import java.util.TreeMap;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Shafer discounting of a source by a reliability factor α: every focal mass
 * is scaled by α and the remaining 1 - α is moved to the whole frame Θ. The
 * less important the source, the closer its evidence gets to total ignorance.
 */
public final class Discounter {

	private Discounter() {
	}

	/**
	 * @param m     normalized assignment
	 * @param alpha reliability in [0, 1]; 1 leaves m unchanged, 0 gives m(Θ) = 1
	 * @return discounted assignment
	 */
	public static MassFunction discount(MassFunction m, double alpha) {
		Preconditions.checkArgument(alpha >= 0 && alpha <= 1, "discount factor must be in [0, 1], got %s", alpha);
		Preconditions.checkArgument(m.isNormalized(), "cannot discount an unnormalized assignment");
		if (alpha == 1.0)
			return m;
		int theta = m.getFrame().fullMask();
		TreeMap<Integer, Double> masses = new TreeMap<>();
		for (Map.Entry<Integer, Double> e : m.asMap().entrySet())
			masses.put(e.getKey(), alpha * e.getValue());
		masses.merge(theta, 1.0 - alpha, Double::sum);
		return MassFunction.of(m.getFrame(), masses);
	}
}
