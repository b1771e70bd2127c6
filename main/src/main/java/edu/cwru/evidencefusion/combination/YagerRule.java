package edu.cwru.evidencefusion.combination;

import java.util.TreeMap;

import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Unnormalized conjunctive rule: intersections keep their raw product and the
 * conflicting mass k is moved to the whole frame Θ. Defined for every k,
 * including total conflict.
 */
public final class YagerRule implements CombinationRule {

	public static final YagerRule INSTANCE = new YagerRule();

	private YagerRule() {
	}

	@Override
	public MassFunction combine(MassFunction m1, MassFunction m2) {
		ConjunctiveProduct product = new ConjunctiveProduct(m1, m2);
		TreeMap<Integer, Double> masses = product.intersections();
		masses.merge(m1.getFrame().fullMask(), product.conflict(), Double::sum);
		return MassFunction.of(m1.getFrame(), masses);
	}

	@Override
	public RuleType getType() {
		return RuleType.YAGER;
	}
}
