package edu.cwru.evidencefusion.combination;

import java.util.Map;
import java.util.TreeMap;

import edu.cwru.evidencefusion.exceptions.TotalConflictException;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Normalized conjunctive rule: m(C) = Σ_{A∩B=C} m1(A) m2(B) / (1 - k).
 */
public final class DempsterRule implements CombinationRule {

	public static final DempsterRule INSTANCE = new DempsterRule();

	private DempsterRule() {
	}

	/**
	 * @throws TotalConflictException if no pair of focal elements intersects
	 */
	@Override
	public MassFunction combine(MassFunction m1, MassFunction m2) {
		ConjunctiveProduct product = new ConjunctiveProduct(m1, m2);
		double agreement = product.agreement();
		if (ConflictMeasure.isTotal(product.conflict()) || agreement <= 0.0)
			throw new TotalConflictException(product.conflict());
		TreeMap<Integer, Double> masses = product.intersections();
		for (Map.Entry<Integer, Double> e : masses.entrySet())
			e.setValue(e.getValue() / agreement);
		return MassFunction.of(m1.getFrame(), masses);
	}

	@Override
	public RuleType getType() {
		return RuleType.DEMPSTER;
	}
}
