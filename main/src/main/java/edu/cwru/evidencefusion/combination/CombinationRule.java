package edu.cwru.evidencefusion.combination;

import edu.cwru.evidencefusion.mass.MassFunction;

public interface CombinationRule {

	/**
	 * Combine two normalized assignments over the same frame into a new
	 * normalized assignment. Operands are not modified.
	 */
	MassFunction combine(MassFunction m1, MassFunction m2);

	RuleType getType();
}
