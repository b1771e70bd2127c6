package edu.cwru.evidencefusion.combination;

/**
 * The combination rule actually applied at a fold step.
 */
public enum RuleType {
	DEMPSTER, YAGER
}
