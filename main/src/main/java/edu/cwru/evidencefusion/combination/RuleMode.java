package edu.cwru.evidencefusion.combination;

/**
 * Rule selection policy of the {@link AdaptiveCombiner}.
 */
public enum RuleMode {
	/** Dempster below the conflict threshold, Yager at or above it. */
	ADAPTIVE,
	/** Always Dempster; fails on total conflict. */
	DEMPSTER,
	/** Always Yager. */
	YAGER
}
