package edu.cwru.evidencefusion.ahp;

/**
 * What to do with a matrix whose consistency ratio exceeds the threshold.
 */
public enum ConsistencyPolicy {
	/** Abort with an InconsistentJudgmentException. */
	REJECT,
	/** Log a warning, keep the evidence, and flag it in the trace. */
	WARN
}
