package edu.cwru.evidencefusion.analysis;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.cwru.evidencefusion.belief.BeliefInterval;
import edu.cwru.evidencefusion.belief.RankedAlternative;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * What an analysis hands to result exporters.
 */
public final class AnalysisResult {

	private final AnalysisConfig config;
	private final MassFunction groupAssignment;
	private final ImmutableList<BeliefInterval> intervals;
	private final ImmutableList<RankedAlternative> ranking;
	private final AnalysisTrace trace;

	AnalysisResult(AnalysisConfig config, MassFunction groupAssignment, List<BeliefInterval> intervals,
			List<RankedAlternative> ranking, AnalysisTrace trace) {
		this.config = config;
		this.groupAssignment = groupAssignment;
		this.intervals = ImmutableList.copyOf(intervals);
		this.ranking = ImmutableList.copyOf(ranking);
		this.trace = trace;
	}

	public AnalysisConfig getConfig() {
		return this.config;
	}

	public MassFunction getGroupAssignment() {
		return this.groupAssignment;
	}

	/**
	 * In frame order.
	 */
	public ImmutableList<BeliefInterval> getIntervals() {
		return this.intervals;
	}

	public ImmutableList<RankedAlternative> getRanking() {
		return this.ranking;
	}

	public RankedAlternative getOptimal() {
		return this.ranking.get(0);
	}

	public List<String> rankedAlternatives() {
		return this.ranking.stream().map(RankedAlternative::getAlternative)
				.collect(ImmutableList.toImmutableList());
	}

	public AnalysisTrace getTrace() {
		return this.trace;
	}
}
