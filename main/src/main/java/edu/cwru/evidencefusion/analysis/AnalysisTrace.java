package edu.cwru.evidencefusion.analysis;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.cwru.evidencefusion.combination.FoldResult;
import edu.cwru.evidencefusion.combination.FoldStep;
import edu.cwru.evidencefusion.combination.RuleType;

/**
 * Full intermediate record of an analysis: every per-expert assignment, every
 * per-criterion fold, and the cross-criteria fold.
 */
public final class AnalysisTrace {

	private final ImmutableList<CriterionFusion> criteria;
	private final FoldResult criteriaFold;

	AnalysisTrace(List<CriterionFusion> criteria, FoldResult criteriaFold) {
		this.criteria = ImmutableList.copyOf(criteria);
		this.criteriaFold = criteriaFold;
	}

	/**
	 * In criterion fold order.
	 */
	public ImmutableList<CriterionFusion> getCriteria() {
		return this.criteria;
	}

	public FoldResult getCriteriaFold() {
		return this.criteriaFold;
	}

	/**
	 * Every fold step of the run in execution order: the expert folds of each
	 * criterion, then the cross-criteria fold.
	 */
	public List<FoldStep> allSteps() {
		List<FoldStep> ret = new ArrayList<>();
		for (CriterionFusion c : this.criteria)
			ret.addAll(c.getExpertFold().getSteps());
		ret.addAll(this.criteriaFold.getSteps());
		return ret;
	}

	public int countRule(RuleType rule) {
		int count = this.criteriaFold.countRule(rule);
		for (CriterionFusion c : this.criteria)
			count += c.getExpertFold().countRule(rule);
		return count;
	}

	/**
	 * Evidence accepted despite an excessive consistency ratio, or replaced by
	 * total ignorance because no matrix was supplied.
	 */
	public List<ExpertEvidence> flaggedEvidence() {
		List<ExpertEvidence> ret = new ArrayList<>();
		for (CriterionFusion c : this.criteria) {
			for (ExpertEvidence e : c.getEvidence()) {
				if (e.isMissing() || !e.isConsistent())
					ret.add(e);
			}
		}
		return ret;
	}
}
