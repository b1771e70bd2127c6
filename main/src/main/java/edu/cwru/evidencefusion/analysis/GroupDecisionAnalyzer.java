package edu.cwru.evidencefusion.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.ahp.PairwiseComparisonMatrix;
import edu.cwru.evidencefusion.belief.BeliefInterval;
import edu.cwru.evidencefusion.belief.BeliefPlausibilityCalculator;
import edu.cwru.evidencefusion.belief.RankedAlternative;
import edu.cwru.evidencefusion.bpa.BpaBuildResult;
import edu.cwru.evidencefusion.bpa.BpaBuilder;
import edu.cwru.evidencefusion.combination.AdaptiveCombiner;
import edu.cwru.evidencefusion.combination.ConflictMeasure;
import edu.cwru.evidencefusion.combination.Discounter;
import edu.cwru.evidencefusion.combination.FoldResult;
import edu.cwru.evidencefusion.combination.LabelledMass;
import edu.cwru.evidencefusion.combination.RuleType;
import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Runs the whole pipeline over an {@link AnalysisInput}:
 *
 * <ol>
 * <li>per criterion, build every expert's assignment from their matrix and
 * discount it by the expert's scaled weight;</li>
 * <li>fold the experts left to right, in input order, with the adaptive
 * rule;</li>
 * <li>discount each criterion result by the criterion's scaled weight and fold
 * the criteria left to right, in input order;</li>
 * <li>rank the alternatives by their belief intervals.</li>
 * </ol>
 *
 * Stateless apart from its configuration; a single instance may be reused and
 * shared.
 */
public class GroupDecisionAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(GroupDecisionAnalyzer.class);

	private final AnalysisConfig config;
	private final BpaBuilder bpaBuilder;
	private final AdaptiveCombiner combiner;
	private final BeliefPlausibilityCalculator calculator;

	public GroupDecisionAnalyzer() {
		this(AnalysisConfig.defaults());
	}

	public GroupDecisionAnalyzer(AnalysisConfig config) {
		this.config = Preconditions.checkNotNull(config, "config");
		this.bpaBuilder = new BpaBuilder(config.getPriorityMethod(), config.getMassMapping(),
				config.getConsistencyThreshold(), config.getConsistencyPolicy(), config.getReciprocityTolerance());
		this.combiner = new AdaptiveCombiner(config.getConflictThreshold(), config.getRuleMode());
		this.calculator = new BeliefPlausibilityCalculator(config.getScalarization());
	}

	public AnalysisConfig getConfig() {
		return this.config;
	}

	/**
	 * Matrix and consistency failures propagate with the offending expert and
	 * criterion ids; no partial result is returned.
	 */
	public AnalysisResult analyze(AnalysisInput input) {
		Preconditions.checkNotNull(input, "input");
		Frame frame = input.getFrame();
		List<Expert> experts = input.getExperts();
		List<Criterion> criteria = input.getCriteria();
		logger.debug("Analyzing {} alternatives, {} experts, {} criteria with {}", frame.size(), experts.size(),
				criteria.size(), this.config);

		double[] expertFactors = this.config.getExpertWeightScaling()
				.toDiscountFactors(experts.stream().mapToDouble(Expert::getWeight).toArray());
		double[] criterionFactors = this.config.getCriterionWeightScaling()
				.toDiscountFactors(criteria.stream().mapToDouble(Criterion::getWeight).toArray());

		// criteria are independent until their results are folded, so only this
		// stage may run in parallel
		IntStream indices = IntStream.range(0, criteria.size());
		if (this.config.isParallelCriteria())
			indices = indices.parallel();
		List<CriterionFusion> fusions = indices
				.mapToObj(c -> fuseCriterion(input, criteria.get(c), criterionFactors[c], expertFactors))
				.collect(Collectors.toList());

		List<LabelledMass> criterionSources = new ArrayList<>(fusions.size());
		for (CriterionFusion fusion : fusions)
			criterionSources.add(new LabelledMass(fusion.getCriterionId(), fusion.getDiscounted()));
		FoldResult criteriaFold = this.combiner.fold(criterionSources);
		MassFunction group = criteriaFold.getCombined();

		List<BeliefInterval> intervals = this.calculator.intervals(group);
		List<RankedAlternative> ranking = this.calculator.rank(group);
		AnalysisTrace trace = new AnalysisTrace(fusions, criteriaFold);

		logger.debug("Group assignment {}", group);
		logger.debug("Ranking {} (Dempster folds: {}, Yager folds: {})", ranking, trace.countRule(RuleType.DEMPSTER),
				trace.countRule(RuleType.YAGER));
		return new AnalysisResult(this.config, group, intervals, ranking, trace);
	}

	private CriterionFusion fuseCriterion(AnalysisInput input, Criterion criterion, double criterionFactor,
			double[] expertFactors) {
		Frame frame = input.getFrame();
		List<Expert> experts = input.getExperts();
		List<ExpertEvidence> evidence = new ArrayList<>(experts.size());
		List<LabelledMass> sources = new ArrayList<>(experts.size());
		for (int e = 0; e < experts.size(); e++) {
			Expert expert = experts.get(e);
			ExpertEvidence ev = buildEvidence(frame, expert, criterion, expertFactors[e],
					input.matrix(expert.getId(), criterion.getId()));
			evidence.add(ev);
			sources.add(new LabelledMass(expert.getId(), ev.getDiscounted()));
		}
		double meanConflict = ConflictMeasure.meanPairwiseConflict(
				evidence.stream().map(ExpertEvidence::getDiscounted).collect(Collectors.toList()));
		FoldResult fold = this.combiner.fold(sources);
		MassFunction discounted = Discounter.discount(fold.getCombined(), criterionFactor);
		logger.debug("criterion {}: mean pairwise conflict {}, combined {}, discounted by {} -> {}",
				criterion.getId(), String.format("%.6f", meanConflict), fold.getCombined(), criterionFactor,
				discounted);
		return new CriterionFusion(criterion.getId(), evidence, meanConflict, fold, criterionFactor, discounted);
	}

	private ExpertEvidence buildEvidence(Frame frame, Expert expert, Criterion criterion, double factor,
			Optional<PairwiseComparisonMatrix> matrix) {
		if (!matrix.isPresent()) {
			logger.warn("No matrix from expert {} for criterion {}; using total ignorance", expert.getId(),
					criterion.getId());
			MassFunction vacuous = MassFunction.vacuous(frame);
			return new ExpertEvidence(expert.getId(), criterion.getId(), null, vacuous, factor, vacuous);
		}
		BpaBuildResult build = this.bpaBuilder.build(expert.getId(), criterion.getId(), frame, matrix.get());
		MassFunction raw = build.getMassFunction();
		return new ExpertEvidence(expert.getId(), criterion.getId(), build, raw, factor,
				Discounter.discount(raw, factor));
	}
}
