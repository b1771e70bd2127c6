package edu.cwru.evidencefusion.bpa;

import java.util.Arrays;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.ahp.ConsistencyCheck;
import edu.cwru.evidencefusion.ahp.ConsistencyPolicy;
import edu.cwru.evidencefusion.ahp.PairwiseComparisonMatrix;
import edu.cwru.evidencefusion.ahp.PriorityMethod;
import edu.cwru.evidencefusion.exceptions.InconsistentJudgmentException;
import edu.cwru.evidencefusion.exceptions.MalformedMatrixException;
import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Converts one expert's pairwise comparison matrix for one criterion into a
 * basic probability assignment: validate, derive priorities, check
 * consistency, then hand the priorities to a {@link MassMapping}.
 */
public class BpaBuilder {

	private static final Logger logger = LoggerFactory.getLogger(BpaBuilder.class);

	private final PriorityMethod priorityMethod;
	private final MassMapping mapping;
	private final double consistencyThreshold;
	private final ConsistencyPolicy consistencyPolicy;
	private final double reciprocityTolerance;

	public BpaBuilder(PriorityMethod priorityMethod, MassMapping mapping, double consistencyThreshold,
			ConsistencyPolicy consistencyPolicy, double reciprocityTolerance) {
		this.priorityMethod = Preconditions.checkNotNull(priorityMethod, "priorityMethod");
		this.mapping = Preconditions.checkNotNull(mapping, "mapping");
		this.consistencyPolicy = Preconditions.checkNotNull(consistencyPolicy, "consistencyPolicy");
		Preconditions.checkArgument(consistencyThreshold >= 0, "consistency threshold must be >= 0");
		Preconditions.checkArgument(reciprocityTolerance >= 0, "reciprocity tolerance must be >= 0");
		this.consistencyThreshold = consistencyThreshold;
		this.reciprocityTolerance = reciprocityTolerance;
	}

	/**
	 * @param expertId    reported in errors and in the result
	 * @param criterionId reported in errors and in the result
	 * @param frame
	 * @param matrix
	 * @return the assignment with its priorities and consistency ratio
	 * @throws MalformedMatrixException      if the matrix is not a valid
	 *                                       comparison matrix over the frame
	 * @throws InconsistentJudgmentException if the consistency ratio exceeds the
	 *                                       threshold under
	 *                                       {@link ConsistencyPolicy#REJECT}
	 */
	public BpaBuildResult build(String expertId, String criterionId, Frame frame, PairwiseComparisonMatrix matrix) {
		Optional<String> defect = matrix.findDefect(frame.size(), this.reciprocityTolerance);
		if (defect.isPresent())
			throw new MalformedMatrixException(expertId, criterionId, defect.get());

		double[] priorities = this.priorityMethod.priorities(matrix);
		ConsistencyCheck check = ConsistencyCheck.evaluate(matrix, priorities);
		boolean consistent = check.isAcceptable(this.consistencyThreshold);
		if (!consistent) {
			if (this.consistencyPolicy == ConsistencyPolicy.REJECT)
				throw new InconsistentJudgmentException(expertId, criterionId, check.getConsistencyRatio(),
						this.consistencyThreshold);
			logger.warn("Accepting inconsistent judgments of expert {} on criterion {}: CR = {} > {}", expertId,
					criterionId, String.format("%.4f", check.getConsistencyRatio()), this.consistencyThreshold);
		}

		MassFunction bpa = this.mapping.map(frame, priorities);
		if (logger.isDebugEnabled())
			logger.debug("expert={} criterion={} priorities={} CR={} -> {}", expertId, criterionId,
					Arrays.toString(priorities), String.format("%.4f", check.getConsistencyRatio()), bpa);
		return new BpaBuildResult(expertId, criterionId, priorities, check.getLambdaMax(),
				check.getConsistencyRatio(), consistent, bpa);
	}

	public PriorityMethod getPriorityMethod() {
		return this.priorityMethod;
	}

	public MassMapping getMapping() {
		return this.mapping;
	}
}
