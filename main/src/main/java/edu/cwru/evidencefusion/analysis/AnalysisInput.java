package edu.cwru.evidencefusion.analysis;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

import edu.cwru.evidencefusion.ahp.PairwiseComparisonMatrix;
import edu.cwru.evidencefusion.mass.Frame;

/**
 * Everything one analysis run consumes: the frame, experts and criteria in fold
 * order, and one comparison matrix per (expert, criterion).
 */
public final class AnalysisInput {

	private final Frame frame;
	private final ImmutableList<Expert> experts;
	private final ImmutableList<Criterion> criteria;
	private final ImmutableTable<String, String, PairwiseComparisonMatrix> matrices;

	private AnalysisInput(Builder builder) {
		this.frame = Preconditions.checkNotNull(builder.frame, "frame");
		this.experts = ImmutableList.copyOf(builder.experts);
		this.criteria = ImmutableList.copyOf(builder.criteria);
		this.matrices = ImmutableTable.copyOf(builder.matrices);
	}

	public static Builder builder() {
		return new Builder();
	}

	public Frame getFrame() {
		return this.frame;
	}

	public ImmutableList<Expert> getExperts() {
		return this.experts;
	}

	public ImmutableList<Criterion> getCriteria() {
		return this.criteria;
	}

	public Optional<PairwiseComparisonMatrix> matrix(String expertId, String criterionId) {
		return Optional.ofNullable(this.matrices.get(expertId, criterionId));
	}

	/**
	 * Copy of this input with the experts in a different order, same content.
	 */
	public AnalysisInput withExpertOrder(List<Expert> reordered) {
		Preconditions.checkArgument(new HashSet<>(reordered).equals(new HashSet<>(this.experts))
				&& reordered.size() == this.experts.size(), "reordered experts must be a permutation");
		Builder builder = builder().frame(this.frame);
		reordered.forEach(builder::expert);
		this.criteria.forEach(builder::criterion);
		this.matrices.cellSet().forEach(c -> builder.matrix(c.getRowKey(), c.getColumnKey(), c.getValue()));
		return builder.build();
	}

	/**
	 * Copy of this input without one expert, e.g. after its matrix was rejected.
	 */
	public AnalysisInput withoutExpert(String expertId) {
		Builder builder = builder().frame(this.frame);
		this.experts.stream().filter(e -> !e.getId().equals(expertId)).forEach(builder::expert);
		this.criteria.forEach(builder::criterion);
		this.matrices.cellSet().stream().filter(c -> !c.getRowKey().equals(expertId))
				.forEach(c -> builder.matrix(c.getRowKey(), c.getColumnKey(), c.getValue()));
		return builder.build();
	}

	public static final class Builder {
		private Frame frame;
		private final List<Expert> experts = new ArrayList<>();
		private final List<Criterion> criteria = new ArrayList<>();
		private final Table<String, String, PairwiseComparisonMatrix> matrices = HashBasedTable.create();

		private Builder() {
		}

		public Builder frame(Frame frame) {
			this.frame = frame;
			return this;
		}

		public Builder alternatives(String... alternatives) {
			return frame(Frame.of(alternatives));
		}

		public Builder expert(Expert expert) {
			this.experts.add(expert);
			return this;
		}

		public Builder expert(String id, double weight) {
			return expert(new Expert(id, weight));
		}

		public Builder criterion(Criterion criterion) {
			this.criteria.add(criterion);
			return this;
		}

		public Builder criterion(String id, double weight) {
			return criterion(new Criterion(id, weight));
		}

		public Builder matrix(String expertId, String criterionId, PairwiseComparisonMatrix matrix) {
			Preconditions.checkNotNull(matrix, "matrix");
			this.matrices.put(expertId, criterionId, matrix);
			return this;
		}

		public Builder matrix(String expertId, String criterionId, double[][] values) {
			return matrix(expertId, criterionId, PairwiseComparisonMatrix.of(values));
		}

		/**
		 * @throws IllegalArgumentException on an empty or duplicated expert or
		 *                                  criterion list, or a matrix referring
		 *                                  to an unknown id
		 */
		public AnalysisInput build() {
			Preconditions.checkState(this.frame != null, "frame is required");
			Preconditions.checkArgument(!this.experts.isEmpty(), "at least one expert is required");
			Preconditions.checkArgument(!this.criteria.isEmpty(), "at least one criterion is required");
			Set<String> expertIds = new HashSet<>();
			for (Expert e : this.experts)
				Preconditions.checkArgument(expertIds.add(e.getId()), "duplicate expert id: %s", e.getId());
			Set<String> criterionIds = new HashSet<>();
			for (Criterion c : this.criteria)
				Preconditions.checkArgument(criterionIds.add(c.getId()), "duplicate criterion id: %s", c.getId());
			for (String expertId : this.matrices.rowKeySet())
				Preconditions.checkArgument(expertIds.contains(expertId), "matrix for unknown expert: %s", expertId);
			for (String criterionId : this.matrices.columnKeySet())
				Preconditions.checkArgument(criterionIds.contains(criterionId), "matrix for unknown criterion: %s",
						criterionId);
			return new AnalysisInput(this);
		}
	}
}
