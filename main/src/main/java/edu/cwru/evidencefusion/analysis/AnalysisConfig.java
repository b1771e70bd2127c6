package edu.cwru.evidencefusion.analysis;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.ahp.ConsistencyPolicy;
import edu.cwru.evidencefusion.ahp.PriorityMethod;
import edu.cwru.evidencefusion.belief.RankingScalarization;
import edu.cwru.evidencefusion.bpa.ConfidenceScaledMapping;
import edu.cwru.evidencefusion.bpa.DsAhpMapping;
import edu.cwru.evidencefusion.bpa.MassMapping;
import edu.cwru.evidencefusion.combination.AdaptiveCombiner;
import edu.cwru.evidencefusion.combination.RuleMode;
import edu.cwru.evidencefusion.combination.WeightScaling;

/**
 * Immutable set of tunable parameters of an analysis run. Build with
 * {@link #builder()}, or read {@code fusion.*} keys with
 * {@link #fromProperties(Properties)}.
 */
public final class AnalysisConfig {

	public static final String DEFAULT_RESOURCE = "evidence-fusion.properties";

	public static final double DEFAULT_CONFIDENCE = 0.8;
	public static final double DEFAULT_CONSISTENCY_THRESHOLD = 0.1;
	public static final double DEFAULT_RECIPROCITY_TOLERANCE = 1e-3;
	public static final double DEFAULT_PESSIMISM = 0.5;

	private final double conflictThreshold;
	private final RuleMode ruleMode;
	private final PriorityMethod priorityMethod;
	private final MassMapping massMapping;
	private final double consistencyThreshold;
	private final ConsistencyPolicy consistencyPolicy;
	private final double reciprocityTolerance;
	private final WeightScaling expertWeightScaling;
	private final WeightScaling criterionWeightScaling;
	private final RankingScalarization scalarization;
	private final boolean parallelCriteria;

	private AnalysisConfig(Builder builder) {
		this.conflictThreshold = builder.conflictThreshold;
		this.ruleMode = builder.ruleMode;
		this.priorityMethod = builder.priorityMethod;
		this.massMapping = builder.massMapping;
		this.consistencyThreshold = builder.consistencyThreshold;
		this.consistencyPolicy = builder.consistencyPolicy;
		this.reciprocityTolerance = builder.reciprocityTolerance;
		this.expertWeightScaling = builder.expertWeightScaling;
		this.criterionWeightScaling = builder.criterionWeightScaling;
		this.scalarization = builder.scalarization;
		this.parallelCriteria = builder.parallelCriteria;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static AnalysisConfig defaults() {
		return builder().build();
	}

	/**
	 * Read the {@value #DEFAULT_RESOURCE} classpath resource; defaults when it is
	 * absent.
	 */
	public static AnalysisConfig load() {
		return load(DEFAULT_RESOURCE);
	}

	public static AnalysisConfig load(String resource) {
		Properties properties = new Properties();
		try (InputStream in = AnalysisConfig.class.getClassLoader().getResourceAsStream(resource)) {
			if (in != null)
				properties.load(in);
		} catch (IOException e) {
			throw new UncheckedIOException("cannot read " + resource, e);
		}
		return fromProperties(properties);
	}

	/**
	 * Missing keys keep their defaults; malformed values fail with
	 * IllegalArgumentException.
	 */
	public static AnalysisConfig fromProperties(Properties p) {
		Builder builder = builder();
		String value;
		if ((value = get(p, "fusion.conflict-threshold")) != null)
			builder.conflictThreshold(parseDouble("fusion.conflict-threshold", value));
		if ((value = get(p, "fusion.rule-mode")) != null)
			builder.ruleMode(parseEnum(RuleMode.class, "fusion.rule-mode", value));
		if ((value = get(p, "fusion.priority-method")) != null)
			builder.priorityMethod(parseEnum(PriorityMethod.class, "fusion.priority-method", value));
		String mapping = StringUtils.defaultIfBlank(get(p, "fusion.mapping"), ConfidenceScaledMapping.NAME);
		String factor = get(p, "fusion.mapping.factor");
		if (ConfidenceScaledMapping.NAME.equalsIgnoreCase(mapping))
			builder.massMapping(new ConfidenceScaledMapping(
					factor == null ? DEFAULT_CONFIDENCE : parseDouble("fusion.mapping.factor", factor)));
		else if (DsAhpMapping.NAME.equalsIgnoreCase(mapping))
			builder.massMapping(new DsAhpMapping(factor == null ? 1.0 : parseDouble("fusion.mapping.factor", factor),
					(value = get(p, "fusion.mapping.grouping-tolerance")) == null ? 0.0
							: parseDouble("fusion.mapping.grouping-tolerance", value)));
		else
			throw new IllegalArgumentException("fusion.mapping: unknown mapping '" + mapping + "'");
		if ((value = get(p, "fusion.consistency.threshold")) != null)
			builder.consistencyThreshold(parseDouble("fusion.consistency.threshold", value));
		if ((value = get(p, "fusion.consistency.policy")) != null)
			builder.consistencyPolicy(parseEnum(ConsistencyPolicy.class, "fusion.consistency.policy", value));
		if ((value = get(p, "fusion.reciprocity-tolerance")) != null)
			builder.reciprocityTolerance(parseDouble("fusion.reciprocity-tolerance", value));
		if ((value = get(p, "fusion.expert-weight-scaling")) != null)
			builder.expertWeightScaling(parseEnum(WeightScaling.class, "fusion.expert-weight-scaling", value));
		if ((value = get(p, "fusion.criterion-weight-scaling")) != null)
			builder.criterionWeightScaling(parseEnum(WeightScaling.class, "fusion.criterion-weight-scaling", value));
		String ranking = StringUtils.defaultIfBlank(get(p, "fusion.ranking"), "midpoint").toLowerCase(Locale.ROOT);
		switch (ranking) {
		case "midpoint":
			builder.scalarization(RankingScalarization.midpoint());
			break;
		case "pessimism":
			value = get(p, "fusion.ranking.pessimism");
			builder.scalarization(RankingScalarization
					.pessimism(value == null ? DEFAULT_PESSIMISM : parseDouble("fusion.ranking.pessimism", value)));
			break;
		case "belief":
			builder.scalarization(RankingScalarization.belief());
			break;
		case "plausibility":
			builder.scalarization(RankingScalarization.plausibility());
			break;
		default:
			throw new IllegalArgumentException("fusion.ranking: unknown scalarization '" + ranking + "'");
		}
		if ((value = get(p, "fusion.parallel-criteria")) != null)
			builder.parallelCriteria(Boolean.parseBoolean(value));
		return builder.build();
	}

	private static String get(Properties p, String key) {
		return StringUtils.trimToNull(p.getProperty(key));
	}

	private static double parseDouble(String key, String value) {
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + ": not a number '" + value + "'", e);
		}
	}

	private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
		try {
			return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(key + ": unknown value '" + value + "'", e);
		}
	}

	public double getConflictThreshold() {
		return this.conflictThreshold;
	}

	public RuleMode getRuleMode() {
		return this.ruleMode;
	}

	public PriorityMethod getPriorityMethod() {
		return this.priorityMethod;
	}

	public MassMapping getMassMapping() {
		return this.massMapping;
	}

	public double getConsistencyThreshold() {
		return this.consistencyThreshold;
	}

	public ConsistencyPolicy getConsistencyPolicy() {
		return this.consistencyPolicy;
	}

	public double getReciprocityTolerance() {
		return this.reciprocityTolerance;
	}

	public WeightScaling getExpertWeightScaling() {
		return this.expertWeightScaling;
	}

	public WeightScaling getCriterionWeightScaling() {
		return this.criterionWeightScaling;
	}

	public RankingScalarization getScalarization() {
		return this.scalarization;
	}

	public boolean isParallelCriteria() {
		return this.parallelCriteria;
	}

	/**
	 * Copy with another conflict threshold, for threshold sweeps.
	 */
	public AnalysisConfig withConflictThreshold(double threshold) {
		return toBuilder().conflictThreshold(threshold).build();
	}

	public Builder toBuilder() {
		return builder().conflictThreshold(this.conflictThreshold).ruleMode(this.ruleMode)
				.priorityMethod(this.priorityMethod).massMapping(this.massMapping)
				.consistencyThreshold(this.consistencyThreshold).consistencyPolicy(this.consistencyPolicy)
				.reciprocityTolerance(this.reciprocityTolerance).expertWeightScaling(this.expertWeightScaling)
				.criterionWeightScaling(this.criterionWeightScaling).scalarization(this.scalarization)
				.parallelCriteria(this.parallelCriteria);
	}

	@Override
	public String toString() {
		return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE).append("τ", this.conflictThreshold)
				.append("mode", this.ruleMode).append("priorities", this.priorityMethod)
				.append("mapping", this.massMapping).append("crThreshold", this.consistencyThreshold)
				.append("crPolicy", this.consistencyPolicy).append("experts", this.expertWeightScaling)
				.append("criteria", this.criterionWeightScaling).append("ranking", this.scalarization.name())
				.append("parallel", this.parallelCriteria).toString();
	}

	public static final class Builder {
		private double conflictThreshold = AdaptiveCombiner.DEFAULT_THRESHOLD;
		private RuleMode ruleMode = RuleMode.ADAPTIVE;
		private PriorityMethod priorityMethod = PriorityMethod.EIGENVECTOR;
		private MassMapping massMapping = new ConfidenceScaledMapping(DEFAULT_CONFIDENCE);
		private double consistencyThreshold = DEFAULT_CONSISTENCY_THRESHOLD;
		private ConsistencyPolicy consistencyPolicy = ConsistencyPolicy.REJECT;
		private double reciprocityTolerance = DEFAULT_RECIPROCITY_TOLERANCE;
		private WeightScaling expertWeightScaling = WeightScaling.NONE;
		private WeightScaling criterionWeightScaling = WeightScaling.SUM;
		private RankingScalarization scalarization = RankingScalarization.midpoint();
		private boolean parallelCriteria = false;

		private Builder() {
		}

		public Builder conflictThreshold(double conflictThreshold) {
			this.conflictThreshold = conflictThreshold;
			return this;
		}

		public Builder ruleMode(RuleMode ruleMode) {
			this.ruleMode = ruleMode;
			return this;
		}

		public Builder priorityMethod(PriorityMethod priorityMethod) {
			this.priorityMethod = priorityMethod;
			return this;
		}

		public Builder massMapping(MassMapping massMapping) {
			this.massMapping = massMapping;
			return this;
		}

		public Builder consistencyThreshold(double consistencyThreshold) {
			this.consistencyThreshold = consistencyThreshold;
			return this;
		}

		public Builder consistencyPolicy(ConsistencyPolicy consistencyPolicy) {
			this.consistencyPolicy = consistencyPolicy;
			return this;
		}

		public Builder reciprocityTolerance(double reciprocityTolerance) {
			this.reciprocityTolerance = reciprocityTolerance;
			return this;
		}

		public Builder expertWeightScaling(WeightScaling expertWeightScaling) {
			this.expertWeightScaling = expertWeightScaling;
			return this;
		}

		public Builder criterionWeightScaling(WeightScaling criterionWeightScaling) {
			this.criterionWeightScaling = criterionWeightScaling;
			return this;
		}

		public Builder scalarization(RankingScalarization scalarization) {
			this.scalarization = scalarization;
			return this;
		}

		public Builder parallelCriteria(boolean parallelCriteria) {
			this.parallelCriteria = parallelCriteria;
			return this;
		}

		public AnalysisConfig build() {
			Preconditions.checkArgument(this.conflictThreshold >= 0 && this.conflictThreshold <= 1,
					"conflict threshold must be in [0, 1], got %s", this.conflictThreshold);
			Preconditions.checkArgument(this.consistencyThreshold >= 0, "consistency threshold must be >= 0, got %s",
					this.consistencyThreshold);
			Preconditions.checkArgument(this.reciprocityTolerance >= 0, "reciprocity tolerance must be >= 0, got %s",
					this.reciprocityTolerance);
			Preconditions.checkNotNull(this.ruleMode, "ruleMode");
			Preconditions.checkNotNull(this.priorityMethod, "priorityMethod");
			Preconditions.checkNotNull(this.massMapping, "massMapping");
			Preconditions.checkNotNull(this.consistencyPolicy, "consistencyPolicy");
			Preconditions.checkNotNull(this.expertWeightScaling, "expertWeightScaling");
			Preconditions.checkNotNull(this.criterionWeightScaling, "criterionWeightScaling");
			Preconditions.checkNotNull(this.scalarization, "scalarization");
			return new AnalysisConfig(this);
		}
	}
}
