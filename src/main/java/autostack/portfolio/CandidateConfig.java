package autostack.portfolio;

import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

/**
 * A model configuration drawn from the portfolio. Immutable; shared by all layers that train it.
 *
 * The hyperparameter map may contain the reserved key {@value #ENGINE_ARGS}, a nested map of arguments that steer the engine rather than the model.
 */
public class CandidateConfig {

	public static final String ENGINE_ARGS = "engine";
	public static final String ARG_VALID_BASE = "validBase";
	public static final String ARG_VALID_STACKER = "validStacker";
	public static final String ARG_MAX_ROWS = "maxRows";

	private final String name;
	private final String familyId;
	private final ImmutableMap<String, Object> hyperparameters;
	private final ResourceEstimate estimate;
	private final int rank;
	private final String weightsId;

	public CandidateConfig(final String name, final String familyId, final Map<String, ?> hyperparameters, final ResourceEstimate estimate, final int rank) {
		this(name, familyId, hyperparameters, estimate, rank, null);
	}

	/**
	 * @param weightsId
	 *            identifier of an external weights artifact the candidate needs, or null if it is self-contained
	 */
	public CandidateConfig(final String name, final String familyId, final Map<String, ?> hyperparameters, final ResourceEstimate estimate, final int rank, final String weightsId) {
		super();
		this.name = Objects.requireNonNull(name);
		this.familyId = Objects.requireNonNull(familyId);
		this.estimate = Objects.requireNonNull(estimate);
		this.rank = rank;
		this.weightsId = weightsId;
		ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
		if (hyperparameters != null) {
			for (Entry<String, ?> e : hyperparameters.entrySet()) {
				if (e.getValue() == null) {
					continue;
				}
				if (ENGINE_ARGS.equals(e.getKey())) {
					if (!(e.getValue() instanceof Map)) {
						throw new IllegalArgumentException("Engine arguments of " + name + " must be a map but are " + e.getValue());
					}
					builder.put(ENGINE_ARGS, ImmutableMap.copyOf((Map<?, ?>) e.getValue()));
				} else {
					builder.put(e.getKey(), e.getValue());
				}
			}
		}
		this.hyperparameters = builder.build();
	}

	public String getName() {
		return this.name;
	}

	public String getFamilyId() {
		return this.familyId;
	}

	/**
	 * @return all hyperparameters including the engine arguments
	 */
	public ImmutableMap<String, Object> getHyperparameters() {
		return this.hyperparameters;
	}

	/**
	 * @return the hyperparameters handed to the model family, i.e. without the engine arguments
	 */
	public Map<String, Object> getModelHyperparameters() {
		ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
		this.hyperparameters.entrySet().stream().filter(e -> !ENGINE_ARGS.equals(e.getKey())).forEach(builder::put);
		return builder.build();
	}

	public Map<?, ?> getEngineArgs() {
		Object args = this.hyperparameters.get(ENGINE_ARGS);
		return args != null ? (Map<?, ?>) args : ImmutableMap.of();
	}

	public boolean isValidBase() {
		return this.getBooleanEngineArg(ARG_VALID_BASE);
	}

	public boolean isValidStacker() {
		return this.getBooleanEngineArg(ARG_VALID_STACKER);
	}

	public boolean isAdmissibleInLayer(final int layer) {
		return layer == 0 ? this.isValidBase() : this.isValidStacker();
	}

	/**
	 * @return maximum number of training rows the candidate should be trained on, or {@link Integer#MAX_VALUE} if unconstrained
	 */
	public int getMaxRows() {
		Object maxRows = this.getEngineArgs().get(ARG_MAX_ROWS);
		if (maxRows == null) {
			return Integer.MAX_VALUE;
		}
		if (maxRows instanceof Number) {
			return ((Number) maxRows).intValue();
		}
		return Integer.parseInt(maxRows.toString());
	}

	private boolean getBooleanEngineArg(final String key) {
		Object value = this.getEngineArgs().get(key);
		if (value == null) {
			return true;
		}
		return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(value.toString());
	}

	public ResourceEstimate getEstimate() {
		return this.estimate;
	}

	/**
	 * @return position in the portfolio; lower ranks have higher expected value
	 */
	public int getRank() {
		return this.rank;
	}

	public boolean requiresExternalWeights() {
		return this.weightsId != null;
	}

	public String getWeightsId() {
		return this.weightsId;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((this.estimate == null) ? 0 : this.estimate.hashCode());
		result = prime * result + ((this.familyId == null) ? 0 : this.familyId.hashCode());
		result = prime * result + ((this.hyperparameters == null) ? 0 : this.hyperparameters.hashCode());
		result = prime * result + ((this.name == null) ? 0 : this.name.hashCode());
		result = prime * result + this.rank;
		result = prime * result + ((this.weightsId == null) ? 0 : this.weightsId.hashCode());
		return result;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (this.getClass() != obj.getClass()) {
			return false;
		}
		CandidateConfig other = (CandidateConfig) obj;
		return this.name.equals(other.name) && this.familyId.equals(other.familyId) && this.hyperparameters.equals(other.hyperparameters) && this.estimate.equals(other.estimate) && this.rank == other.rank
				&& Objects.equals(this.weightsId, other.weightsId);
	}

	@Override
	public String toString() {
		return this.name + " [family=" + this.familyId + ", rank=" + this.rank + ", hyperparameters=" + this.hyperparameters + "]";
	}
}
