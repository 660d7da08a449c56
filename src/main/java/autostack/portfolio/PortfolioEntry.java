package autostack.portfolio;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import autostack.data.ProblemType;

/**
 * One line of the portfolio file. The cost model is linear in the number of cells of the training data.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PortfolioEntry {

	private final String name;
	private final String family;
	private final Preset minPreset;
	private final int rank;
	private final ImmutableMap<String, Object> hyperparameters;
	private final double baseSeconds;
	private final double secondsPerMillionCells;
	private final double bytesPerCell;
	private final int cpus;
	private final int gpus;
	private final boolean gpuOnly;
	private final boolean gpuSharing;
	private final int maxFeatures;
	private final int maxClasses;
	private final Set<ProblemType> problemTypes;
	private final String weights;

	@JsonCreator
	public PortfolioEntry(@JsonProperty("name") final String name, @JsonProperty("family") final String family, @JsonProperty("minPreset") final Preset minPreset, @JsonProperty("rank") final int rank,
			@JsonProperty("hyperparameters") final Map<String, Object> hyperparameters, @JsonProperty("baseSeconds") final double baseSeconds, @JsonProperty("secondsPerMillionCells") final double secondsPerMillionCells,
			@JsonProperty("bytesPerCell") final double bytesPerCell, @JsonProperty("cpus") final Integer cpus, @JsonProperty("gpus") final int gpus, @JsonProperty("gpuOnly") final boolean gpuOnly,
			@JsonProperty("gpuSharing") final boolean gpuSharing, @JsonProperty("maxFeatures") final Integer maxFeatures, @JsonProperty("maxClasses") final Integer maxClasses,
			@JsonProperty("problemTypes") final List<ProblemType> problemTypes, @JsonProperty("weights") final String weights) {
		super();
		if (name == null || family == null) {
			throw new IllegalArgumentException("Portfolio entries need a name and a family.");
		}
		this.name = name;
		this.family = family;
		this.minPreset = minPreset != null ? minPreset : Preset.MEDIUM_QUALITY;
		this.rank = rank;
		this.hyperparameters = hyperparameters != null ? ImmutableMap.copyOf(hyperparameters) : ImmutableMap.of();
		this.baseSeconds = baseSeconds;
		this.secondsPerMillionCells = secondsPerMillionCells;
		this.bytesPerCell = bytesPerCell;
		this.cpus = cpus != null ? cpus : 1;
		this.gpus = gpus;
		this.gpuOnly = gpuOnly;
		this.gpuSharing = gpuSharing;
		this.maxFeatures = maxFeatures != null ? maxFeatures : Integer.MAX_VALUE;
		this.maxClasses = maxClasses != null ? maxClasses : Integer.MAX_VALUE;
		this.problemTypes = problemTypes == null || problemTypes.isEmpty() ? EnumSet.allOf(ProblemType.class) : EnumSet.copyOf(problemTypes);
		this.weights = weights;
	}

	public String getName() {
		return this.name;
	}

	public String getFamily() {
		return this.family;
	}

	public Preset getMinPreset() {
		return this.minPreset;
	}

	public int getRank() {
		return this.rank;
	}

	public ImmutableMap<String, Object> getHyperparameters() {
		return this.hyperparameters;
	}

	public double getBaseSeconds() {
		return this.baseSeconds;
	}

	public double getSecondsPerMillionCells() {
		return this.secondsPerMillionCells;
	}

	public double getBytesPerCell() {
		return this.bytesPerCell;
	}

	public int getCpus() {
		return this.cpus;
	}

	public int getGpus() {
		return this.gpus;
	}

	public boolean isGpuOnly() {
		return this.gpuOnly;
	}

	public boolean isGpuSharing() {
		return this.gpuSharing;
	}

	public int getMaxFeatures() {
		return this.maxFeatures;
	}

	public int getMaxClasses() {
		return this.maxClasses;
	}

	public List<ProblemType> getProblemTypes() {
		return ImmutableList.copyOf(this.problemTypes);
	}

	public String getWeights() {
		return this.weights;
	}

	public boolean supports(final DatasetCharacteristics characteristics) {
		return this.problemTypes.contains(characteristics.getProblemType()) && characteristics.getNumFeatures() <= this.maxFeatures
				&& (!characteristics.getProblemType().isClassification() || characteristics.getNumClasses() <= this.maxClasses);
	}

	/**
	 * Instantiates the entry for a concrete dataset.
	 *
	 * @param useGpu
	 *            whether GPUs are present; GPU requests of entries that can also run on CPUs are dropped if not
	 */
	public CandidateConfig toCandidate(final DatasetCharacteristics characteristics, final boolean useGpu) {
		int requestedGpus = useGpu ? this.gpus : 0;
		ResourceEstimate estimate = ResourceEstimate.perCell(this.cpus, requestedGpus, this.baseSeconds, this.secondsPerMillionCells / 1e6, this.bytesPerCell, characteristics.getNumCells(), this.gpuOnly,
				this.gpuSharing);
		return new CandidateConfig(this.name, this.family, this.hyperparameters, estimate, this.rank, this.weights);
	}

	@Override
	public String toString() {
		return "PortfolioEntry [name=" + this.name + ", family=" + this.family + ", minPreset=" + this.minPreset + ", rank=" + this.rank + "]";
	}
}
