package autostack;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import autostack.ensemble.EnsembleSelector;

/**
 * Engine settings. Defaults come from the classpath resource {@value #DEFAULT_RESOURCE}; a user file only needs to name the keys it changes.
 */
public class AutoStackConfig {

	public static final String DEFAULT_RESOURCE = "/autostack/defaults.json";

	private static final ObjectMapper MAPPER = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

	@JsonProperty
	private long seed;

	@JsonProperty
	private int maxStackLayers;

	@JsonProperty
	private double minModelSeconds;

	@JsonProperty
	private double gracePeriodSeconds;

	@JsonProperty
	private int extremeMaxRows;

	@JsonProperty
	private double maxHeapFraction;

	@JsonProperty
	private int ensembleRounds;

	@JsonProperty
	private double ensembleTolerance;

	@JsonProperty
	private EnsembleSelector.TieBreak ensembleTieBreak;

	@JsonProperty
	private boolean parallelEnsembleSearch;

	/* null means that the preset decides */
	@JsonProperty
	private Boolean refitFull;

	@JsonProperty
	private boolean persistArtifacts;

	@JsonProperty
	private String artifactDirectory;

	@JsonProperty
	private String weightsCacheDirectory;

	@JsonProperty
	private double[] quantileLevels;

	public static AutoStackConfig loadDefault() throws IOException {
		try (InputStream in = AutoStackConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				throw new IOException("Configuration resource " + DEFAULT_RESOURCE + " not found on the classpath.");
			}
			return MAPPER.readValue(in, AutoStackConfig.class);
		}
	}

	/**
	 * Reads the defaults and overrides them with the keys present in the given file.
	 */
	public static AutoStackConfig load(final Path file) throws IOException {
		AutoStackConfig config = loadDefault();
		try (InputStream in = Files.newInputStream(file)) {
			return MAPPER.readerForUpdating(config).readValue(in);
		}
	}

	public long getSeed() {
		return this.seed;
	}

	public AutoStackConfig setSeed(final long seed) {
		this.seed = seed;
		return this;
	}

	/**
	 * @return upper bound on the number of stack layers, applied on top of the preset
	 */
	public int getMaxStackLayers() {
		return this.maxStackLayers;
	}

	public AutoStackConfig setMaxStackLayers(final int maxStackLayers) {
		this.maxStackLayers = maxStackLayers;
		return this;
	}

	public double getMinModelSeconds() {
		return this.minModelSeconds;
	}

	public AutoStackConfig setMinModelSeconds(final double minModelSeconds) {
		this.minModelSeconds = minModelSeconds;
		return this;
	}

	public double getGracePeriodSeconds() {
		return this.gracePeriodSeconds;
	}

	public AutoStackConfig setGracePeriodSeconds(final double gracePeriodSeconds) {
		this.gracePeriodSeconds = gracePeriodSeconds;
		return this;
	}

	public int getExtremeMaxRows() {
		return this.extremeMaxRows;
	}

	public AutoStackConfig setExtremeMaxRows(final int extremeMaxRows) {
		this.extremeMaxRows = extremeMaxRows;
		return this;
	}

	/**
	 * @return share of the maximum heap that training and in-memory artifacts may fill
	 */
	public double getMaxHeapFraction() {
		return this.maxHeapFraction;
	}

	public AutoStackConfig setMaxHeapFraction(final double maxHeapFraction) {
		this.maxHeapFraction = maxHeapFraction;
		return this;
	}

	public int getEnsembleRounds() {
		return this.ensembleRounds;
	}

	public AutoStackConfig setEnsembleRounds(final int ensembleRounds) {
		this.ensembleRounds = ensembleRounds;
		return this;
	}

	public double getEnsembleTolerance() {
		return this.ensembleTolerance;
	}

	public AutoStackConfig setEnsembleTolerance(final double ensembleTolerance) {
		this.ensembleTolerance = ensembleTolerance;
		return this;
	}

	public EnsembleSelector.TieBreak getEnsembleTieBreak() {
		return this.ensembleTieBreak;
	}

	public AutoStackConfig setEnsembleTieBreak(final EnsembleSelector.TieBreak ensembleTieBreak) {
		this.ensembleTieBreak = ensembleTieBreak;
		return this;
	}

	public boolean isParallelEnsembleSearch() {
		return this.parallelEnsembleSearch;
	}

	public AutoStackConfig setParallelEnsembleSearch(final boolean parallelEnsembleSearch) {
		this.parallelEnsembleSearch = parallelEnsembleSearch;
		return this;
	}

	public Boolean getRefitFull() {
		return this.refitFull;
	}

	public AutoStackConfig setRefitFull(final Boolean refitFull) {
		this.refitFull = refitFull;
		return this;
	}

	public boolean isPersistArtifacts() {
		return this.persistArtifacts;
	}

	public AutoStackConfig setPersistArtifacts(final boolean persistArtifacts) {
		this.persistArtifacts = persistArtifacts;
		return this;
	}

	public Path getArtifactDirectory() {
		return this.artifactDirectory != null ? Paths.get(this.artifactDirectory) : null;
	}

	public AutoStackConfig setArtifactDirectory(final String artifactDirectory) {
		this.artifactDirectory = artifactDirectory;
		return this;
	}

	public Path getWeightsCacheDirectory() {
		return this.weightsCacheDirectory != null ? Paths.get(this.weightsCacheDirectory) : null;
	}

	public AutoStackConfig setWeightsCacheDirectory(final String weightsCacheDirectory) {
		this.weightsCacheDirectory = weightsCacheDirectory;
		return this;
	}

	public double[] getQuantileLevels() {
		return this.quantileLevels != null ? Arrays.copyOf(this.quantileLevels, this.quantileLevels.length) : null;
	}

	public AutoStackConfig setQuantileLevels(final double... quantileLevels) {
		this.quantileLevels = quantileLevels != null ? Arrays.copyOf(quantileLevels, quantileLevels.length) : null;
		return this;
	}

	@Override
	public String toString() {
		return "AutoStackConfig [seed=" + this.seed + ", maxStackLayers=" + this.maxStackLayers + ", minModelSeconds=" + this.minModelSeconds + ", gracePeriodSeconds=" + this.gracePeriodSeconds + ", extremeMaxRows="
				+ this.extremeMaxRows + ", maxHeapFraction=" + this.maxHeapFraction + ", ensembleRounds=" + this.ensembleRounds + ", ensembleTolerance=" + this.ensembleTolerance + ", ensembleTieBreak=" + this.ensembleTieBreak + ", parallelEnsembleSearch="
				+ this.parallelEnsembleSearch + ", refitFull=" + this.refitFull + ", persistArtifacts=" + this.persistArtifacts + ", artifactDirectory=" + this.artifactDirectory + ", weightsCacheDirectory="
				+ this.weightsCacheDirectory + ", quantileLevels=" + Arrays.toString(this.quantileLevels) + "]";
	}
}
