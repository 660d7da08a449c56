package autostack.portfolio;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.api4.java.common.control.ILoggingCustomizable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import autostack.resources.Parallelism;

/**
 * Ranked list of model configurations, pruned per fit by dataset characteristics, preset and detected hardware.
 */
public class CandidatePortfolio implements ILoggingCustomizable {

	public static final String DEFAULT_RESOURCE = "/autostack/portfolio.json";
	public static final int DEFAULT_EXTREME_MAX_ROWS = 30000;

	private Logger logger = LoggerFactory.getLogger(CandidatePortfolio.class);

	private final ImmutableList<PortfolioEntry> entries;
	private final int extremeMaxRows;

	public CandidatePortfolio(final List<PortfolioEntry> entries, final int extremeMaxRows) {
		super();
		this.entries = ImmutableList.copyOf(entries);
		this.extremeMaxRows = extremeMaxRows;
		long distinctNames = this.entries.stream().map(PortfolioEntry::getName).distinct().count();
		if (distinctNames != this.entries.size()) {
			throw new IllegalArgumentException("Portfolio entry names must be unique.");
		}
	}

	public static CandidatePortfolio loadDefault(final int extremeMaxRows) throws IOException {
		try (InputStream in = CandidatePortfolio.class.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				throw new IOException("Portfolio resource " + DEFAULT_RESOURCE + " not found on the classpath.");
			}
			return new CandidatePortfolio(readEntries(in), extremeMaxRows);
		}
	}

	public static CandidatePortfolio load(final Path file, final int extremeMaxRows) throws IOException {
		try (InputStream in = Files.newInputStream(file)) {
			return new CandidatePortfolio(readEntries(in), extremeMaxRows);
		}
	}

	private static List<PortfolioEntry> readEntries(final InputStream in) throws IOException {
		return new ObjectMapper().readValue(in, new TypeReference<List<PortfolioEntry>>() {
		});
	}

	public ImmutableList<PortfolioEntry> getEntries() {
		return this.entries;
	}

	public int getExtremeMaxRows() {
		return this.extremeMaxRows;
	}

	/**
	 * The candidate set of the extreme preset is only admitted up to {@link #getExtremeMaxRows()} rows. Above, the candidates of the best preset are
	 * used instead.
	 */
	public Preset getCandidatePreset(final Preset preset, final int numRows) {
		if (preset == Preset.EXTREME_QUALITY && numRows > this.extremeMaxRows) {
			return Preset.BEST_QUALITY;
		}
		return preset;
	}

	public PortfolioSelection getCandidates(final DatasetCharacteristics characteristics, final Preset preset, final Parallelism parallelism) {
		List<String> notes = new ArrayList<>();
		Preset candidatePreset = this.getCandidatePreset(preset, characteristics.getNumRows());
		if (candidatePreset != preset) {
			String note = String.format("%s is disabled for datasets with more than %d rows (got %d). Using the candidates of %s.", preset, this.extremeMaxRows, characteristics.getNumRows(), candidatePreset);
			this.logger.info(note);
			notes.add(note);
		}

		List<PortfolioEntry> admitted = this.entries.stream().filter(e -> candidatePreset.isAtLeast(e.getMinPreset())).filter(e -> e.supports(characteristics)).collect(Collectors.toList());
		if (!parallelism.hasGpu()) {
			List<String> gpuOnly = admitted.stream().filter(PortfolioEntry::isGpuOnly).map(PortfolioEntry::getName).collect(Collectors.toList());
			if (!gpuOnly.isEmpty()) {
				String note = "No GPU detected, excluding GPU-only candidates " + gpuOnly;
				this.logger.info(note);
				notes.add(note);
				admitted.removeIf(PortfolioEntry::isGpuOnly);
			}
		}

		List<CandidateConfig> candidates = new ArrayList<>();
		List<String> tooLarge = new ArrayList<>();
		for (PortfolioEntry entry : admitted) {
			CandidateConfig candidate = entry.toCandidate(characteristics, parallelism.hasGpu());
			if (characteristics.getNumRows() > candidate.getMaxRows()) {
				tooLarge.add(candidate.getName());
				continue;
			}
			candidates.add(candidate);
		}
		if (!tooLarge.isEmpty()) {
			notes.add("Excluding candidates " + tooLarge + " since the data has more rows than they accept.");
		}
		candidates.sort(Comparator.comparingInt(CandidateConfig::getRank).thenComparing(CandidateConfig::getName));
		this.logger.info("Selected {} of {} portfolio candidates for {} under {}.", candidates.size(), this.entries.size(), characteristics, candidatePreset);
		return new PortfolioSelection(preset, candidatePreset, candidates, notes);
	}

	@Override
	public String getLoggerName() {
		return this.logger.getName();
	}

	@Override
	public void setLoggerName(final String name) {
		this.logger = LoggerFactory.getLogger(name);
	}
}
