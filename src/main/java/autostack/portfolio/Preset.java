package autostack.portfolio;

import java.util.Locale;

/**
 * Speed/quality trade-off of a fit. The declaration order is the total order of the presets: later presets admit more and more expensive
 * candidates.
 */
public enum Preset {

	MEDIUM_QUALITY(5, 1, 1, true), GOOD_QUALITY(5, 1, 2, true), HIGH_QUALITY(8, 1, 2, true), BEST_QUALITY(8, 1, 2, false), EXTREME_QUALITY(8, 2, 3, false);

	private final int numFolds;
	private final int numRepetitions;
	private final int numStackLayers;
	private final boolean refitFull;

	Preset(final int numFolds, final int numRepetitions, final int numStackLayers, final boolean refitFull) {
		this.numFolds = numFolds;
		this.numRepetitions = numRepetitions;
		this.numStackLayers = numStackLayers;
		this.refitFull = refitFull;
	}

	public int getNumFolds() {
		return this.numFolds;
	}

	public int getNumRepetitions() {
		return this.numRepetitions;
	}

	public int getNumStackLayers() {
		return this.numStackLayers;
	}

	public boolean isRefitFull() {
		return this.refitFull;
	}

	public boolean isAtLeast(final Preset other) {
		return this.compareTo(other) >= 0;
	}

	/**
	 * Accepts both enum names and short ids like "best" or "best_quality".
	 */
	public static Preset fromId(final String id) {
		String normalized = id.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		if (!normalized.endsWith("_QUALITY")) {
			normalized = normalized + "_QUALITY";
		}
		return Preset.valueOf(normalized);
	}
}
