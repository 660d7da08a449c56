package autostack.portfolio;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Ranked candidates for one fit together with the preset that actually determined them and the notes explaining what was left out.
 */
public class PortfolioSelection {

	private final Preset requestedPreset;
	private final Preset candidatePreset;
	private final ImmutableList<CandidateConfig> candidates;
	private final ImmutableList<String> notes;

	public PortfolioSelection(final Preset requestedPreset, final Preset candidatePreset, final List<CandidateConfig> candidates, final List<String> notes) {
		super();
		this.requestedPreset = requestedPreset;
		this.candidatePreset = candidatePreset;
		this.candidates = ImmutableList.copyOf(candidates);
		this.notes = ImmutableList.copyOf(notes);
	}

	public Preset getRequestedPreset() {
		return this.requestedPreset;
	}

	/**
	 * @return the preset whose candidate set was used; differs from the requested one if the requested preset was gated off
	 */
	public Preset getCandidatePreset() {
		return this.candidatePreset;
	}

	public ImmutableList<CandidateConfig> getCandidates() {
		return this.candidates;
	}

	public ImmutableList<String> getNotes() {
		return this.notes;
	}

	public boolean isEmpty() {
		return this.candidates.isEmpty();
	}

	@Override
	public String toString() {
		return "PortfolioSelection [requestedPreset=" + this.requestedPreset + ", candidatePreset=" + this.candidatePreset + ", candidates=" + this.candidates.size() + ", notes=" + this.notes + "]";
	}
}
