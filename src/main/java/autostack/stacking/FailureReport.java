package autostack.stacking;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * All candidate failures of a fit, in the order they were observed.
 */
public class FailureReport {

	private final ImmutableList<CandidateFailure> failures;
	private final ImmutableList<String> notes;

	public FailureReport(final List<CandidateFailure> failures, final List<String> notes) {
		super();
		this.failures = ImmutableList.copyOf(failures);
		this.notes = ImmutableList.copyOf(notes);
	}

	public ImmutableList<CandidateFailure> getFailures() {
		return this.failures;
	}

	public ImmutableList<String> getNotes() {
		return this.notes;
	}

	public boolean isEmpty() {
		return this.failures.isEmpty();
	}

	public String describe() {
		StringBuilder sb = new StringBuilder();
		sb.append(this.failures.size()).append(" candidate(s) failed:");
		for (CandidateFailure failure : this.failures) {
			sb.append("\n\t").append(failure);
		}
		for (String note : this.notes) {
			sb.append("\n\tNote: ").append(note);
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return this.describe();
	}
}
