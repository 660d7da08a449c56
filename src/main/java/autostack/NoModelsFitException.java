package autostack;

import autostack.stacking.FailureReport;

/**
 * Raised when not a single candidate could be fit in any layer.
 */
public class NoModelsFitException extends AutoStackException {

	private static final long serialVersionUID = -1209388012733530121L;

	private final transient FailureReport report;

	public NoModelsFitException(final FailureReport report) {
		super("No model could be fit.\n" + report.describe());
		this.report = report;
	}

	public FailureReport getReport() {
		return this.report;
	}
}
