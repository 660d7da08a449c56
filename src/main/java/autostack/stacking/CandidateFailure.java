package autostack.stacking;

import java.util.Objects;

/**
 * Why a candidate did not make it into a layer.
 */
public class CandidateFailure {

	public enum Kind {
		/** training or scoring raised an error */
		FAILED,
		/** pretrained weights could not be provided */
		MISSING_WEIGHTS,
		/** the layer deadline plus grace period passed before the candidate finished */
		TIMEOUT,
		/** no family is registered for the candidate or it cannot handle the problem */
		UNSUPPORTED
	}

	private final String candidateName;
	private final int layer;
	private final Kind kind;
	private final String reason;
	private final Throwable cause;

	public CandidateFailure(final String candidateName, final int layer, final Kind kind, final String reason, final Throwable cause) {
		super();
		this.candidateName = Objects.requireNonNull(candidateName);
		this.layer = layer;
		this.kind = Objects.requireNonNull(kind);
		this.reason = reason;
		this.cause = cause;
	}

	public String getCandidateName() {
		return this.candidateName;
	}

	public int getLayer() {
		return this.layer;
	}

	public Kind getKind() {
		return this.kind;
	}

	public String getReason() {
		return this.reason;
	}

	public Throwable getCause() {
		return this.cause;
	}

	@Override
	public String toString() {
		return this.candidateName + " (layer " + (this.layer + 1) + "): " + this.kind + " - " + this.reason;
	}
}
