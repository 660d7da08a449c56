package autostack.family;

import java.io.Serializable;

import autostack.data.ProblemType;

/**
 * Trained state of one model. Only the family that produced an artifact can interpret it.
 */
public interface ModelArtifact extends Serializable {

	public ProblemType getProblemType();
}
