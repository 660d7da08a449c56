package autostack.family;

import autostack.AutoStackException;

/**
 * Failure of a single model family on a single candidate; never fatal for a fit.
 */
public class ModelFitException extends AutoStackException {

	private static final long serialVersionUID = -4469128021447351090L;

	public ModelFitException(final String message) {
		super(message);
	}

	public ModelFitException(final String message, final Throwable cause) {
		super(message, cause);
	}
}
