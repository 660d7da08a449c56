package autostack;

/**
 * Raised at fit entry, before any resource is allocated, when the request cannot be served at all.
 */
public class FitConfigurationException extends AutoStackException {

	private static final long serialVersionUID = 5820471635208114947L;

	public FitConfigurationException(final String message) {
		super(message);
	}
}
