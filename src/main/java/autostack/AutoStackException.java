package autostack;

public class AutoStackException extends Exception {

	private static final long serialVersionUID = -3418262015749361023L;

	public AutoStackException(final String message) {
		super(message);
	}

	public AutoStackException(final String message, final Throwable cause) {
		super(message, cause);
	}
}
