package absint;

/**
 * Thrown when the model, typer or CFG builder supplied by the caller cannot
 * handle the analysed program.
 *
 * These errors abort the analysis of the program: an incomplete setup must
 * never degrade into an imprecise result.
 */
public class ConfigurationException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public ConfigurationException(String format, Object... args) {
		super(String.format(format, args));
	}

	public ConfigurationException(Throwable cause, String format, Object... args) {
		super(String.format(format, args), cause);
	}
}
