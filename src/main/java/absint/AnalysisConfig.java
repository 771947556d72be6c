package absint;

/**
 * Analysis configuration.
 */
public final class AnalysisConfig {
	/** The log level name (see Log.Level). */
	public static final String LOG_LEVEL = stringEnv("ABSINT_LOG_LEVEL", "INFO");

	/** Name of the default merge policy. */
	public static final String MERGE_POLICY = stringEnv("ABSINT_MERGE_POLICY", "equal-env");
	/** Traces longer than this are always merged by the default policy. */
	public static final int MAX_TRACE = intEnv("ABSINT_MAX_TRACE", 64);

	/** Where checkers write DOT files when no explicit path is given. */
	public static final String DOT_DIR = stringEnv("ABSINT_DOT_DIR", ".");

	/** Whether to dump every fixpoint iteration at trace level. */
	public static final boolean TRACE_FIXPOINT = checkEnv("ABSINT_TRACE_FIXPOINT");

	private AnalysisConfig() {
	}

	/**
	 * Check if a setting has been enabled through an environment variable.
	 */
	private static boolean checkEnv(String var) {
		String value = System.getenv(var);
		return value != null && !value.isEmpty();
	}

	/**
	 * Get a string value from the environment.
	 */
	private static String stringEnv(String var, String def) {
		String value = System.getenv(var);
		if (value != null && !value.isEmpty()) {
			return value;
		} else {
			return def;
		}
	}

	/**
	 * Get an integer value from the environment.
	 */
	private static int intEnv(String var, int def) {
		String value = System.getenv(var);
		if (value != null && !value.isEmpty()) {
			return Integer.parseInt(value);
		} else {
			return def;
		}
	}
}
