package absint.util;

import absint.AnalysisConfig;

import com.google.common.base.Throwables;

/**
 * Simple logging class with formatting support.
 */
public final class Log {
	/**
	 * Available log levels.
	 */
	public enum Level {
		TRACE,
		DEBUG,
		INFO,
		WARN,
		ERROR;

		/**
		 * @return Whether this log level is enabled.
		 */
		public boolean isEnabled() {
			return this.ordinal() >= LEVEL.ordinal();
		}
	}

	/** The current log level (from $ABSINT_LOG_LEVEL). */
	public static final Level LEVEL = parseLevel(AnalysisConfig.LOG_LEVEL);

	private static Level parseLevel(String level) {
		try {
			return Level.valueOf(level.toUpperCase());
		} catch (IllegalArgumentException e) {
			TtyLogger.INSTANCE.log(Level.ERROR, Log.class, "Unknown log level " + level, null);
			return Level.DEBUG;
		}
	}

	private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
	private static final TtyLogger LOGGER = TtyLogger.INSTANCE;

	private Log() {
	}

	private static String getMessage(Throwable e) {
		return Throwables.getRootCause(e).getMessage();
	}

	public static void trace(String format, Object... args) {
		if (Level.TRACE.isEnabled()) {
			LOGGER.log(Level.TRACE, WALKER.getCallerClass(), String.format(format, args), null);
		}
	}

	public static void trace(Throwable e) {
		if (Level.TRACE.isEnabled()) {
			LOGGER.log(Level.TRACE, WALKER.getCallerClass(), getMessage(e), e);
		}
	}

	public static void debug(String format, Object... args) {
		if (Level.DEBUG.isEnabled()) {
			LOGGER.log(Level.DEBUG, WALKER.getCallerClass(), String.format(format, args), null);
		}
	}

	public static void debug(Throwable e) {
		if (Level.DEBUG.isEnabled()) {
			LOGGER.log(Level.DEBUG, WALKER.getCallerClass(), getMessage(e), e);
		}
	}

	public static void info(String format, Object... args) {
		if (Level.INFO.isEnabled()) {
			LOGGER.log(Level.INFO, WALKER.getCallerClass(), String.format(format, args), null);
		}
	}

	public static void info(Throwable e) {
		if (Level.INFO.isEnabled()) {
			LOGGER.log(Level.INFO, WALKER.getCallerClass(), getMessage(e), e);
		}
	}

	public static void warn(String format, Object... args) {
		if (Level.WARN.isEnabled()) {
			LOGGER.log(Level.WARN, WALKER.getCallerClass(), String.format(format, args), null);
		}
	}

	public static void warn(Throwable e) {
		if (Level.WARN.isEnabled()) {
			LOGGER.log(Level.WARN, WALKER.getCallerClass(), getMessage(e), e);
		}
	}

	public static void error(String format, Object... args) {
		if (Level.ERROR.isEnabled()) {
			LOGGER.log(Level.ERROR, WALKER.getCallerClass(), String.format(format, args), null);
		}
	}

	public static void error(Throwable e) {
		if (Level.ERROR.isEnabled()) {
			LOGGER.log(Level.ERROR, WALKER.getCallerClass(), getMessage(e), e);
		}
	}
}
