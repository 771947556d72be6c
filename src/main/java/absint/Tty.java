package absint;

import java.io.PrintStream;
import java.util.Map;

/**
 * Utilities for TTY formatting.
 */
public final class Tty {
	/** Whether standard output is a TTY. */
	public static final boolean IS_A_TTY = System.console() != null;

	private static final Map<String, String> STYLES = Map.ofEntries(
		Map.entry("<b>", "\033[1m"),
		Map.entry("</b>", "\033[22m"),

		Map.entry("<i>", "\033[3m"),
		Map.entry("</i>", "\033[23m"),

		Map.entry("<fg=red>", "\033[31m"),
		Map.entry("<fg=green>", "\033[32m"),
		Map.entry("<fg=yellow>", "\033[33m"),
		Map.entry("<fg=blue>", "\033[34m"),
		Map.entry("<fg=cyan>", "\033[36m"),
		Map.entry("<fg=gray>", "\033[90m"),
		Map.entry("</fg>", "\033[39m")
	);

	private Tty() {
	}

	/**
	 * @return The format string with style tags replaced (or removed, when not a TTY).
	 */
	public static String style(String format, boolean colors) {
		for (var entry : STYLES.entrySet()) {
			format = format.replace(entry.getKey(), colors ? entry.getValue() : "");
		}
		return format;
	}

	/**
	 * Print a styled, formatted string to the given stream.
	 */
	public static void print(PrintStream out, String format, Object... args) {
		out.format(style(format, IS_A_TTY), args);
	}

	/**
	 * Print a styled, formatted string to standard error.
	 */
	public static void print(String format, Object... args) {
		print(System.err, format, args);
	}
}
