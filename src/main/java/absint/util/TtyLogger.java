package absint.util;

import absint.Tty;
import absint.util.Log.Level;

import com.google.common.base.Throwables;

/**
 * Logging backend with colors.
 */
final class TtyLogger {
	static final TtyLogger INSTANCE = new TtyLogger();

	private TtyLogger() {
	}

	private static String color(Level level) {
		switch (level) {
		case INFO:
			return "cyan";
		case WARN:
			return "yellow";
		case ERROR:
			return "red";
		default:
			return "gray";
		}
	}

	private void header(Level level, String tag, String line) {
		var fg = color(level);
		if (level.compareTo(Level.WARN) >= 0) {
			Tty.print("<fg=" + fg + "><b>%-5s</b> <i>%-20s</i> <b>%s</b></fg>\n", level, tag, line);
		} else {
			Tty.print("<fg=" + fg + "><b>%-5s</b> <i>%-20s</i></fg> %s\n", level, tag, line);
		}
	}

	private void trailer(Level level, String line) {
		Tty.print("<fg=" + color(level) + ">%s</fg>\n", line);
	}

	/**
	 * Print a log record.  The caller is responsible for level filtering.
	 */
	void log(Level level, Object src, Object msg, Throwable e) {
		// Avoid interleaved lines
		synchronized (this) {
			String tag;
			if (src instanceof String s) {
				tag = s;
			} else if (src instanceof Class<?> c) {
				tag = c.getSimpleName();
			} else {
				tag = src.getClass().getSimpleName();
			}

			var str = String.valueOf(msg);
			if (str.contains("\n")) {
				header(level, tag, "");
				str.lines()
					.forEach(line -> trailer(level, line));
			} else {
				header(level, tag, str);
			}

			if (e != null) {
				Throwables.getStackTraceAsString(e)
					.lines()
					.forEach(line -> trailer(level, line));
			}
		}
	}
}
