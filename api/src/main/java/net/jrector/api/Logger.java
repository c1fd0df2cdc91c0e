package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.io.PrintStream;
import java.util.Locale;

public class Logger {
    public static final Logger NONE = new Logger(null, null);

    @Nullable
    private final PrintStream debugOut;
    @Nullable
    private final PrintStream errorOut;

    public Logger(@Nullable PrintStream debugOut, @Nullable PrintStream errorOut) {
        this.debugOut = debugOut;
        this.errorOut = errorOut;
    }

    public void error(String message, Object... args) {
        if (errorOut != null) {
            errorOut.printf(Locale.ROOT, message + "\n", args);
        }
    }

    /**
     * Warnings go to the error stream, prefixed so they can be told apart from errors.
     */
    public void warn(String message, Object... args) {
        if (errorOut != null) {
            errorOut.printf(Locale.ROOT, "WARNING: " + message + "\n", args);
        }
    }

    public void debug(String message, Object... args) {
        if (debugOut != null) {
            debugOut.printf(Locale.ROOT, message + "\n", args);
        }
    }

    public boolean isDebugEnabled() {
        return debugOut != null;
    }
}
