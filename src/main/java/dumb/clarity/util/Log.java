package dumb.clarity.util;

import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;

public class Log {

    private static volatile BiConsumer<LogLevel, String> sink = (level, message) -> System.out.println("[" + level + "] " + message);

    private static volatile LogLevel threshold = LogLevel.INFO;

    public static void setSink(BiConsumer<LogLevel, String> sink) {
        Log.sink = requireNonNull(sink);
    }

    public static void setThreshold(LogLevel threshold) {
        Log.threshold = requireNonNull(threshold);
    }

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void debug(String message) {
        message(message, LogLevel.DEBUG);
    }

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void message(String message, LogLevel level) {
        if (level.ordinal() >= threshold.ordinal())
            sink.accept(level, message);
    }

    public enum LogLevel {
        DEBUG, INFO, WARNING, ERROR
    }
}
