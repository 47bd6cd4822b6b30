package com.github.jnthnclt.os.rowset.log;

import java.io.PrintStream;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

public class RowsetLoggerFactory {

    public interface RowsetLoggerProvider {
        RowsetLogger createLogger(String name);
    }

    public static final ConcurrentHashMap<String, RowsetLogger> loggers = new ConcurrentHashMap<>();
    public static final AtomicReference<RowsetLoggerProvider> ROWSET_LOGGER_PROVIDER = new AtomicReference<>(
        name -> new SysoutRowsetLogger(name, SysoutRowsetLoggerLevel.INFO, System.out));

    public static RowsetLogger getLogger() {
        StackTraceElement[] elements = Thread.currentThread().getStackTrace();
        String name = elements[2].getClassName();
        return loggers.computeIfAbsent(name, s -> ROWSET_LOGGER_PROVIDER.get().createLogger(name));
    }

    public enum SysoutRowsetLoggerLevel {
        ERROR, WARN, INFO, DEBUG
    }

    public static class SysoutRowsetLogger implements RowsetLogger {

        private final String name;
        private final SysoutRowsetLoggerLevel level;
        private final PrintStream out;

        public SysoutRowsetLogger(String name, SysoutRowsetLoggerLevel level, PrintStream out) {
            this.name = name;
            this.level = level;
            this.out = out;
        }

        private boolean enabled(SysoutRowsetLoggerLevel at) {
            return level.ordinal() >= at.ordinal();
        }

        private void log(SysoutRowsetLoggerLevel at, String msg, Throwable t) {
            if (enabled(at)) {
                out.println(at + ": " + Thread.currentThread().getName() + " " + name + " " + msg);
                if (t != null) {
                    t.printStackTrace(out);
                }
            }
        }

        private void logPattern(SysoutRowsetLoggerLevel at, String messagePattern, Object... args) {
            if (enabled(at)) {
                FormattingTuple tuple = MessageFormatter.arrayFormat(messagePattern, args);
                log(at, tuple.getMessage(), tuple.getThrowable());
            }
        }

        @Override
        public boolean isDebugEnabled() {
            return enabled(SysoutRowsetLoggerLevel.DEBUG);
        }

        @Override
        public void debug(String msg) {
            log(SysoutRowsetLoggerLevel.DEBUG, msg, null);
        }

        @Override
        public void debug(String messagePattern, Object arg) {
            logPattern(SysoutRowsetLoggerLevel.DEBUG, messagePattern, arg);
        }

        @Override
        public void debug(String messagePattern, Object arg1, Object arg2) {
            logPattern(SysoutRowsetLoggerLevel.DEBUG, messagePattern, arg1, arg2);
        }

        @Override
        public void debug(String messagePattern, Object... argArray) {
            logPattern(SysoutRowsetLoggerLevel.DEBUG, messagePattern, argArray);
        }

        @Override
        public void debug(String msg, Throwable t) {
            log(SysoutRowsetLoggerLevel.DEBUG, msg, t);
        }

        @Override
        public void warn(String msg) {
            log(SysoutRowsetLoggerLevel.WARN, msg, null);
        }

        @Override
        public void warn(String messagePattern, Object arg) {
            logPattern(SysoutRowsetLoggerLevel.WARN, messagePattern, arg);
        }

        @Override
        public void warn(String messagePattern, Object arg1, Object arg2) {
            logPattern(SysoutRowsetLoggerLevel.WARN, messagePattern, arg1, arg2);
        }

        @Override
        public void warn(String messagePattern, Object... argArray) {
            logPattern(SysoutRowsetLoggerLevel.WARN, messagePattern, argArray);
        }

        @Override
        public void warn(String msg, Throwable t) {
            log(SysoutRowsetLoggerLevel.WARN, msg, t);
        }

        @Override
        public void info(String msg) {
            log(SysoutRowsetLoggerLevel.INFO, msg, null);
        }

        @Override
        public void info(String messagePattern, Object arg) {
            logPattern(SysoutRowsetLoggerLevel.INFO, messagePattern, arg);
        }

        @Override
        public void info(String messagePattern, Object arg1, Object arg2) {
            logPattern(SysoutRowsetLoggerLevel.INFO, messagePattern, arg1, arg2);
        }

        @Override
        public void info(String messagePattern, Object... argArray) {
            logPattern(SysoutRowsetLoggerLevel.INFO, messagePattern, argArray);
        }

        @Override
        public void info(String msg, Throwable t) {
            log(SysoutRowsetLoggerLevel.INFO, msg, t);
        }

        @Override
        public void error(String msg) {
            log(SysoutRowsetLoggerLevel.ERROR, msg, null);
        }

        @Override
        public void error(String messagePattern, Object arg) {
            logPattern(SysoutRowsetLoggerLevel.ERROR, messagePattern, arg);
        }

        @Override
        public void error(String messagePattern, Object arg1, Object arg2) {
            logPattern(SysoutRowsetLoggerLevel.ERROR, messagePattern, arg1, arg2);
        }

        @Override
        public void error(String messagePattern, Object... argArray) {
            logPattern(SysoutRowsetLoggerLevel.ERROR, messagePattern, argArray);
        }

        @Override
        public void error(String msg, Throwable t) {
            log(SysoutRowsetLoggerLevel.ERROR, msg, t);
        }

        @Override
        public void inc(String name) {

        }

        @Override
        public void inc(String name, long amount) {

        }

        @Override
        public void set(String name, long value) {

        }
    }
}
