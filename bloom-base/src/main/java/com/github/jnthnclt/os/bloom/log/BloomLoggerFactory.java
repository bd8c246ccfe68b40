package com.github.jnthnclt.os.bloom.log;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

public class BloomLoggerFactory {

    public interface BloomLoggerProvider {
        BloomLogger createLogger(String name);
    }

    public static final ConcurrentHashMap<String, BloomLogger> loggers = new ConcurrentHashMap<>();
    public static final AtomicReference<BloomLoggerProvider> BLOOM_LOGGER_PROVIDER = new AtomicReference<>(
        name -> new SysoutBloomLogger(name, SysoutBloomLoggerLevel.INFO));

    public static BloomLogger getLogger() {
        StackTraceElement[] elements = Thread.currentThread().getStackTrace();
        String name = elements[2].getClassName();
        return loggers.computeIfAbsent(name, s -> BLOOM_LOGGER_PROVIDER.get().createLogger(name));
    }

    public enum SysoutBloomLoggerLevel {
        ERROR, WARN, INFO, DEBUG
    }

    public static class SysoutBloomLogger implements BloomLogger {

        private final String name;
        private final SysoutBloomLoggerLevel level;
        private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

        public SysoutBloomLogger(String name, SysoutBloomLoggerLevel level) {
            this.name = name;
            this.level = level;
        }

        private boolean enabled(SysoutBloomLoggerLevel at) {
            return level.ordinal() >= at.ordinal();
        }

        private void log(SysoutBloomLoggerLevel at, String messagePattern, Object[] args, Throwable t) {
            if (enabled(at)) {
                System.out.println(at + ": " + Thread.currentThread().getName() + " " + name + " " + MessageFormatter.format(messagePattern, args));
                if (t != null) {
                    t.printStackTrace(System.out);
                }
            }
        }

        public long counter(String counterName) {
            AtomicLong got = counters.get(counterName);
            return got == null ? 0 : got.get();
        }

        @Override
        public boolean isDebugEnabled() {
            return enabled(SysoutBloomLoggerLevel.DEBUG);
        }

        @Override
        public void debug(String msg) {
            log(SysoutBloomLoggerLevel.DEBUG, msg, null, null);
        }

        @Override
        public void debug(String messagePattern, Object arg) {
            log(SysoutBloomLoggerLevel.DEBUG, messagePattern, new Object[] { arg }, null);
        }

        @Override
        public void debug(String messagePattern, Object arg1, Object arg2) {
            log(SysoutBloomLoggerLevel.DEBUG, messagePattern, new Object[] { arg1, arg2 }, null);
        }

        @Override
        public void debug(String messagePattern, Object... argArray) {
            log(SysoutBloomLoggerLevel.DEBUG, messagePattern, argArray, null);
        }

        @Override
        public void debug(String msg, Throwable t) {
            log(SysoutBloomLoggerLevel.DEBUG, msg, null, t);
        }

        @Override
        public void warn(String msg) {
            log(SysoutBloomLoggerLevel.WARN, msg, null, null);
        }

        @Override
        public void warn(String messagePattern, Object arg) {
            log(SysoutBloomLoggerLevel.WARN, messagePattern, new Object[] { arg }, null);
        }

        @Override
        public void warn(String messagePattern, Object arg1, Object arg2) {
            log(SysoutBloomLoggerLevel.WARN, messagePattern, new Object[] { arg1, arg2 }, null);
        }

        @Override
        public void warn(String messagePattern, Object... argArray) {
            log(SysoutBloomLoggerLevel.WARN, messagePattern, argArray, null);
        }

        @Override
        public void warn(String msg, Throwable t) {
            log(SysoutBloomLoggerLevel.WARN, msg, null, t);
        }

        @Override
        public void info(String msg) {
            log(SysoutBloomLoggerLevel.INFO, msg, null, null);
        }

        @Override
        public void info(String messagePattern, Object arg) {
            log(SysoutBloomLoggerLevel.INFO, messagePattern, new Object[] { arg }, null);
        }

        @Override
        public void info(String messagePattern, Object arg1, Object arg2) {
            log(SysoutBloomLoggerLevel.INFO, messagePattern, new Object[] { arg1, arg2 }, null);
        }

        @Override
        public void info(String messagePattern, Object... argArray) {
            log(SysoutBloomLoggerLevel.INFO, messagePattern, argArray, null);
        }

        @Override
        public void info(String msg, Throwable t) {
            log(SysoutBloomLoggerLevel.INFO, msg, null, t);
        }

        @Override
        public void error(String msg) {
            log(SysoutBloomLoggerLevel.ERROR, msg, null, null);
        }

        @Override
        public void error(String messagePattern, Object arg) {
            log(SysoutBloomLoggerLevel.ERROR, messagePattern, new Object[] { arg }, null);
        }

        @Override
        public void error(String messagePattern, Object arg1, Object arg2) {
            log(SysoutBloomLoggerLevel.ERROR, messagePattern, new Object[] { arg1, arg2 }, null);
        }

        @Override
        public void error(String messagePattern, Object... argArray) {
            log(SysoutBloomLoggerLevel.ERROR, messagePattern, argArray, null);
        }

        @Override
        public void error(String msg, Throwable t) {
            log(SysoutBloomLoggerLevel.ERROR, msg, null, t);
        }

        @Override
        public void inc(String counterName) {
            inc(counterName, 1);
        }

        @Override
        public void inc(String counterName, long amount) {
            counters.computeIfAbsent(counterName, k -> new AtomicLong()).addAndGet(amount);
        }

        @Override
        public void set(String counterName, long value) {
            counters.computeIfAbsent(counterName, k -> new AtomicLong()).set(value);
        }
    }
}
