package com.storysentinel.service.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Collects records logged to one logger while attached. Use with try-with-resources.
 */
public final class LogCapture extends Handler implements AutoCloseable {
    private final Logger logger;
    private final Level previousLevel;
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();

    private LogCapture(Logger logger) {
        this.logger = logger;
        this.previousLevel = logger.getLevel();
        setLevel(Level.ALL);
        logger.setLevel(Level.ALL);
        logger.addHandler(this);
    }

    public static LogCapture attach(Class<?> owner) {
        return new LogCapture(Logger.getLogger(owner.getName()));
    }

    public List<LogRecord> records() {
        return List.copyOf(records);
    }

    public boolean contains(Level level, String message) {
        return records.stream().anyMatch(r -> r.getLevel().equals(level) && message.equals(r.getMessage()));
    }

    public boolean containsFragment(Level level, String fragment) {
        return records.stream().anyMatch(r -> r.getLevel().equals(level)
                && r.getMessage() != null && r.getMessage().contains(fragment));
    }

    @Override
    public void publish(LogRecord record) {
        records.add(record);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
        logger.removeHandler(this);
        logger.setLevel(previousLevel);
    }
}
