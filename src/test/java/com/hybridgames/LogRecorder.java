package com.hybridgames;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/** Collects the records of one logger while open. */
public final class LogRecorder extends Handler implements AutoCloseable {
  private final Logger logger;
  private final List<LogRecord> records = new ArrayList<>();

  private LogRecorder(Logger logger) {
    this.logger = logger;
    setLevel(Level.ALL);
    logger.addHandler(this);
  }

  public static LogRecorder attach(Class<?> owner) {
    return new LogRecorder(Logger.getLogger(owner.getName()));
  }

  @Override
  public synchronized void publish(LogRecord logRecord) {
    records.add(logRecord);
  }

  @Override
  public void flush() {
  }

  @Override
  public void close() {
    logger.removeHandler(this);
  }

  public synchronized List<String> messages(Level level) {
    return records.stream()
        .filter(logRecord -> logRecord.getLevel().equals(level))
        .map(LogRecord::getMessage)
        .toList();
  }

  public boolean contains(Level level, String fragment) {
    return messages(level).stream().anyMatch(message -> message.contains(fragment));
  }
}
