package com.reclink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives progress messages while a cache is built. Purely informational.
 */
@FunctionalInterface
public interface StatusListener {

  void emit(String message);

  /** Forwards messages to the SLF4J logger of the given class at INFO level. */
  static StatusListener logTo(Class<?> clazz) {
    Logger log = LoggerFactory.getLogger(clazz);
    return log::info;
  }

  static StatusListener silent() {
    return message -> {};
  }
}
