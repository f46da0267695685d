/*
 * Copyright 2018-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.facebook.buildplan.log;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import javax.annotation.Nullable;

/**
 * Wrapper around {@link java.util.logging.Logger} which takes {@link String#format} patterns and
 * only formats them when the level is enabled.
 *
 * <p>Levels map as follows: {@code verbose} is FINER, {@code debug} is FINE, {@code info} is INFO,
 * {@code warn} is WARNING and {@code error} is SEVERE.
 */
public class Logger {

  private final java.util.logging.Logger delegate;

  private Logger(java.util.logging.Logger delegate) {
    this.delegate = delegate;
  }

  public static Logger get(Class<?> cls) {
    return get(cls.getName());
  }

  public static Logger get(String name) {
    return new Logger(java.util.logging.Logger.getLogger(name));
  }

  /**
   * Sends records of at least {@code level} under the {@code com.facebook.buildplan} namespace to
   * stderr, formatted with {@link LogFormatter}.
   */
  public static Handler setUpConsoleLogging(Level level) {
    java.util.logging.Logger root = java.util.logging.Logger.getLogger("com.facebook.buildplan");
    ConsoleHandler handler = new ConsoleHandler();
    handler.setFormatter(new LogFormatter());
    handler.setLevel(level);
    root.addHandler(handler);
    root.setLevel(level);
    return handler;
  }

  public String getName() {
    return delegate.getName();
  }

  public boolean isVerboseEnabled() {
    return delegate.isLoggable(Level.FINER);
  }

  public boolean isDebugEnabled() {
    return delegate.isLoggable(Level.FINE);
  }

  public void verbose(String format, Object... args) {
    log(Level.FINER, null, format, args);
  }

  public void verbose(Throwable t, String format, Object... args) {
    log(Level.FINER, t, format, args);
  }

  public void debug(String format, Object... args) {
    log(Level.FINE, null, format, args);
  }

  public void debug(Throwable t, String format, Object... args) {
    log(Level.FINE, t, format, args);
  }

  public void info(String format, Object... args) {
    log(Level.INFO, null, format, args);
  }

  public void info(Throwable t, String format, Object... args) {
    log(Level.INFO, t, format, args);
  }

  public void warn(String format, Object... args) {
    log(Level.WARNING, null, format, args);
  }

  public void warn(Throwable t, String format, Object... args) {
    log(Level.WARNING, t, format, args);
  }

  public void error(String format, Object... args) {
    log(Level.SEVERE, null, format, args);
  }

  public void error(Throwable t, String format, Object... args) {
    log(Level.SEVERE, t, format, args);
  }

  private void log(Level level, @Nullable Throwable t, String format, Object... args) {
    if (!delegate.isLoggable(level)) {
      return;
    }
    String message = args.length == 0 ? format : String.format(format, args);
    LogRecord record = new LogRecord(level, message);
    record.setLoggerName(delegate.getName());
    record.setSourceClassName(delegate.getName());
    record.setThrown(t);
    delegate.log(record);
  }
}
