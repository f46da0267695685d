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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Formats records as {@code [timestamp][level][tid:NN][logger] message}, followed by the stack
 * trace of the thrown exception, if any.
 */
public class LogFormatter extends java.util.logging.Formatter {

  private static final ImmutableMap<Level, String> LEVEL_TAGS =
      ImmutableMap.<Level, String>builder()
          .put(Level.SEVERE, "error")
          .put(Level.WARNING, "warn ")
          .put(Level.INFO, "info ")
          .put(Level.FINE, "debug")
          .put(Level.FINER, "vrbos")
          .build();

  private final DateTimeFormatter timestampFormat;

  public LogFormatter() {
    this(ZoneId.systemDefault());
  }

  @VisibleForTesting
  LogFormatter(ZoneId zone) {
    timestampFormat =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS", Locale.US).withZone(zone);
  }

  @Override
  public String format(LogRecord record) {
    StringBuilder line = new StringBuilder(255);
    line.append('[').append(timestampFormat.format(record.getInstant())).append(']');
    line.append('[').append(levelTag(record.getLevel())).append(']');
    line.append("[tid:").append(Strings.padStart(Long.toString(record.getLongThreadID()), 2, '0'));
    line.append("][").append(record.getLoggerName()).append("] ");
    line.append(formatMessage(record)).append('\n');
    if (record.getThrown() != null) {
      line.append(Throwables.getStackTraceAsString(record.getThrown())).append('\n');
    }
    return line.toString();
  }

  private static String levelTag(Level level) {
    String tag = LEVEL_TAGS.get(level);
    return tag != null ? tag : String.format("%-5d", level.intValue());
  }
}
