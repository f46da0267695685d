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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.stream.Collectors;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class LoggerTest {

  private static final String NAME = "com.facebook.buildplan.log.LoggerTest";

  private final List<LogRecord> records = new ArrayList<>();
  private final Handler handler =
      new Handler() {
        @Override
        public void publish(LogRecord record) {
          records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };

  private java.util.logging.Logger delegate;

  @Before
  public void setUp() {
    delegate = java.util.logging.Logger.getLogger(NAME);
    delegate.setUseParentHandlers(false);
    delegate.addHandler(handler);
    delegate.setLevel(Level.INFO);
  }

  @After
  public void tearDown() {
    delegate.removeHandler(handler);
    delegate.setUseParentHandlers(true);
    delegate.setLevel(null);
  }

  @Test
  public void formatsArgumentsAndMapsLevels() {
    Logger logger = Logger.get(NAME);

    logger.info("Planned %d modules for %s.", 3, "aarch64");
    logger.warn("Alias %s unused.", "Loging");
    logger.error(new IllegalStateException("boom"), "Planning aborted.");

    assertThat(records.size(), equalTo(3));
    assertThat(records.get(0).getMessage(), equalTo("Planned 3 modules for aarch64."));
    assertThat(records.get(0).getLevel(), equalTo(Level.INFO));
    assertThat(records.get(1).getLevel(), equalTo(Level.WARNING));
    assertThat(records.get(2).getLevel(), equalTo(Level.SEVERE));
    assertThat(records.get(2).getThrown().getMessage(), equalTo("boom"));
    assertThat(records.get(2).getLoggerName(), equalTo(NAME));
    assertThat(records.get(2).getSourceClassName(), equalTo(NAME));
  }

  @Test
  public void messagesBelowTheLevelAreDropped() {
    Logger logger = Logger.get(NAME);

    logger.debug("Not shown %s", "at info");
    logger.verbose("Not shown either");
    logger.info("Shown");

    assertFalse(logger.isDebugEnabled());
    assertThat(
        records.stream().map(LogRecord::getMessage).collect(Collectors.toList()),
        contains("Shown"));

    delegate.setLevel(Level.FINER);
    assertTrue(logger.isVerboseEnabled());
  }

  @Test
  public void consoleLoggingUsesLogFormatter() {
    Handler console = Logger.setUpConsoleLogging(Level.WARNING);
    java.util.logging.Logger root = java.util.logging.Logger.getLogger("com.facebook.buildplan");
    try {
      assertTrue(console.getFormatter() instanceof LogFormatter);
      assertThat(console.getLevel(), equalTo(Level.WARNING));
      assertThat(root.getLevel(), equalTo(Level.WARNING));
    } finally {
      root.removeHandler(console);
      root.setLevel(null);
    }
  }

  @Test
  public void messageWithoutArgumentsIsNotFormatted() {
    Logger.get(NAME).info("100% planned");

    assertThat(records.get(0).getMessage(), equalTo("100% planned"));
  }
}
