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

package com.facebook.buildplan.config;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.facebook.buildplan.util.HumanReadableException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

public class ConfigTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private enum Color {
    RED,
    GREEN,
  }

  @Test
  public void readsSectionsFromIni() throws IOException {
    Config config =
        Config.createFromReader(
            new StringReader("[alias]\n  value = spaced \n  empty =\n[other]\n  x = 1\n"));

    assertThat(config.getSectionToEntries().keySet().size(), equalTo(2));
    assertThat(config.getValue("alias", "value"), equalTo(Optional.of("spaced")));
    assertThat(config.getValue("other", "x"), equalTo(Optional.of("1")));
    assertThat(config.getValue("alias", "empty"), equalTo(Optional.empty()));
    assertThat(config.getValue("missing", "x"), equalTo(Optional.empty()));
    assertThat(config.get("missing"), equalTo(ImmutableMap.of()));
  }

  @Test
  public void laterFilesAndOverridesWin() throws IOException {
    Path first = temporaryFolder.newFile("first.ini").toPath();
    Files.write(first, "[aliasing]\n  a = first\n  b = first\n".getBytes(StandardCharsets.UTF_8));
    Path second = temporaryFolder.newFile("second.ini").toPath();
    Files.write(
        second, "[aliasing]\n  b = second\n  c = second\n".getBytes(StandardCharsets.UTF_8));

    Config config =
        Config.createFromFiles(
            ImmutableList.of(first, second),
            ImmutableMap.of("aliasing", ImmutableMap.of("c", "override")));

    assertThat(config.getValue("aliasing", "a"), equalTo(Optional.of("first")));
    assertThat(config.getValue("aliasing", "b"), equalTo(Optional.of("second")));
    assertThat(config.getValue("aliasing", "c"), equalTo(Optional.of("override")));
  }

  @Test
  public void booleanValuesAcceptYesNoTrueFalse() {
    Config config =
        new Config(
            ImmutableMap.of("flags", ImmutableMap.of("a", "YES", "b", "false", "c", "True")));

    assertTrue(config.getBooleanValue("flags", "a", false));
    assertFalse(config.getBooleanValue("flags", "b", true));
    assertTrue(config.getBooleanValue("flags", "c", false));
    assertTrue(config.getBooleanValue("flags", "missing", true));
  }

  @Test
  public void invalidBooleanIsReported() {
    Config config = new Config(ImmutableMap.of("flags", ImmutableMap.of("a", "maybe")));

    thrown.expect(HumanReadableException.class);
    thrown.expectMessage("should be yes/no true/false");
    config.getBooleanValue("flags", "a", false);
  }

  @Test
  public void enumValuesAreCaseInsensitive() {
    Config config = new Config(ImmutableMap.of("colors", ImmutableMap.of("pick", "green")));

    assertThat(config.getEnum("colors", "pick", Color.class), equalTo(Optional.of(Color.GREEN)));
    assertThat(config.getEnum("colors", "none", Color.class), equalTo(Optional.empty()));
  }

  @Test
  public void configsWithSameEntriesAreEqual() {
    Config first = new Config(ImmutableMap.of("a", ImmutableMap.of("b", "c")));
    Config second = new Config(ImmutableMap.of("a", ImmutableMap.of("b", "c")));

    assertThat(first, equalTo(second));
    assertThat(first.hashCode(), equalTo(second.hashCode()));
  }
}
