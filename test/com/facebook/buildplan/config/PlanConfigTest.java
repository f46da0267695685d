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

import com.facebook.buildplan.model.ToolsVersion;
import com.facebook.buildplan.plan.BuildConfiguration;
import com.facebook.buildplan.plan.BuildParameters;
import com.facebook.buildplan.util.HumanReadableException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class PlanConfigTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  @Test
  public void defaultsApplyWithoutConfiguration() {
    PlanConfig config = PlanConfig.createDefault();

    assertThat(config.getMinimumToolsVersionForAliasing(), equalTo(ToolsVersion.of(5, 2)));
    assertTrue(config.shouldWarnOnUnappliedAliases());
    assertThat(config.getHostQualifier(), equalTo("-tool"));
    assertThat(config.getBuildConfiguration(), equalTo(BuildConfiguration.DEBUG));
  }

  @Test
  public void readsEverySettingFromIniFile() throws IOException {
    PlanConfig config = new PlanConfig(loadResource("planner.ini"));

    assertThat(config.getMinimumToolsVersionForAliasing(), equalTo(ToolsVersion.of(5, 4)));
    assertFalse(config.shouldWarnOnUnappliedAliases());
    assertThat(config.getHostQualifier(), equalTo("-host"));
    assertThat(
        config.getTargetBuildParameters(),
        equalTo(BuildParameters.of("arm64-apple-ios", BuildConfiguration.RELEASE)));
    assertThat(
        config.getHostBuildParameters(),
        equalTo(BuildParameters.of("arm64-apple-macosx", BuildConfiguration.RELEASE)));
  }

  @Test
  public void hostDefaultsToTargetTriple() {
    PlanConfig config =
        new PlanConfig(
            new Config(
                ImmutableList.of(
                    ImmutableMap.of(
                        "build", ImmutableMap.of("target_triple", "x86_64-unknown-linux-gnu")))));

    assertThat(config.getHostBuildParameters(), equalTo(config.getTargetBuildParameters()));
    assertThat(
        config.getHostBuildParameters().getBuildDirectoryName(),
        equalTo("x86_64-unknown-linux-gnu/debug"));
  }

  @Test
  public void targetTripleIsRequiredForBuildParameters() {
    thrown.expect(HumanReadableException.class);
    thrown.expectMessage("target_triple in [build]");
    PlanConfig.createDefault().getTargetBuildParameters();
  }

  @Test
  public void unknownConfigurationIsReported() {
    PlanConfig config =
        new PlanConfig(
            new Config(
                ImmutableList.of(
                    ImmutableMap.of("build", ImmutableMap.of("configuration", "profile")))));

    thrown.expect(HumanReadableException.class);
    thrown.expectMessage("should be one of [DEBUG, RELEASE], not 'profile'");
    config.getBuildConfiguration();
  }

  @Test
  public void malformedToolsVersionIsReported() {
    PlanConfig config =
        new PlanConfig(
            new Config(
                ImmutableList.of(
                    ImmutableMap.of(
                        "aliasing", ImmutableMap.of("minimum_tools_version", "five")))));

    thrown.expect(HumanReadableException.class);
    thrown.expectMessage("Invalid tools version 'five'");
    config.getMinimumToolsVersionForAliasing();
  }

  private Config loadResource(String name) throws IOException {
    try (InputStream stream = getClass().getResourceAsStream(name);
        Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      return Config.createFromReader(reader);
    }
  }
}
