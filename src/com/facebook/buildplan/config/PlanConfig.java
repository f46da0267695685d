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

import com.facebook.buildplan.model.ToolsVersion;
import com.facebook.buildplan.plan.BuildConfiguration;
import com.facebook.buildplan.plan.BuildParameters;
import java.util.Optional;

/** Typed view of the planner's options, read from a {@link Config}. */
public class PlanConfig {

  public static final String ALIASING_SECTION = "aliasing";
  public static final String DESTINATIONS_SECTION = "destinations";
  public static final String BUILD_SECTION = "build";

  /** Packages older than this do not take part in module aliasing. */
  public static final ToolsVersion DEFAULT_MINIMUM_TOOLS_VERSION = ToolsVersion.of(5, 2);

  public static final String DEFAULT_HOST_QUALIFIER = "-tool";

  private final Config config;

  public PlanConfig(Config config) {
    this.config = config;
  }

  public static PlanConfig createDefault() {
    return new PlanConfig(new Config());
  }

  public ToolsVersion getMinimumToolsVersionForAliasing() {
    return config
        .getValue(ALIASING_SECTION, "minimum_tools_version")
        .map(ToolsVersion::parse)
        .orElse(DEFAULT_MINIMUM_TOOLS_VERSION);
  }

  public boolean shouldWarnOnUnappliedAliases() {
    return config.getBooleanValue(ALIASING_SECTION, "warn_on_unapplied_aliases", true);
  }

  /** Appended to artifact names of host variants that also exist for the target. */
  public String getHostQualifier() {
    return config.getValue(DESTINATIONS_SECTION, "host_qualifier").orElse(DEFAULT_HOST_QUALIFIER);
  }

  public BuildConfiguration getBuildConfiguration() {
    return config
        .getEnum(BUILD_SECTION, "configuration", BuildConfiguration.class)
        .orElse(BuildConfiguration.DEBUG);
  }

  public BuildParameters getTargetBuildParameters() {
    return BuildParameters.of(
        config.getRequiredValue(BUILD_SECTION, "target_triple"), getBuildConfiguration());
  }

  /** Host parameters; without an explicit host triple the build is not cross-compiling. */
  public BuildParameters getHostBuildParameters() {
    Optional<String> hostTriple = config.getValue(BUILD_SECTION, "host_triple");
    if (!hostTriple.isPresent()) {
      return getTargetBuildParameters();
    }
    return BuildParameters.of(hostTriple.get(), getBuildConfiguration());
  }
}
