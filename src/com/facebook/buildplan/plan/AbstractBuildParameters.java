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

package com.facebook.buildplan.plan;

import com.facebook.buildplan.util.immutables.PlanStyleTuple;
import com.google.common.base.Preconditions;
import java.util.Locale;
import org.immutables.value.Value;

/** Platform triple and configuration that one half of the build (host or target) compiles with. */
@Value.Immutable(builder = false)
@PlanStyleTuple
abstract class AbstractBuildParameters {

  public abstract String getTriple();

  public abstract BuildConfiguration getConfiguration();

  @Value.Check
  protected void check() {
    Preconditions.checkArgument(!getTriple().trim().isEmpty(), "Triple must not be empty");
  }

  /** Directory, relative to the scratch root, that artifacts built with these parameters use. */
  public String getBuildDirectoryName() {
    return getTriple() + "/" + getConfiguration().name().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return getBuildDirectoryName();
  }
}
