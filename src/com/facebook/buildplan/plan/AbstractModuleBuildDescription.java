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

import com.facebook.buildplan.alias.AliasMap;
import com.facebook.buildplan.model.ModuleId;
import com.facebook.buildplan.model.ModuleKind;
import com.facebook.buildplan.model.PackageIdentity;
import com.facebook.buildplan.util.immutables.PlanStyleImmutable;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Everything the command emitter needs to compile one module at one destination: the name the
 * module is compiled under, the alias map handed to the compiler and the parameters of the
 * destination's platform.
 */
@Value.Immutable
@PlanStyleImmutable
abstract class AbstractModuleBuildDescription {

  public abstract BuildIdentity getIdentity();

  public abstract ModuleKind getKind();

  /** The name the module is compiled under, after aliasing. */
  public abstract String getFinalName();

  /** Absent when neither the module nor any of its direct dependencies is renamed. */
  public abstract Optional<AliasMap> getAliasMap();

  public abstract BuildParameters getBuildParameters();

  /** Base name of the module's build artifacts, qualified for host variants when needed. */
  public abstract String getArtifactName();

  public ModuleId getModuleId() {
    return getIdentity().getModule();
  }

  public PackageIdentity getPackageIdentity() {
    return getModuleId().getPackageIdentity();
  }

  public String getOriginalName() {
    return getModuleId().getName();
  }

  public Destination getDestination() {
    return getIdentity().getDestination();
  }

  public boolean isAliased() {
    return !getFinalName().equals(getOriginalName());
  }

  /** Unique among the module descriptions of a plan. */
  public String getArtifactKey() {
    return getBuildParameters().getBuildDirectoryName() + "/" + getArtifactName();
  }

  @Override
  public String toString() {
    return getIdentity() + " as " + getArtifactKey();
  }
}
