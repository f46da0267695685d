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

package com.facebook.buildplan.model;

import com.facebook.buildplan.util.immutables.PlanStyleImmutable;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import org.immutables.value.Value;

@Value.Immutable
@PlanStyleImmutable
abstract class AbstractResolvedPackage {

  public abstract PackageIdentity getIdentity();

  @Value.Default
  public String getLocation() {
    return "/" + getIdentity();
  }

  /** Packages below the minimum aliasing tools version never have aliases applied to them. */
  @Value.Default
  public ToolsVersion getToolsVersion() {
    return ToolsVersion.CURRENT;
  }

  /** Whether the package is one of the packages the build was invoked on. */
  @Value.Default
  public boolean isRoot() {
    return false;
  }

  public abstract ImmutableList<ResolvedModule> getModules();

  public abstract ImmutableList<ResolvedProduct> getProducts();

  @Value.Check
  protected void check() {
    Set<String> moduleNames = new HashSet<>();
    for (ResolvedModule module : getModules()) {
      Preconditions.checkArgument(
          module.getPackageIdentity().equals(getIdentity()),
          "Module %s does not belong to package %s",
          module.getId(),
          getIdentity());
      Preconditions.checkArgument(
          moduleNames.add(module.getName()),
          "Duplicate module %s in package %s",
          module.getName(),
          getIdentity());
    }
    Set<String> productNames = new HashSet<>();
    for (ResolvedProduct product : getProducts()) {
      Preconditions.checkArgument(
          product.getPackageIdentity().equals(getIdentity()),
          "Product %s does not belong to package %s",
          product.getId(),
          getIdentity());
      Preconditions.checkArgument(
          productNames.add(product.getName()),
          "Duplicate product %s in package %s",
          product.getName(),
          getIdentity());
      for (String exported : product.getModuleNames()) {
        Preconditions.checkArgument(
            moduleNames.contains(exported),
            "Product %s exports unknown module %s",
            product.getId(),
            exported);
      }
    }
  }
}
