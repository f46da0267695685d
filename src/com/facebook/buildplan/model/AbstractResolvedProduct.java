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
import java.util.Locale;
import org.immutables.value.Value;

/** A named grouping of modules that a package exports to its consumers. */
@Value.Immutable
@PlanStyleImmutable
abstract class AbstractResolvedProduct {

  public abstract String getName();

  public abstract PackageIdentity getPackageIdentity();

  @Value.Default
  public ProductKind getKind() {
    return ProductKind.LIBRARY;
  }

  /** Names of the exported modules, which all live in {@link #getPackageIdentity()}. */
  public abstract ImmutableList<String> getModuleNames();

  @Value.Check
  protected void check() {
    Preconditions.checkArgument(
        !getName().isEmpty(), "Empty product name in %s", getPackageIdentity());
    Preconditions.checkArgument(
        !getModuleNames().isEmpty(), "Product %s exports no modules", getName());
  }

  @Value.Lazy
  public ProductId getId() {
    return ProductId.of(getPackageIdentity(), getName());
  }

  @Value.Lazy
  public ImmutableList<ModuleId> getModuleIds() {
    ImmutableList.Builder<ModuleId> builder = ImmutableList.builder();
    for (String moduleName : getModuleNames()) {
      builder.add(ModuleId.of(getPackageIdentity(), moduleName));
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return String.format("%s product %s", getKind().name().toLowerCase(Locale.ROOT), getId());
  }
}
