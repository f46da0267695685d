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
import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import org.immutables.value.Value;

/** A compilable unit of sources within a package, as handed over by manifest resolution. */
@Value.Immutable
@PlanStyleImmutable
abstract class AbstractResolvedModule {

  public abstract String getName();

  public abstract PackageIdentity getPackageIdentity();

  @Value.Default
  public ModuleKind getKind() {
    return ModuleKind.REGULAR;
  }

  /** Kinds of sources the module contains. An empty set means the module has no sources. */
  public abstract ImmutableSet<SourceKind> getSourceKinds();

  /** Declared dependencies, in declaration order. */
  public abstract ImmutableList<DependencyEdge> getDependencies();

  @Value.Check
  protected void check() {
    Preconditions.checkArgument(
        !getName().isEmpty(), "Empty module name in %s", getPackageIdentity());
  }

  @Value.Lazy
  public ModuleId getId() {
    return ModuleId.of(getPackageIdentity(), getName());
  }

  @Value.Lazy
  public ImmutableList<DeclaredDependency> getDeclaredDependencies() {
    ImmutableList.Builder<DeclaredDependency> builder = ImmutableList.builder();
    int index = 0;
    for (DependencyEdge edge : getDependencies()) {
      builder.add(DeclaredDependency.of(index++, edge));
    }
    return builder.build();
  }

  public boolean hasOnlySubstitutableSources() {
    return !getSourceKinds().contains(SourceKind.FOREIGN);
  }

  @Override
  public String toString() {
    return String.format("%s module %s", getKind().name().toLowerCase(Locale.ROOT), getId());
  }
}
