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

package com.facebook.buildplan.alias;

import com.facebook.buildplan.model.ModuleId;
import com.facebook.buildplan.model.ProductId;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;

/** The outcome of {@link AliasResolver#resolve()}: final names and alias maps per module. */
public class AliasResolution {

  private final ImmutableSet<ModuleId> reachableModules;
  private final ImmutableSet<ProductId> reachableProducts;
  private final ImmutableMap<ModuleId, String> renamedModules;
  private final ImmutableMap<ModuleId, AliasMap> aliasMaps;
  private final ImmutableSet<ProductId> aliasedProducts;
  private final boolean aliasingUsed;

  AliasResolution(
      ImmutableSet<ModuleId> reachableModules,
      ImmutableSet<ProductId> reachableProducts,
      ImmutableMap<ModuleId, String> renamedModules,
      ImmutableMap<ModuleId, AliasMap> aliasMaps,
      ImmutableSet<ProductId> aliasedProducts,
      boolean aliasingUsed) {
    this.reachableModules = reachableModules;
    this.reachableProducts = reachableProducts;
    this.renamedModules = renamedModules;
    this.aliasMaps = aliasMaps;
    this.aliasedProducts = aliasedProducts;
    this.aliasingUsed = aliasingUsed;
  }

  /** Modules reachable from the root packages, in breadth-first discovery order. */
  public ImmutableSet<ModuleId> getReachableModules() {
    return reachableModules;
  }

  /** Products reached through a product edge from a reachable module. */
  public ImmutableSet<ProductId> getReachableProducts() {
    return reachableProducts;
  }

  /** Modules that are built under a new name, mapped to that name. */
  public ImmutableMap<ModuleId, String> getRenamedModules() {
    return renamedModules;
  }

  public String getFinalName(ModuleId module) {
    String alias = renamedModules.get(module);
    return alias == null ? module.getName() : alias;
  }

  public Optional<AliasMap> getAliasMap(ModuleId module) {
    return Optional.ofNullable(aliasMaps.get(module));
  }

  public ImmutableMap<ModuleId, AliasMap> getAliasMaps() {
    return aliasMaps;
  }

  /** Products that at least one edge asked to alias modules of. */
  public ImmutableSet<ProductId> getAliasedProducts() {
    return aliasedProducts;
  }

  /** Whether any edge in the reachable graph requests aliases at all. */
  public boolean isAliasingUsed() {
    return aliasingUsed;
  }
}
