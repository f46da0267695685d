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

import com.facebook.buildplan.alias.AliasResolution;
import com.facebook.buildplan.model.ModuleId;
import com.facebook.buildplan.model.ProductId;
import com.facebook.buildplan.model.ResolvedGraph;
import com.facebook.buildplan.model.ResolvedModule;
import com.facebook.buildplan.model.ResolvedProduct;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;

/**
 * The finished, immutable output of planning: one {@link ModuleBuildDescription} per build
 * identity, the product builds, and the destination-annotated graph connecting them.
 */
public class BuildPlan {

  private final ResolvedGraph graph;
  private final AliasResolution aliasResolution;
  private final BuildParameters targetParameters;
  private final BuildParameters hostParameters;
  private final ImmutableList<PlanNode> roots;
  private final ImmutableMap<PlanNode, ImmutableList<PlanNode>> successors;
  private final ImmutableMap<BuildIdentity, ModuleBuildDescription> moduleDescriptions;
  private final ImmutableMap<ProductIdentity, ProductBuildDescription> productDescriptions;

  BuildPlan(
      ResolvedGraph graph,
      AliasResolution aliasResolution,
      BuildParameters targetParameters,
      BuildParameters hostParameters,
      ImmutableList<PlanNode> roots,
      ImmutableMap<PlanNode, ImmutableList<PlanNode>> successors,
      ImmutableMap<BuildIdentity, ModuleBuildDescription> moduleDescriptions,
      ImmutableMap<ProductIdentity, ProductBuildDescription> productDescriptions) {
    this.graph = graph;
    this.aliasResolution = aliasResolution;
    this.targetParameters = targetParameters;
    this.hostParameters = hostParameters;
    this.roots = roots;
    this.successors = successors;
    this.moduleDescriptions = moduleDescriptions;
    this.productDescriptions = productDescriptions;
  }

  public ResolvedGraph getGraph() {
    return graph;
  }

  public AliasResolution getAliasResolution() {
    return aliasResolution;
  }

  public BuildParameters getBuildParameters(Destination destination) {
    return destination == Destination.HOST ? hostParameters : targetParameters;
  }

  /** Root modules and products, each at its natural destination. */
  public ImmutableList<PlanNode> getRoots() {
    return roots;
  }

  public ImmutableList<BuildIdentity> getRootModules() {
    return roots
        .stream()
        .filter(BuildIdentity.class::isInstance)
        .map(BuildIdentity.class::cast)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Direct successors of {@code node} in declaration order: the products and modules a module
   * depends on, or the modules a product exports.
   */
  public ImmutableList<PlanNode> getSuccessors(PlanNode node) {
    ImmutableList<PlanNode> nodes = successors.get(node);
    if (nodes == null) {
      throw new IllegalStateException(node + " is not part of this build plan");
    }
    return nodes;
  }

  public ImmutableSet<BuildIdentity> getBuildIdentities() {
    return moduleDescriptions.keySet();
  }

  /** Module builds, dependencies before the modules that depend on them. */
  public ImmutableList<ModuleBuildDescription> getModuleDescriptions() {
    return moduleDescriptions.values().asList();
  }

  public ImmutableList<ProductBuildDescription> getProductDescriptions() {
    return productDescriptions.values().asList();
  }

  public Optional<ModuleBuildDescription> getDescription(BuildIdentity identity) {
    return Optional.ofNullable(moduleDescriptions.get(identity));
  }

  /**
   * The build of {@code module} that a consumer at {@code consumerDestination} uses. Macros and
   * plugins are only ever built for the host.
   */
  public Optional<ModuleBuildDescription> getDescription(
      ModuleId module, Destination consumerDestination) {
    ResolvedModule resolvedModule = graph.getModule(module);
    Destination destination =
        DestinationPlanner.requiresHost(graph, resolvedModule)
            ? Destination.HOST
            : consumerDestination;
    return getDescription(BuildIdentity.of(module, destination));
  }

  public Optional<ProductBuildDescription> getProductDescription(ProductIdentity identity) {
    return Optional.ofNullable(productDescriptions.get(identity));
  }

  public Optional<ProductBuildDescription> getProductDescription(
      ProductId product, Destination consumerDestination) {
    ResolvedProduct resolvedProduct = graph.getProduct(product);
    Destination destination =
        DestinationPlanner.requiresHost(graph, resolvedProduct)
            ? Destination.HOST
            : consumerDestination;
    return getProductDescription(ProductIdentity.of(product, destination));
  }

  public ModuleBuildDescription getRequiredDescription(BuildIdentity identity) {
    return getDescription(identity)
        .orElseThrow(
            () -> new IllegalStateException(identity + " has no build description in this plan"));
  }

  public GraphTraversal getTraversal() {
    return new GraphTraversal(this);
  }
}
