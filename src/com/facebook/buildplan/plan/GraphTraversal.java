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

import com.facebook.buildplan.model.ResolvedModule;
import com.facebook.buildplan.model.ResolvedProduct;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the destination-annotated graph of a {@link BuildPlan}.
 *
 * <p>{@link #traverseModules(ModuleVisitor)} is path-sensitive: a module reached through two
 * parents is reported twice. {@link #recursiveDependencies(ModuleBuildDescription)} is
 * identity-sensitive and reports every node at most once.
 */
public class GraphTraversal {

  public interface ModuleVisitor {
    /**
     * @param module the visited build identity
     * @param parent the module that led here on this path, absent for roots
     * @param depth 1 for roots, growing by one per module edge or product hop
     */
    void visit(BuildIdentity module, Optional<BuildIdentity> parent, int depth);
  }

  public interface DependencyVisitor {
    void onProduct(ResolvedProduct product, Destination destination);

    void onModule(
        ResolvedModule module, Destination destination, ModuleBuildDescription description);
  }

  private final BuildPlan plan;

  public GraphTraversal(BuildPlan plan) {
    this.plan = plan;
  }

  /**
   * Depth-first walk from every root module, once per distinct path. Products are transparent:
   * their exported modules appear as children of the module depending on the product.
   *
   * @throws IllegalStateException if a module is reached again while still on the current path
   */
  public void traverseModules(ModuleVisitor visitor) {
    for (BuildIdentity root : plan.getRootModules()) {
      Set<BuildIdentity> onPath = new LinkedHashSet<>();
      visitPath(root, Optional.empty(), 1, onPath, visitor);
    }
  }

  private void visitPath(
      BuildIdentity module,
      Optional<BuildIdentity> parent,
      int depth,
      Set<BuildIdentity> onPath,
      ModuleVisitor visitor) {
    if (!onPath.add(module)) {
      throw new IllegalStateException(
          String.format("Cycle in build plan: %s -> %s", onPath, module));
    }
    visitor.visit(module, parent, depth);
    for (BuildIdentity child : getModuleChildren(module)) {
      visitPath(child, Optional.of(module), depth + 1, onPath, visitor);
    }
    onPath.remove(module);
  }

  private ImmutableList<BuildIdentity> getModuleChildren(BuildIdentity module) {
    ImmutableList.Builder<BuildIdentity> children = ImmutableList.builder();
    for (PlanNode successor : plan.getSuccessors(module)) {
      if (successor instanceof BuildIdentity) {
        children.add((BuildIdentity) successor);
      } else {
        for (PlanNode exported : plan.getSuccessors(successor)) {
          children.add((BuildIdentity) exported);
        }
      }
    }
    return children.build();
  }

  /** Visits the direct dependencies of {@code description} in declaration order. */
  public void traverseDependencies(
      ModuleBuildDescription description, DependencyVisitor visitor) {
    for (PlanNode successor : plan.getSuccessors(description.getIdentity())) {
      successor.accept(
          new PlanNode.Visitor<Void>() {
            @Override
            public Void visitModule(BuildIdentity identity) {
              visitor.onModule(
                  plan.getGraph().getModule(identity.getModule()),
                  identity.getDestination(),
                  plan.getRequiredDescription(identity));
              return null;
            }

            @Override
            public Void visitProduct(ProductIdentity identity) {
              visitor.onProduct(
                  plan.getGraph().getProduct(identity.getProduct()), identity.getDestination());
              return null;
            }
          });
    }
  }

  /**
   * All transitive dependencies of {@code description} in depth-first preorder. A product is
   * followed directly by its exported modules. Every (node, destination) pair appears at most
   * once.
   */
  public ImmutableList<DependencyEntry> recursiveDependencies(
      ModuleBuildDescription description) {
    ImmutableList.Builder<DependencyEntry> entries = ImmutableList.builder();
    Set<PlanNode> seen = new HashSet<>();
    seen.add(description.getIdentity());
    collectDependencies(description.getIdentity(), seen, entries);
    return entries.build();
  }

  private void collectDependencies(
      BuildIdentity module, Set<PlanNode> seen, ImmutableList.Builder<DependencyEntry> entries) {
    for (PlanNode successor : plan.getSuccessors(module)) {
      if (!seen.add(successor)) {
        continue;
      }
      if (successor instanceof BuildIdentity) {
        collectModule((BuildIdentity) successor, seen, entries);
        continue;
      }
      ProductIdentity product = (ProductIdentity) successor;
      entries.add(
          DependencyEntry.ofProduct(
              plan.getGraph().getProduct(product.getProduct()), product.getDestination()));
      for (PlanNode exported : plan.getSuccessors(product)) {
        if (seen.add(exported)) {
          collectModule((BuildIdentity) exported, seen, entries);
        }
      }
    }
  }

  private void collectModule(
      BuildIdentity module, Set<PlanNode> seen, ImmutableList.Builder<DependencyEntry> entries) {
    entries.add(DependencyEntry.ofModule(plan.getRequiredDescription(module)));
    collectDependencies(module, seen, entries);
  }

  /** For every module build reachable from a root, the deepest position it occupies. */
  public ImmutableMap<BuildIdentity, Integer> computeModuleHeights() {
    Map<BuildIdentity, Integer> heights = new LinkedHashMap<>();
    traverseModules((module, parent, depth) -> heights.merge(module, depth, Math::max));
    return ImmutableMap.copyOf(heights);
  }
}
