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
import com.facebook.buildplan.diagnostics.Diagnostic;
import com.facebook.buildplan.diagnostics.DiagnosticKind;
import com.facebook.buildplan.diagnostics.FatalPlanningException;
import com.facebook.buildplan.graph.AcyclicDepthFirstPostOrderTraversal;
import com.facebook.buildplan.log.Logger;
import com.facebook.buildplan.model.DeclaredDependency;
import com.facebook.buildplan.model.DependencyEdge;
import com.facebook.buildplan.model.ModuleEdge;
import com.facebook.buildplan.model.ModuleId;
import com.facebook.buildplan.model.ModuleKind;
import com.facebook.buildplan.model.PackageIdentity;
import com.facebook.buildplan.model.ProductEdge;
import com.facebook.buildplan.model.ProductId;
import com.facebook.buildplan.model.ProductKind;
import com.facebook.buildplan.model.ResolvedGraph;
import com.facebook.buildplan.model.ResolvedModule;
import com.facebook.buildplan.model.ResolvedPackage;
import com.facebook.buildplan.model.ResolvedProduct;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Assigns every reachable module and product a {@link Destination} and creates one build
 * description per (module, destination) and per (product, destination).
 *
 * <p>Everything starts at its natural destination, which is {@link Destination#TARGET} unless the
 * module or product only makes sense on the build machine. Dependencies are built for the
 * destination of whoever needs them, so a module needed both by a macro and by the shipped
 * program is planned twice.
 */
public class DestinationPlanner {

  private static final Logger LOG = Logger.get(DestinationPlanner.class);

  private final ResolvedGraph graph;
  private final AliasResolution aliasResolution;
  private final BuildParameters targetParameters;
  private final BuildParameters hostParameters;
  private final String hostQualifier;

  private final Map<PlanNode, ImmutableList<PlanNode>> successors = new LinkedHashMap<>();

  public DestinationPlanner(
      ResolvedGraph graph,
      AliasResolution aliasResolution,
      BuildParameters targetParameters,
      BuildParameters hostParameters,
      String hostQualifier) {
    this.graph = graph;
    this.aliasResolution = aliasResolution;
    this.targetParameters = targetParameters;
    this.hostParameters = hostParameters;
    this.hostQualifier = hostQualifier;
  }

  /** Macros and plugins, and tests that need one of them to compile, always run on the host. */
  public static boolean requiresHost(ResolvedGraph graph, ResolvedModule module) {
    if (module.getKind().isAlwaysHost()) {
      return true;
    }
    if (module.getKind() != ModuleKind.TEST) {
      return false;
    }
    for (DependencyEdge edge : module.getDependencies()) {
      boolean needsMacro =
          edge.accept(
              new DependencyEdge.Visitor<Boolean>() {
                @Override
                public Boolean visitModule(ModuleEdge moduleEdge) {
                  return graph.getModule(module, moduleEdge).getKind().isAlwaysHost();
                }

                @Override
                public Boolean visitProduct(ProductEdge productEdge) {
                  return graph.getProduct(productEdge).getKind().isMacroOrPlugin();
                }
              });
      if (needsMacro) {
        return true;
      }
    }
    return false;
  }

  public static boolean requiresHost(ResolvedGraph graph, ResolvedProduct product) {
    if (product.getKind().isAlwaysHost()) {
      return true;
    }
    if (product.getKind() != ProductKind.TEST) {
      return false;
    }
    for (ResolvedModule module : graph.getExportedModules(product)) {
      if (requiresHost(graph, module)) {
        return true;
      }
    }
    return false;
  }

  public BuildPlan plan() throws FatalPlanningException {
    ImmutableList<PlanNode> roots = findRoots();

    AcyclicDepthFirstPostOrderTraversal<PlanNode> traversal =
        new AcyclicDepthFirstPostOrderTraversal<>(node -> getSuccessors(node).iterator());
    ImmutableList<PlanNode> postOrder;
    try {
      postOrder = traversal.traverse(roots);
    } catch (AcyclicDepthFirstPostOrderTraversal.CycleException e) {
      ImmutableList.Builder<String> path = ImmutableList.builder();
      for (Object node : e.getCycle()) {
        path.add(node.toString());
      }
      throw new FatalPlanningException(
          Diagnostic.builder()
              .setKind(DiagnosticKind.CYCLIC_DEPENDENCY)
              .addAllPath(path.build())
              .build(),
          e);
    }

    Set<ModuleId> modulesAtTarget = new HashSet<>();
    Set<ProductId> productsAtTarget = new HashSet<>();
    for (PlanNode node : postOrder) {
      if (node.getDestination() != Destination.TARGET) {
        continue;
      }
      node.accept(
          new PlanNode.Visitor<Void>() {
            @Override
            public Void visitModule(BuildIdentity identity) {
              modulesAtTarget.add(identity.getModule());
              return null;
            }

            @Override
            public Void visitProduct(ProductIdentity identity) {
              productsAtTarget.add(identity.getProduct());
              return null;
            }
          });
    }

    Map<BuildIdentity, ModuleBuildDescription> moduleDescriptions = new LinkedHashMap<>();
    Map<ProductIdentity, ProductBuildDescription> productDescriptions = new LinkedHashMap<>();
    Map<String, BuildIdentity> moduleArtifacts = new HashMap<>();
    Map<String, ProductIdentity> productArtifacts = new HashMap<>();
    for (PlanNode node : postOrder) {
      if (node instanceof BuildIdentity) {
        BuildIdentity identity = (BuildIdentity) node;
        ModuleBuildDescription description =
            describeModule(identity, modulesAtTarget.contains(identity.getModule()));
        checkArtifactKey(
            description.getArtifactKey(),
            identity,
            moduleArtifacts,
            identity.getModule().getName());
        moduleDescriptions.put(identity, description);
      } else {
        ProductIdentity identity = (ProductIdentity) node;
        ResolvedProduct product = graph.getProduct(identity.getProduct());
        if (!product.getKind().hasProductBuild()) {
          continue;
        }
        ProductBuildDescription description =
            describeProduct(
                identity, product, productsAtTarget.contains(identity.getProduct()));
        checkArtifactKey(
            description.getArtifactKey(), identity, productArtifacts, product.getName());
        productDescriptions.put(identity, description);
      }
    }

    LOG.debug(
        "Planned %d module builds and %d product builds from %d roots.",
        moduleDescriptions.size(),
        productDescriptions.size(),
        roots.size());
    return new BuildPlan(
        graph,
        aliasResolution,
        targetParameters,
        hostParameters,
        roots,
        ImmutableMap.copyOf(successors),
        ImmutableMap.copyOf(moduleDescriptions),
        ImmutableMap.copyOf(productDescriptions));
  }

  /** Every product and module of the root packages, each at its natural destination. */
  private ImmutableList<PlanNode> findRoots() {
    ImmutableList.Builder<PlanNode> roots = ImmutableList.builder();
    for (ResolvedPackage rootPackage : graph.getRootPackages()) {
      for (ResolvedModule module : rootPackage.getModules()) {
        roots.add(
            BuildIdentity.of(
                module.getId(),
                requiresHost(graph, module) ? Destination.HOST : Destination.TARGET));
      }
      for (ResolvedProduct product : rootPackage.getProducts()) {
        roots.add(
            ProductIdentity.of(
                product.getId(),
                requiresHost(graph, product) ? Destination.HOST : Destination.TARGET));
      }
    }
    return roots.build();
  }

  private ImmutableList<PlanNode> getSuccessors(PlanNode node) {
    ImmutableList<PlanNode> cached = successors.get(node);
    if (cached == null) {
      cached = node.accept(new SuccessorFinder());
      successors.put(node, cached);
    }
    return cached;
  }

  private ModuleBuildDescription describeModule(BuildIdentity identity, boolean alsoAtTarget) {
    ResolvedModule module = graph.getModule(identity.getModule());
    String finalName = aliasResolution.getFinalName(module.getId());
    return ModuleBuildDescription.builder()
        .setIdentity(identity)
        .setKind(module.getKind())
        .setFinalName(finalName)
        .setAliasMap(aliasResolution.getAliasMap(module.getId()))
        .setBuildParameters(getBuildParameters(identity.getDestination()))
        .setArtifactName(qualify(finalName, identity.getDestination(), alsoAtTarget))
        .build();
  }

  private ProductBuildDescription describeProduct(
      ProductIdentity identity, ResolvedProduct product, boolean alsoAtTarget) {
    ImmutableList.Builder<BuildIdentity> modules = ImmutableList.builder();
    for (PlanNode successor : getSuccessors(identity)) {
      modules.add((BuildIdentity) successor);
    }
    return ProductBuildDescription.builder()
        .setIdentity(identity)
        .setKind(product.getKind())
        .setBuildParameters(getBuildParameters(identity.getDestination()))
        .setArtifactName(qualify(product.getName(), identity.getDestination(), alsoAtTarget))
        .setModules(modules.build())
        .build();
  }

  private String qualify(String name, Destination destination, boolean alsoAtTarget) {
    if (destination == Destination.HOST && alsoAtTarget) {
      return name + hostQualifier;
    }
    return name;
  }

  private BuildParameters getBuildParameters(Destination destination) {
    return destination == Destination.HOST ? hostParameters : targetParameters;
  }

  private <T extends PlanNode> void checkArtifactKey(
      String artifactKey, T identity, Map<String, T> claimed, String name)
      throws FatalPlanningException {
    T existing = claimed.putIfAbsent(artifactKey, identity);
    if (existing == null) {
      return;
    }
    PackageIdentity first = packageOf(existing);
    PackageIdentity second = packageOf(identity);
    throw new FatalPlanningException(
        Diagnostic.builder()
            .setKind(DiagnosticKind.DESTINATION_CONFLICT)
            .setModule(name)
            .addAliases(artifactKey)
            .addAllPackages(ImmutableSortedSet.of(first, second))
            .addPath(existing.toString(), identity.toString())
            .build());
  }

  private static PackageIdentity packageOf(PlanNode node) {
    return node.accept(
        new PlanNode.Visitor<PackageIdentity>() {
          @Override
          public PackageIdentity visitModule(BuildIdentity identity) {
            return identity.getModule().getPackageIdentity();
          }

          @Override
          public PackageIdentity visitProduct(ProductIdentity identity) {
            return identity.getProduct().getPackageIdentity();
          }
        });
  }

  /** Direct successors of a node, in declaration order, each at the destination it is built for. */
  private class SuccessorFinder implements PlanNode.Visitor<ImmutableList<PlanNode>> {

    @Override
    public ImmutableList<PlanNode> visitModule(BuildIdentity identity) {
      ResolvedModule module = graph.getModule(identity.getModule());
      Destination destination = identity.getDestination();
      ImmutableList.Builder<PlanNode> builder = ImmutableList.builder();
      for (DeclaredDependency dependency : module.getDeclaredDependencies()) {
        builder.add(
            dependency
                .getEdge()
                .accept(
                    new DependencyEdge.Visitor<PlanNode>() {
                      @Override
                      public PlanNode visitModule(ModuleEdge edge) {
                        return moduleAt(graph.getModule(module, edge), destination);
                      }

                      @Override
                      public PlanNode visitProduct(ProductEdge edge) {
                        ResolvedProduct product = graph.getProduct(edge);
                        return ProductIdentity.of(
                            product.getId(),
                            requiresHost(graph, product) ? Destination.HOST : destination);
                      }
                    }));
      }
      return builder.build();
    }

    @Override
    public ImmutableList<PlanNode> visitProduct(ProductIdentity identity) {
      ResolvedProduct product = graph.getProduct(identity.getProduct());
      ImmutableList.Builder<PlanNode> builder = ImmutableList.builder();
      for (ResolvedModule module : graph.getExportedModules(product)) {
        builder.add(moduleAt(module, identity.getDestination()));
      }
      return builder.build();
    }

    private BuildIdentity moduleAt(ResolvedModule module, Destination consumerDestination) {
      return BuildIdentity.of(
          module.getId(), requiresHost(graph, module) ? Destination.HOST : consumerDestination);
    }
  }
}
