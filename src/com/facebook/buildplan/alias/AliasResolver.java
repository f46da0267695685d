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

import com.facebook.buildplan.config.PlanConfig;
import com.facebook.buildplan.diagnostics.Diagnostic;
import com.facebook.buildplan.diagnostics.DiagnosticCollector;
import com.facebook.buildplan.diagnostics.DiagnosticKind;
import com.facebook.buildplan.diagnostics.FatalPlanningException;
import com.facebook.buildplan.graph.AbstractBreadthFirstTraversal;
import com.facebook.buildplan.log.Logger;
import com.facebook.buildplan.model.DeclaredDependency;
import com.facebook.buildplan.model.DependencyEdge;
import com.facebook.buildplan.model.ModuleEdge;
import com.facebook.buildplan.model.ModuleId;
import com.facebook.buildplan.model.PackageIdentity;
import com.facebook.buildplan.model.ProductEdge;
import com.facebook.buildplan.model.ProductId;
import com.facebook.buildplan.model.ProductKind;
import com.facebook.buildplan.model.ResolvedGraph;
import com.facebook.buildplan.model.ResolvedModule;
import com.facebook.buildplan.model.ResolvedPackage;
import com.facebook.buildplan.model.ResolvedProduct;
import com.facebook.buildplan.model.ToolsVersion;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.SetMultimap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Decides the name every reachable module is compiled under.
 *
 * <p>A product edge may carry rename requests ({@code originalName -> newName}) for modules of the
 * product's package. A request travels down from the edge that declares it, through the product's
 * modules and their module dependencies, and renames the first module it meets with a matching
 * name. Requests made further up the graph win over requests for the same name made further down,
 * and a request whose new name is itself renamed further up is replaced by the upper name.
 *
 * <p>Problems are reported to the {@link DiagnosticCollector}; only a product cycle aborts
 * resolution.
 */
public class AliasResolver {

  private static final Logger LOG = Logger.get(AliasResolver.class);

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final ResolvedGraph graph;
  private final ToolsVersion minimumToolsVersion;
  private final boolean warnOnUnappliedAliases;
  private final SourceSubstitutability substitutability;
  private final DiagnosticCollector diagnostics;

  public AliasResolver(
      ResolvedGraph graph,
      PlanConfig config,
      SourceSubstitutability substitutability,
      DiagnosticCollector diagnostics) {
    this.graph = graph;
    this.minimumToolsVersion = config.getMinimumToolsVersionForAliasing();
    this.warnOnUnappliedAliases = config.shouldWarnOnUnappliedAliases();
    this.substitutability = substitutability;
    this.diagnostics = diagnostics;
  }

  public AliasResolution resolve() throws FatalPlanningException {
    return new Run().resolve();
  }

  /** Whether alias requests into {@code resolvedPackage} are honored. */
  public boolean isEligibleForAliasing(ResolvedPackage resolvedPackage) {
    return resolvedPackage.getToolsVersion().isAtLeast(minimumToolsVersion);
  }

  private boolean isEligibleForAliasing(PackageIdentity identity) {
    return isEligibleForAliasing(graph.getPackage(identity));
  }

  /** State of a single {@link #resolve()} call. */
  private class Run {

    private final Map<EdgeRef, ImmutableSortedMap<String, String>> usableRequests =
        new LinkedHashMap<>();
    private final Set<ModuleId> ambiguousModules = new HashSet<>();
    // Consuming module -> request keys it asked for with two different values.
    private final SetMultimap<ModuleId, String> ambiguousKeys = HashMultimap.create();
    private final Set<ProductId> reachableProducts = new LinkedHashSet<>();
    private final Set<ProductId> aliasedProducts = new LinkedHashSet<>();
    private boolean aliasingUsed = false;

    private final Set<LevelKey> resolvedLevels = new HashSet<>();
    private final List<ProductId> productPath = new ArrayList<>();
    private final Map<ModuleId, List<Assignment>> assignments = new HashMap<>();
    private final Set<RequestRef> appliedRequests = new HashSet<>();
    private final Set<RequestRef> supersededRequests = new HashSet<>();

    AliasResolution resolve() throws FatalPlanningException {
      ImmutableSet<ModuleId> reachable = findReachableModules();
      for (ModuleId id : reachable) {
        collectRequests(graph.getModule(id));
      }

      for (ResolvedPackage rootPackage : graph.getRootPackages()) {
        ImmutableList<ModuleId> entries =
            rootPackage
                .getModules()
                .stream()
                .map(ResolvedModule::getId)
                .collect(ImmutableList.toImmutableList());
        resolveLevel(rootPackage.getIdentity(), entries, ImmutableSortedMap.of(), null);
      }

      Map<ModuleId, String> renamed = new LinkedHashMap<>();
      Map<ModuleId, String> renamingProducts = new HashMap<>();
      for (ModuleId id : reachable) {
        mergeAssignments(id, renamed, renamingProducts);
      }

      ImmutableMap<ModuleId, AliasMap> aliasMaps = buildAliasMaps(reachable, renamed);
      checkSubstitutability(renamed, renamingProducts);
      reportUnappliedRequests();
      checkModuleNameUniqueness(reachable, renamed);
      checkProductNameUniqueness();

      return new AliasResolution(
          reachable,
          ImmutableSet.copyOf(reachableProducts),
          ImmutableMap.copyOf(renamed),
          aliasMaps,
          ImmutableSet.copyOf(aliasedProducts),
          aliasingUsed);
    }

    private ImmutableSet<ModuleId> findReachableModules() {
      List<ModuleId> roots = Lists.transform(graph.getRootModules(), ResolvedModule::getId);
      AbstractBreadthFirstTraversal<ModuleId> traversal =
          new AbstractBreadthFirstTraversal<ModuleId>(roots) {
            @Override
            public Iterable<ModuleId> visit(ModuleId id) {
              ResolvedModule module = graph.getModule(id);
              List<ModuleId> successors = new ArrayList<>();
              for (DependencyEdge edge : module.getDependencies()) {
                edge.accept(
                    new DependencyEdge.Visitor<Void>() {
                      @Override
                      public Void visitModule(ModuleEdge moduleEdge) {
                        successors.add(graph.getModule(module, moduleEdge).getId());
                        return null;
                      }

                      @Override
                      public Void visitProduct(ProductEdge productEdge) {
                        ResolvedProduct product = graph.getProduct(productEdge);
                        reachableProducts.add(product.getId());
                        successors.addAll(product.getModuleIds());
                        return null;
                      }
                    });
              }
              return successors;
            }
          };
      return traversal.start();
    }

    /** Validates the requests {@code module} makes and records the ones resolution may use. */
    private void collectRequests(ResolvedModule module) {
      Map<PackageIdentity, Map<String, String>> requestedByPackage = new HashMap<>();
      for (DeclaredDependency dependency : module.getDeclaredDependencies()) {
        if (!(dependency.getEdge() instanceof ProductEdge)) {
          continue;
        }
        ProductEdge edge = (ProductEdge) dependency.getEdge();
        if (!edge.hasRequestedAliases()) {
          continue;
        }
        aliasingUsed = true;

        ImmutableSortedMap<String, String> requests =
            ImmutableSortedMap.copyOf(edge.getRequestedAliases());
        boolean valid = true;
        for (Map.Entry<String, String> request : requests.entrySet()) {
          if (!IDENTIFIER.matcher(request.getValue()).matches()) {
            diagnostics.emit(
                Diagnostic.builder()
                    .setKind(DiagnosticKind.INVALID_ALIAS_IDENTIFIER)
                    .setPackageIdentity(module.getPackageIdentity())
                    .setModule(module.getName())
                    .setProduct(edge.getProductName())
                    .setOriginalName(request.getKey())
                    .addAliases(request.getValue())
                    .build());
            valid = false;
          }
        }
        if (!valid) {
          continue;
        }

        ResolvedPackage origin = graph.getPackage(edge.getPackageIdentity());
        if (!isEligibleForAliasing(origin)) {
          LOG.debug(
              "Ignoring aliases %s from %s: package %s has tools version %s, aliasing needs %s.",
              requests,
              module.getId(),
              origin.getIdentity(),
              origin.getToolsVersion(),
              minimumToolsVersion);
          continue;
        }

        Map<String, String> requested =
            requestedByPackage.computeIfAbsent(origin.getIdentity(), key -> new HashMap<>());
        for (Map.Entry<String, String> request : requests.entrySet()) {
          String previous = requested.putIfAbsent(request.getKey(), request.getValue());
          if (previous != null && !previous.equals(request.getValue())) {
            ambiguousModules.add(ModuleId.of(origin.getIdentity(), request.getKey()));
            ambiguousKeys.put(module.getId(), request.getKey());
            diagnostics.emit(
                Diagnostic.builder()
                    .setKind(DiagnosticKind.AMBIGUOUS_ALIAS_IN_PRODUCT)
                    .setPackageIdentity(origin.getIdentity())
                    .setProduct(edge.getProductName())
                    .setModule(request.getKey())
                    .setOriginalName(request.getKey())
                    .addAliases(previous, request.getValue())
                    .build());
          }
        }
        usableRequests.put(new EdgeRef(module.getId(), dependency.getDeclarationIndex()), requests);
        aliasedProducts.add(edge.getProductId());
      }
    }

    /**
     * Applies {@code pending} to the modules reachable from {@code entries} through module edges,
     * then continues into every product those modules depend on.
     */
    private void resolveLevel(
        PackageIdentity packageIdentity,
        ImmutableList<ModuleId> entries,
        ImmutableSortedMap<String, PendingAlias> pending,
        ProductId viaProduct)
        throws FatalPlanningException {
      if (viaProduct != null) {
        int index = productPath.indexOf(viaProduct);
        if (index >= 0) {
          List<String> cycle = new ArrayList<>();
          for (ProductId id : productPath.subList(index, productPath.size())) {
            cycle.add(id.toString());
          }
          cycle.add(viaProduct.toString());
          throw new FatalPlanningException(
              Diagnostic.builder()
                  .setKind(DiagnosticKind.CYCLIC_DEPENDENCY)
                  .setPackageIdentity(viaProduct.getPackageIdentity())
                  .setProduct(viaProduct.getName())
                  .addAllPath(cycle)
                  .build());
        }
      }
      if (!resolvedLevels.add(new LevelKey(entries, pending))) {
        return;
      }

      Set<ModuleId> level = closeOverModuleEdges(entries);
      SortedMap<String, PendingAlias> remaining = new TreeMap<>(pending);
      if (isEligibleForAliasing(packageIdentity)) {
        for (ModuleId id : level) {
          PendingAlias alias = pending.get(id.getName());
          if (alias != null) {
            assignments
                .computeIfAbsent(id, key -> new ArrayList<>())
                .add(new Assignment(alias.finalName, alias.productName, alias.contributors));
            appliedRequests.addAll(alias.contributors);
            remaining.remove(id.getName());
          }
        }
      }

      if (viaProduct != null) {
        productPath.add(viaProduct);
      }
      try {
        for (ModuleId id : level) {
          for (DeclaredDependency dependency : graph.getModule(id).getDeclaredDependencies()) {
            if (!(dependency.getEdge() instanceof ProductEdge)) {
              continue;
            }
            ProductEdge edge = (ProductEdge) dependency.getEdge();
            EdgeRef edgeRef = new EdgeRef(id, dependency.getDeclarationIndex());
            ImmutableSortedMap<String, PendingAlias> next =
                compose(remaining, edgeRef, edge.getProductName());
            resolveLevel(
                edge.getPackageIdentity(),
                graph.getProduct(edge).getModuleIds(),
                next,
                edge.getProductId());
          }
        }
      } finally {
        if (viaProduct != null) {
          productPath.remove(productPath.size() - 1);
        }
      }
    }

    private Set<ModuleId> closeOverModuleEdges(ImmutableList<ModuleId> entries) {
      AbstractBreadthFirstTraversal<ModuleId> traversal =
          new AbstractBreadthFirstTraversal<ModuleId>(entries) {
            @Override
            public Iterable<ModuleId> visit(ModuleId id) {
              ResolvedModule module = graph.getModule(id);
              List<ModuleId> successors = new ArrayList<>();
              for (DependencyEdge edge : module.getDependencies()) {
                if (edge instanceof ModuleEdge) {
                  successors.add(graph.getModule(module, (ModuleEdge) edge).getId());
                }
              }
              return successors;
            }
          };
      return traversal.start();
    }

    /** Combines the aliases still pending from above with the requests one edge makes. */
    private ImmutableSortedMap<String, PendingAlias> compose(
        SortedMap<String, PendingAlias> outer, EdgeRef edgeRef, String productName) {
      ImmutableSortedMap<String, String> requests = usableRequests.get(edgeRef);
      if (requests == null) {
        return ImmutableSortedMap.copyOf(outer);
      }
      Map<String, PendingAlias> result = new TreeMap<>(outer);
      for (Map.Entry<String, String> request : requests.entrySet()) {
        String originalName = request.getKey();
        String newName = request.getValue();
        RequestRef requestRef = new RequestRef(edgeRef, originalName);
        if (outer.containsKey(originalName)) {
          LOG.verbose(
              "Request %s -> %s from %s is overridden by %s.",
              originalName,
              newName,
              edgeRef.consumer,
              outer.get(originalName).finalName);
          supersededRequests.add(requestRef);
          continue;
        }
        PendingAlias chained = newName.equals(originalName) ? null : outer.get(newName);
        if (chained != null) {
          result.remove(newName);
          result.put(
              originalName,
              new PendingAlias(
                  chained.finalName,
                  productName,
                  ImmutableSet.<RequestRef>builder()
                      .addAll(chained.contributors)
                      .add(requestRef)
                      .build()));
        } else {
          result.put(
              originalName, new PendingAlias(newName, productName, ImmutableSet.of(requestRef)));
        }
      }
      return ImmutableSortedMap.copyOf(result);
    }

    private void mergeAssignments(
        ModuleId id, Map<ModuleId, String> renamed, Map<ModuleId, String> renamingProducts) {
      List<Assignment> moduleAssignments = assignments.get(id);
      if (moduleAssignments == null) {
        return;
      }
      Set<String> names = new LinkedHashSet<>();
      for (Assignment assignment : moduleAssignments) {
        names.add(assignment.finalName);
      }
      if (names.size() == 1) {
        String name = names.iterator().next();
        if (!name.equals(id.getName())) {
          renamed.put(id, name);
          renamingProducts.put(id, moduleAssignments.get(0).productName);
        }
        return;
      }
      if (ambiguousModules.contains(id) || stemsFromAmbiguousRequest(moduleAssignments)) {
        ambiguousModules.add(id);
        return;
      }
      diagnostics.emit(
          Diagnostic.builder()
              .setKind(DiagnosticKind.CONFLICTING_ALIAS_REQUEST)
              .setPackageIdentity(id.getPackageIdentity())
              .setProduct(moduleAssignments.get(0).productName)
              .setModule(id.getName())
              .setOriginalName(id.getName())
              .addAllAliases(names)
              .build());
    }

    private boolean stemsFromAmbiguousRequest(List<Assignment> moduleAssignments) {
      for (Assignment assignment : moduleAssignments) {
        for (RequestRef request : assignment.contributors) {
          if (ambiguousKeys.containsEntry(request.edge.consumer, request.originalName)) {
            return true;
          }
        }
      }
      return false;
    }

    private ImmutableMap<ModuleId, AliasMap> buildAliasMaps(
        ImmutableSet<ModuleId> reachable, Map<ModuleId, String> renamed) {
      ImmutableMap.Builder<ModuleId, AliasMap> aliasMaps = ImmutableMap.builder();
      for (ModuleId id : reachable) {
        ResolvedModule module = graph.getModule(id);
        AliasMapBuilder builder = new AliasMapBuilder(id);
        String ownName = renamed.get(id);
        if (ownName != null) {
          builder.put(id.getName(), ownName);
        }
        for (DeclaredDependency dependency : module.getDeclaredDependencies()) {
          dependency
              .getEdge()
              .accept(
                  new DependencyEdge.Visitor<Void>() {
                    @Override
                    public Void visitModule(ModuleEdge edge) {
                      ModuleId target = graph.getModule(module, edge).getId();
                      builder.put(edge.getName(), finalName(target, renamed));
                      return null;
                    }

                    @Override
                    public Void visitProduct(ProductEdge edge) {
                      ImmutableSortedMap<String, String> requests =
                          usableRequests.getOrDefault(
                              new EdgeRef(id, dependency.getDeclarationIndex()),
                              ImmutableSortedMap.of());
                      for (ModuleId target : graph.getProduct(edge).getModuleIds()) {
                        if (ambiguousModules.contains(target)) {
                          continue;
                        }
                        String seenAs = requests.getOrDefault(target.getName(), target.getName());
                        builder.put(seenAs, finalName(target, renamed));
                      }
                      return null;
                    }
                  });
        }
        builder.build().ifPresent(aliasMap -> aliasMaps.put(id, aliasMap));
      }
      return aliasMaps.build();
    }

    private void checkSubstitutability(
        Map<ModuleId, String> renamed, Map<ModuleId, String> renamingProducts) {
      for (Map.Entry<ModuleId, String> entry : renamed.entrySet()) {
        ModuleId id = entry.getKey();
        if (!substitutability.hasOnlySubstitutableSources(graph.getModule(id))) {
          diagnostics.emit(
              Diagnostic.builder()
                  .setKind(DiagnosticKind.NON_SUBSTITUTABLE_SOURCES_ALIASED)
                  .setPackageIdentity(id.getPackageIdentity())
                  .setProduct(renamingProducts.get(id))
                  .setModule(id.getName())
                  .setOriginalName(id.getName())
                  .addAliases(entry.getValue())
                  .build());
        }
      }
    }

    private void reportUnappliedRequests() {
      for (Map.Entry<EdgeRef, ImmutableSortedMap<String, String>> entry :
          usableRequests.entrySet()) {
        EdgeRef edgeRef = entry.getKey();
        for (Map.Entry<String, String> request : entry.getValue().entrySet()) {
          RequestRef requestRef = new RequestRef(edgeRef, request.getKey());
          if (appliedRequests.contains(requestRef) || supersededRequests.contains(requestRef)) {
            continue;
          }
          ProductEdge edge = edgeRef.getEdge();
          if (!warnOnUnappliedAliases) {
            LOG.debug(
                "Alias %s -> %s requested by %s matched no module of %s.",
                request.getKey(),
                request.getValue(),
                edgeRef.consumer,
                edge.getProductId());
            continue;
          }
          diagnostics.emit(
              Diagnostic.builder()
                  .setKind(DiagnosticKind.UNAPPLIED_ALIAS)
                  .setPackageIdentity(edge.getPackageIdentity())
                  .setProduct(edge.getProductName())
                  .setModule(edgeRef.consumer.getName())
                  .setOriginalName(request.getKey())
                  .addAliases(request.getValue())
                  .build());
        }
      }
    }

    private void checkModuleNameUniqueness(
        ImmutableSet<ModuleId> reachable, Map<ModuleId, String> renamed) {
      SortedMap<String, Set<PackageIdentity>> packagesByName = new TreeMap<>();
      for (ModuleId id : reachable) {
        packagesByName
            .computeIfAbsent(finalName(id, renamed), key -> new TreeSet<>())
            .add(id.getPackageIdentity());
      }
      for (Map.Entry<String, Set<PackageIdentity>> entry : packagesByName.entrySet()) {
        if (entry.getValue().size() < 2) {
          continue;
        }
        diagnostics.emit(
            Diagnostic.builder()
                .setKind(DiagnosticKind.DUPLICATE_MODULE_NAME)
                .setModule(entry.getKey())
                .addAllPackages(entry.getValue())
                .build());
      }
    }

    /** Only automatic libraries can be told apart by aliasing the modules they export. */
    private boolean isDisambiguatedByAlias(ProductId id) {
      return graph.getProduct(id).getKind() == ProductKind.LIBRARY
          && isEligibleForAliasing(id.getPackageIdentity())
          && aliasedProducts.contains(id);
    }

    private void checkProductNameUniqueness() {
      SortedMap<String, List<ProductId>> productsByName = new TreeMap<>();
      for (ProductId id : reachableProducts) {
        productsByName.computeIfAbsent(id.getName(), key -> new ArrayList<>()).add(id);
      }
      for (Map.Entry<String, List<ProductId>> entry : productsByName.entrySet()) {
        List<ProductId> sameName = entry.getValue();
        if (sameName.size() < 2) {
          continue;
        }
        long undisambiguated = sameName.stream().filter(id -> !isDisambiguatedByAlias(id)).count();
        if (undisambiguated < 2) {
          continue;
        }
        ImmutableSortedSet<PackageIdentity> packages =
            sameName
                .stream()
                .map(ProductId::getPackageIdentity)
                .collect(ImmutableSortedSet.toImmutableSortedSet(PackageIdentity::compareTo));
        if (aliasingUsed) {
          for (PackageIdentity identity : packages) {
            ResolvedPackage resolvedPackage = graph.getPackage(identity);
            if (!isEligibleForAliasing(resolvedPackage)) {
              diagnostics.emit(
                  Diagnostic.builder()
                      .setKind(DiagnosticKind.TOOLS_VERSION_TOO_OLD_FOR_ALIASING)
                      .setPackageIdentity(identity)
                      .setProduct(entry.getKey())
                      .build());
            }
          }
        }
        diagnostics.emit(
            Diagnostic.builder()
                .setKind(DiagnosticKind.DUPLICATE_PRODUCT_NAME)
                .setProduct(entry.getKey())
                .addAllPackages(packages)
                .build());
      }
    }
  }

  private static String finalName(ModuleId id, Map<ModuleId, String> renamed) {
    String name = renamed.get(id);
    return name == null ? id.getName() : name;
  }

  /** Collects one module's alias map, reporting entries that contradict each other. */
  private class AliasMapBuilder {
    private final ModuleId owner;
    private final Map<String, String> entries = new TreeMap<>();
    private boolean conflicting = false;

    AliasMapBuilder(ModuleId owner) {
      this.owner = owner;
    }

    void put(String seenAs, String finalName) {
      if (seenAs.equals(finalName)) {
        return;
      }
      String existing = entries.putIfAbsent(seenAs, finalName);
      if (existing != null && !existing.equals(finalName)) {
        conflicting = true;
        diagnostics.emit(
            Diagnostic.builder()
                .setKind(DiagnosticKind.CONFLICTING_ALIAS_REQUEST)
                .setPackageIdentity(owner.getPackageIdentity())
                .setModule(owner.getName())
                .setOriginalName(seenAs)
                .addAliases(existing, finalName)
                .build());
      }
    }

    Optional<AliasMap> build() {
      if (entries.isEmpty()) {
        return Optional.empty();
      }
      SetMultimap<String, String> namesByAlias = LinkedHashMultimap.create();
      for (Map.Entry<String, String> entry : entries.entrySet()) {
        namesByAlias.put(entry.getValue(), entry.getKey());
      }
      for (Map.Entry<String, Collection<String>> entry :
          namesByAlias.asMap().entrySet()) {
        if (entry.getValue().size() > 1) {
          conflicting = true;
          diagnostics.emit(
              Diagnostic.builder()
                  .setKind(DiagnosticKind.CONFLICTING_ALIAS_REQUEST)
                  .setPackageIdentity(owner.getPackageIdentity())
                  .setModule(owner.getName())
                  .addAliases(entry.getKey())
                  .addAllPath(entry.getValue())
                  .build());
        }
      }
      if (conflicting) {
        return Optional.empty();
      }
      return Optional.of(AliasMap.of(entries));
    }
  }

  /** A product edge, identified by the module declaring it and its declaration position. */
  private final class EdgeRef {
    private final ModuleId consumer;
    private final int declarationIndex;

    EdgeRef(ModuleId consumer, int declarationIndex) {
      this.consumer = consumer;
      this.declarationIndex = declarationIndex;
    }

    ProductEdge getEdge() {
      return (ProductEdge) graph.getModule(consumer).getDependencies().get(declarationIndex);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof EdgeRef)) {
        return false;
      }
      EdgeRef that = (EdgeRef) obj;
      return consumer.equals(that.consumer) && declarationIndex == that.declarationIndex;
    }

    @Override
    public int hashCode() {
      return Objects.hash(consumer, declarationIndex);
    }
  }

  /** One {@code originalName -> newName} entry of an edge's requests. */
  private static final class RequestRef {
    private final EdgeRef edge;
    private final String originalName;

    RequestRef(EdgeRef edge, String originalName) {
      this.edge = edge;
      this.originalName = originalName;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof RequestRef)) {
        return false;
      }
      RequestRef that = (RequestRef) obj;
      return edge.equals(that.edge) && originalName.equals(that.originalName);
    }

    @Override
    public int hashCode() {
      return Objects.hash(edge, originalName);
    }
  }

  /** A rename travelling down the graph, waiting for a module with a matching name. */
  private static final class PendingAlias {
    private final String finalName;
    private final String productName;
    private final ImmutableSet<RequestRef> contributors;

    PendingAlias(String finalName, String productName, ImmutableSet<RequestRef> contributors) {
      this.finalName = finalName;
      this.productName = productName;
      this.contributors = contributors;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof PendingAlias)) {
        return false;
      }
      PendingAlias that = (PendingAlias) obj;
      return finalName.equals(that.finalName)
          && productName.equals(that.productName)
          && contributors.equals(that.contributors);
    }

    @Override
    public int hashCode() {
      return Objects.hash(finalName, productName, contributors);
    }
  }

  private static final class Assignment {
    private final String finalName;
    private final String productName;
    private final ImmutableSet<RequestRef> contributors;

    Assignment(String finalName, String productName, ImmutableSet<RequestRef> contributors) {
      this.finalName = finalName;
      this.productName = productName;
      this.contributors = contributors;
    }
  }

  private static final class LevelKey {
    private final ImmutableList<ModuleId> entries;
    private final ImmutableSortedMap<String, PendingAlias> pending;

    LevelKey(ImmutableList<ModuleId> entries, ImmutableSortedMap<String, PendingAlias> pending) {
      this.entries = entries;
      this.pending = pending;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof LevelKey)) {
        return false;
      }
      LevelKey that = (LevelKey) obj;
      return entries.equals(that.entries) && pending.equals(that.pending);
    }

    @Override
    public int hashCode() {
      return Objects.hash(entries, pending);
    }
  }
}
