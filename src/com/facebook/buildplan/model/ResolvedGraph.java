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

import com.facebook.buildplan.util.HumanReadableException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The fully resolved package graph: packages, their modules and products, and the dependency edges
 * between them. Produced by manifest resolution and never mutated afterwards.
 *
 * <p>All lookups are keyed by {@link PackageIdentity}, {@link ModuleId} and {@link ProductId}, so
 * consumers keep their own state in tables keyed the same way instead of on the nodes.
 */
public class ResolvedGraph {

  private final ImmutableMap<PackageIdentity, ResolvedPackage> packages;
  private final ImmutableMap<ModuleId, ResolvedModule> modules;
  private final ImmutableMap<ProductId, ResolvedProduct> products;
  private final ImmutableList<ResolvedPackage> rootPackages;

  public ResolvedGraph(Iterable<ResolvedPackage> packages) {
    Map<PackageIdentity, ResolvedPackage> packagesByIdentity = new LinkedHashMap<>();
    ImmutableMap.Builder<ModuleId, ResolvedModule> modules = ImmutableMap.builder();
    ImmutableMap.Builder<ProductId, ResolvedProduct> products = ImmutableMap.builder();
    ImmutableList.Builder<ResolvedPackage> rootPackages = ImmutableList.builder();
    for (ResolvedPackage resolvedPackage : packages) {
      ResolvedPackage existing =
          packagesByIdentity.put(resolvedPackage.getIdentity(), resolvedPackage);
      if (existing != null) {
        throw new HumanReadableException(
            "Package identity '%s' is declared by both %s and %s.",
            resolvedPackage.getIdentity(),
            existing.getLocation(),
            resolvedPackage.getLocation());
      }
      for (ResolvedModule module : resolvedPackage.getModules()) {
        modules.put(module.getId(), module);
      }
      for (ResolvedProduct product : resolvedPackage.getProducts()) {
        products.put(product.getId(), product);
      }
      if (resolvedPackage.isRoot()) {
        rootPackages.add(resolvedPackage);
      }
    }
    this.packages = ImmutableMap.copyOf(packagesByIdentity);
    this.modules = modules.build();
    this.products = products.build();
    this.rootPackages = rootPackages.build();

    verifyEdges();
  }

  private void verifyEdges() {
    for (ResolvedModule module : modules.values()) {
      for (DependencyEdge edge : module.getDependencies()) {
        edge.accept(
            new DependencyEdge.Visitor<Void>() {
              @Override
              public Void visitModule(ModuleEdge moduleEdge) {
                ModuleId target = ModuleId.of(module.getPackageIdentity(), moduleEdge.getName());
                if (!modules.containsKey(target)) {
                  throw new HumanReadableException(
                      "Module %s depends on unknown module '%s'.",
                      module.getId(),
                      moduleEdge.getName());
                }
                return null;
              }

              @Override
              public Void visitProduct(ProductEdge productEdge) {
                if (!products.containsKey(productEdge.getProductId())) {
                  throw new HumanReadableException(
                      "Module %s depends on product '%s' which package '%s' does not declare.",
                      module.getId(),
                      productEdge.getProductName(),
                      productEdge.getPackageIdentity());
                }
                return null;
              }
            });
      }
    }
  }

  public ImmutableList<ResolvedPackage> getPackages() {
    return packages.values().asList();
  }

  public ImmutableList<ResolvedPackage> getRootPackages() {
    return rootPackages;
  }

  public ImmutableMap<ModuleId, ResolvedModule> getModules() {
    return modules;
  }

  public ImmutableMap<ProductId, ResolvedProduct> getProducts() {
    return products;
  }

  public ResolvedPackage getPackage(PackageIdentity identity) {
    ResolvedPackage resolvedPackage = packages.get(identity);
    if (resolvedPackage == null) {
      throw new IllegalArgumentException("No package " + identity + " in the graph");
    }
    return resolvedPackage;
  }

  public Optional<ResolvedModule> getModuleOptional(ModuleId id) {
    return Optional.ofNullable(modules.get(id));
  }

  public ResolvedModule getModule(ModuleId id) {
    ResolvedModule module = modules.get(id);
    if (module == null) {
      throw new IllegalArgumentException("No module " + id + " in the graph");
    }
    return module;
  }

  public ResolvedProduct getProduct(ProductId id) {
    ResolvedProduct product = products.get(id);
    if (product == null) {
      throw new IllegalArgumentException("No product " + id + " in the graph");
    }
    return product;
  }

  /** The module that {@code edge}, declared by {@code consumer}, points at. */
  public ResolvedModule getModule(ResolvedModule consumer, ModuleEdge edge) {
    return getModule(ModuleId.of(consumer.getPackageIdentity(), edge.getName()));
  }

  public ResolvedProduct getProduct(ProductEdge edge) {
    return getProduct(edge.getProductId());
  }

  public ImmutableList<ResolvedModule> getExportedModules(ResolvedProduct product) {
    ImmutableList.Builder<ResolvedModule> builder = ImmutableList.builder();
    for (ModuleId id : product.getModuleIds()) {
      builder.add(getModule(id));
    }
    return builder.build();
  }

  /** Modules of all root packages, in package then declaration order. */
  public ImmutableList<ResolvedModule> getRootModules() {
    ImmutableList.Builder<ResolvedModule> builder = ImmutableList.builder();
    for (ResolvedPackage rootPackage : rootPackages) {
      builder.addAll(rootPackage.getModules());
    }
    return builder.build();
  }

  public int getSize() {
    return modules.size();
  }
}
