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

import static com.facebook.buildplan.model.GraphBuilder.moduleDep;
import static com.facebook.buildplan.model.GraphBuilder.productDep;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

import com.facebook.buildplan.util.HumanReadableException;
import com.google.common.collect.ImmutableList;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class ResolvedGraphTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  @Test
  public void indexesModulesAndProductsByKey() {
    GraphBuilder builder = new GraphBuilder();
    builder
        .rootPackage("app")
        .module("App", ModuleKind.EXECUTABLE, moduleDep("Core"), productDep("Log", "logpkg"))
        .module("Core");
    builder
        .addPackage("LogPkg")
        .module("Logging")
        .module("Sinks")
        .product("Log", "Logging", "Sinks");
    ResolvedGraph graph = builder.build();

    assertThat(graph.getSize(), equalTo(4));
    assertThat(graph.getRootPackages().size(), equalTo(1));
    ResolvedModule app = graph.getModule(ModuleId.of(PackageIdentity.of("app"), "App"));
    assertThat(app.getKind(), equalTo(ModuleKind.EXECUTABLE));
    assertThat(
        graph.getModule(app, ModuleEdge.of("Core")).getId(),
        equalTo(ModuleId.of(PackageIdentity.of("app"), "Core")));

    ResolvedProduct log = graph.getProduct(productDep("Log", "LOGPKG"));
    assertThat(
        graph.getExportedModules(log)
            .stream()
            .map(ResolvedModule::getName)
            .collect(ImmutableList.toImmutableList()),
        contains("Logging", "Sinks"));
    assertThat(
        graph.getRootModules()
            .stream()
            .map(ResolvedModule::getName)
            .collect(ImmutableList.toImmutableList()),
        contains("App", "Core"));
  }

  @Test
  public void declaredDependenciesKeepDeclarationOrder() {
    GraphBuilder builder = new GraphBuilder();
    builder
        .rootPackage("app")
        .module("App", productDep("Z", "zpkg"), moduleDep("B"), moduleDep("A"))
        .module("A")
        .module("B");
    builder.addPackage("zpkg").module("Z").product("Z", "Z");
    ResolvedModule app =
        builder.build().getModule(ModuleId.of(PackageIdentity.of("app"), "App"));

    ImmutableList<DeclaredDependency> declared = app.getDeclaredDependencies();
    assertThat(declared.size(), equalTo(3));
    assertThat(declared.get(0).getDeclarationIndex(), equalTo(0));
    assertThat(declared.get(1).getEdge(), equalTo(ModuleEdge.of("B")));
    assertThat(declared.get(2).getDeclarationIndex(), equalTo(2));
  }

  @Test
  public void danglingProductEdgeIsRejected() {
    GraphBuilder builder = new GraphBuilder();
    builder.rootPackage("app").module("App", productDep("Missing", "logpkg"));
    builder.addPackage("logpkg").module("Logging").product("Logging", "Logging");

    thrown.expect(HumanReadableException.class);
    thrown.expectMessage("Missing");
    builder.build();
  }

  @Test
  public void danglingModuleEdgeIsRejected() {
    GraphBuilder builder = new GraphBuilder();
    builder.rootPackage("app").module("App", moduleDep("Nowhere"));

    thrown.expect(HumanReadableException.class);
    thrown.expectMessage("unknown module 'Nowhere'");
    builder.build();
  }

  @Test
  public void duplicatePackageIdentityIsRejected() {
    GraphBuilder builder = new GraphBuilder();
    builder.rootPackage("app").module("App");
    builder.addPackage("APP").module("Other");

    thrown.expect(HumanReadableException.class);
    thrown.expectMessage("Package identity 'app'");
    builder.build();
  }

  @Test
  public void productExportingUnknownModuleIsRejected() {
    GraphBuilder builder = new GraphBuilder();
    builder.rootPackage("app").module("App").product("Lib", "NotThere");

    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("exports unknown module NotThere");
    builder.build();
  }
}
