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

import static com.facebook.buildplan.model.GraphBuilder.moduleDep;
import static com.facebook.buildplan.model.GraphBuilder.productDep;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

import com.facebook.buildplan.config.PlanConfig;
import com.facebook.buildplan.model.GraphBuilder;
import com.facebook.buildplan.model.ModuleId;
import com.facebook.buildplan.model.ModuleKind;
import com.facebook.buildplan.model.PackageIdentity;
import com.facebook.buildplan.model.ResolvedGraph;
import com.facebook.buildplan.model.ResolvedModule;
import com.facebook.buildplan.model.ResolvedProduct;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class GraphTraversalTest {

  private static final BuildParameters TARGET =
      BuildParameters.of("aarch64-unknown-linux-gnu", BuildConfiguration.DEBUG);
  private static final BuildParameters HOST =
      BuildParameters.of("x86_64-unknown-linux-gnu", BuildConfiguration.DEBUG);

  @Rule public ExpectedException thrown = ExpectedException.none();

  /**
   * App and Core are root modules; both reach Utils, App once directly and once through Core.
   *
   * <pre>
   *   App -> Core -> [Utils] -> Base
   *   App ---------> [Utils]
   * </pre>
   */
  private static BuildPlan utilsReachedTwice() {
    GraphBuilder builder = new GraphBuilder();
    builder
        .rootPackage("app")
        .module(
            "App", ModuleKind.EXECUTABLE, moduleDep("Core"), productDep("Utils", "utilspkg"))
        .module("Core", productDep("Utils", "utilspkg"));
    builder
        .addPackage("utilspkg")
        .module("Utils", moduleDep("Base"))
        .module("Base")
        .product("Utils", "Utils");
    return plan(builder.build());
  }

  @Test
  public void traverseModulesReportsEveryPath() {
    List<String> visits = new ArrayList<>();
    utilsReachedTwice()
        .getTraversal()
        .traverseModules(
            (module, parent, depth) ->
                visits.add(
                    module.getModule().getName()
                        + "<"
                        + parent.map(p -> p.getModule().getName()).orElse("root")
                        + "@"
                        + depth));

    assertThat(
        visits,
        contains(
            "App<root@1",
            "Core<App@2",
            "Utils<Core@3",
            "Base<Utils@4",
            "Utils<App@2",
            "Base<Utils@3",
            "Core<root@1",
            "Utils<Core@2",
            "Base<Utils@3"));
  }

  @Test
  public void heightIsTheDeepestPosition() {
    ImmutableMap<BuildIdentity, Integer> heights =
        utilsReachedTwice().getTraversal().computeModuleHeights();

    assertThat(heights.get(target("app", "App")), equalTo(1));
    assertThat(heights.get(target("app", "Core")), equalTo(2));
    assertThat(heights.get(target("utilspkg", "Utils")), equalTo(3));
    assertThat(heights.get(target("utilspkg", "Base")), equalTo(4));
  }

  @Test
  public void recursiveDependenciesListEachNodeOnce() {
    BuildPlan plan = utilsReachedTwice();
    ModuleBuildDescription app = plan.getRequiredDescription(target("app", "App"));

    ImmutableList<DependencyEntry> entries = plan.getTraversal().recursiveDependencies(app);

    assertThat(
        entries.stream().map(DependencyEntry::toString).collect(ImmutableList.toImmutableList()),
        contains(
            "MODULE app/Core@target",
            "PRODUCT utilspkg:Utils@target",
            "MODULE utilspkg/Utils@target",
            "MODULE utilspkg/Base@target"));
    assertThat(entries.get(1).getKind(), equalTo(DependencyEntry.Kind.PRODUCT));
    assertThat(entries.get(1).getDescription(), equalTo(Optional.empty()));
    assertThat(entries.get(3).getDescription().get().getFinalName(), equalTo("Base"));
  }

  @Test
  public void recursiveDependenciesKeepOneEntryPerDestination() {
    BuildPlan plan = plan(DestinationPlannerTest.macroAndAppShareLibrary());
    ModuleBuildDescription app = plan.getRequiredDescription(target("app", "App"));

    ImmutableList<BuildIdentity> modules =
        plan.getTraversal()
            .recursiveDependencies(app)
            .stream()
            .filter(entry -> entry.getKind() == DependencyEntry.Kind.MODULE)
            .map(entry -> entry.getDescription().get().getIdentity())
            .collect(ImmutableList.toImmutableList());

    assertThat(
        modules,
        contains(
            BuildIdentity.of(id("app", "MyMacros"), Destination.HOST),
            BuildIdentity.of(id("swift-syntax", "SwiftSyntax"), Destination.HOST),
            BuildIdentity.of(id("swift-syntax", "SwiftSyntax"), Destination.TARGET)));
  }

  @Test
  public void traverseDependenciesVisitsOnlyDirectEdges() {
    BuildPlan plan = utilsReachedTwice();
    List<String> visited = new ArrayList<>();

    plan.getTraversal()
        .traverseDependencies(
            plan.getRequiredDescription(target("app", "App")),
            new GraphTraversal.DependencyVisitor() {
              @Override
              public void onProduct(ResolvedProduct product, Destination destination) {
                visited.add("product " + product.getName() + " " + destination);
              }

              @Override
              public void onModule(
                  ResolvedModule module,
                  Destination destination,
                  ModuleBuildDescription description) {
                visited.add("module " + description.getFinalName() + " " + destination);
              }
            });

    assertThat(visited, contains("module Core TARGET", "product Utils TARGET"));
  }

  @Test
  public void corruptedPlanWithCycleFailsFast() {
    ResolvedGraph graph = new GraphBuilder().build();
    BuildIdentity a = target("pkg", "A");
    BuildIdentity b = target("pkg", "B");
    BuildPlan corrupted =
        new BuildPlan(
            graph,
            null,
            TARGET,
            HOST,
            ImmutableList.<PlanNode>of(a),
            ImmutableMap.<PlanNode, ImmutableList<PlanNode>>of(
                a, ImmutableList.<PlanNode>of(b), b, ImmutableList.<PlanNode>of(a)),
            ImmutableMap.of(),
            ImmutableMap.of());

    thrown.expect(IllegalStateException.class);
    thrown.expectMessage("Cycle in build plan");
    corrupted.getTraversal().traverseModules((module, parent, depth) -> {});
  }

  private static BuildPlan plan(ResolvedGraph graph) {
    return new BuildPlanner(PlanConfig.createDefault())
        .plan(graph, TARGET, HOST)
        .getBuildPlanOrThrow();
  }

  private static BuildIdentity target(String packageIdentity, String name) {
    return BuildIdentity.of(id(packageIdentity, name), Destination.TARGET);
  }

  private static ModuleId id(String packageIdentity, String name) {
    return ModuleId.of(PackageIdentity.of(packageIdentity), name);
  }
}
