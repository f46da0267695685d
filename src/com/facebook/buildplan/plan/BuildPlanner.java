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
import com.facebook.buildplan.alias.AliasResolver;
import com.facebook.buildplan.alias.SourceSubstitutability;
import com.facebook.buildplan.config.PlanConfig;
import com.facebook.buildplan.diagnostics.DiagnosticCollector;
import com.facebook.buildplan.diagnostics.FatalPlanningException;
import com.facebook.buildplan.log.Logger;
import com.facebook.buildplan.model.ResolvedGraph;
import java.util.Optional;

/**
 * Entry point of the planning layer: resolves module aliases, then assigns destinations and builds
 * the per-identity descriptions. Each call to {@link #plan} is independent.
 */
public class BuildPlanner {

  private static final Logger LOG = Logger.get(BuildPlanner.class);

  private final PlanConfig config;
  private final SourceSubstitutability substitutability;

  public BuildPlanner(PlanConfig config) {
    this(config, SourceSubstitutability.DECLARED_SOURCES);
  }

  public BuildPlanner(PlanConfig config, SourceSubstitutability substitutability) {
    this.config = config;
    this.substitutability = substitutability;
  }

  /** Plans with the build parameters from the {@code [build]} section of the configuration. */
  public PlanningResult plan(ResolvedGraph graph) {
    return plan(graph, config.getTargetBuildParameters(), config.getHostBuildParameters());
  }

  public PlanningResult plan(
      ResolvedGraph graph, BuildParameters targetParameters, BuildParameters hostParameters) {
    LOG.debug(
        "Planning %d modules for target %s and host %s.",
        graph.getSize(),
        targetParameters,
        hostParameters);
    DiagnosticCollector diagnostics = new DiagnosticCollector();
    try {
      AliasResolution aliasResolution =
          new AliasResolver(graph, config, substitutability, diagnostics).resolve();
      if (diagnostics.hasErrors()) {
        LOG.info(
            "Alias resolution reported %d error(s), not assigning destinations.",
            diagnostics.getErrorCount());
        return new PlanningResult(diagnostics.getDiagnostics(), Optional.empty());
      }

      BuildPlan buildPlan =
          new DestinationPlanner(
                  graph,
                  aliasResolution,
                  targetParameters,
                  hostParameters,
                  config.getHostQualifier())
              .plan();
      return new PlanningResult(diagnostics.getDiagnostics(), Optional.of(buildPlan));
    } catch (FatalPlanningException e) {
      LOG.debug(e, "Planning aborted.");
      diagnostics.emit(e.getDiagnostic());
      return new PlanningResult(diagnostics.getDiagnostics(), Optional.empty());
    }
  }
}
