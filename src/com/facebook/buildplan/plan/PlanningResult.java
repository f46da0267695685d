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

import com.facebook.buildplan.diagnostics.Diagnostic;
import com.facebook.buildplan.diagnostics.DiagnosticKind;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** Diagnostics of one planning run, plus the plan if the run produced no errors. */
public class PlanningResult {

  private final ImmutableList<Diagnostic> diagnostics;
  private final Optional<BuildPlan> buildPlan;

  PlanningResult(ImmutableList<Diagnostic> diagnostics, Optional<BuildPlan> buildPlan) {
    this.diagnostics = diagnostics;
    this.buildPlan = buildPlan;
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public ImmutableList<Diagnostic> getDiagnostics(DiagnosticKind kind) {
    return diagnostics
        .stream()
        .filter(diagnostic -> diagnostic.getKind() == kind)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Diagnostic> getErrors() {
    return diagnostics
        .stream()
        .filter(Diagnostic::isError)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Diagnostic> getWarnings() {
    return diagnostics
        .stream()
        .filter(diagnostic -> !diagnostic.isError())
        .collect(ImmutableList.toImmutableList());
  }

  public boolean hasErrors() {
    return !getErrors().isEmpty();
  }

  public Optional<BuildPlan> getBuildPlan() {
    return buildPlan;
  }

  public BuildPlan getBuildPlanOrThrow() {
    if (!buildPlan.isPresent()) {
      throw new BuildPlanException(getErrors());
    }
    return buildPlan.get();
  }
}
