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

package com.facebook.buildplan.diagnostics;

/**
 * Raised inside the planner when a problem makes the rest of the run meaningless. The planner
 * entry point turns it back into a {@link Diagnostic}; it never reaches callers of the planner.
 */
@SuppressWarnings("serial")
public class FatalPlanningException extends Exception {

  private final Diagnostic diagnostic;

  public FatalPlanningException(Diagnostic diagnostic) {
    super(diagnostic.toString());
    this.diagnostic = diagnostic;
  }

  public FatalPlanningException(Diagnostic diagnostic, Throwable cause) {
    super(diagnostic.toString(), cause);
    this.diagnostic = diagnostic;
  }

  public Diagnostic getDiagnostic() {
    return diagnostic;
  }
}
