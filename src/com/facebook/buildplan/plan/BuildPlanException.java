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
import com.facebook.buildplan.util.HumanReadableException;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** Thrown when a caller asks for the build plan of a planning run that produced errors. */
@SuppressWarnings("serial")
public class BuildPlanException extends HumanReadableException {

  private final ImmutableList<Diagnostic> errors;

  public BuildPlanException(ImmutableList<Diagnostic> errors) {
    super(
        "No build plan was produced (%d error(s)):\n  %s",
        errors.size(),
        Joiner.on("\n  ").join(errors));
    this.errors = errors;
  }

  public ImmutableList<Diagnostic> getErrors() {
    return errors;
  }
}
