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

import com.facebook.buildplan.log.Logger;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the diagnostics of one planning run so that independent problems are all reported
 * together. Not thread safe; planning is single threaded.
 */
public class DiagnosticCollector {

  private static final Logger LOG = Logger.get(DiagnosticCollector.class);

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public void emit(Diagnostic diagnostic) {
    if (diagnostic.isError()) {
      LOG.error("%s", diagnostic);
    } else {
      LOG.warn("%s", diagnostic);
    }
    diagnostics.add(diagnostic);
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }

  public int getErrorCount() {
    return (int) diagnostics.stream().filter(Diagnostic::isError).count();
  }

  public ImmutableList<Diagnostic> getDiagnostics(DiagnosticKind kind) {
    return diagnostics
        .stream()
        .filter(diagnostic -> diagnostic.getKind() == kind)
        .collect(ImmutableList.toImmutableList());
  }
}
