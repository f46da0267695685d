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

/** Every problem the planner can report. Fatal kinds abort planning as soon as they are found. */
public enum DiagnosticKind {
  /** A requested alias is empty or not a valid identifier. */
  INVALID_ALIAS_IDENTIFIER(Severity.ERROR, false),
  /** Independent requests give one module (or one alias map key) different names. */
  CONFLICTING_ALIAS_REQUEST(Severity.ERROR, false),
  /** One module asks for two different names for the same module of one package. */
  AMBIGUOUS_ALIAS_IN_PRODUCT(Severity.ERROR, false),
  /** An aliased module has sources whose symbols keep their original names. */
  NON_SUBSTITUTABLE_SOURCES_ALIASED(Severity.WARNING, false),
  /** An alias request never matched any module. */
  UNAPPLIED_ALIAS(Severity.WARNING, false),
  /** Two packages' products share a name and aliasing does not tell them apart. */
  DUPLICATE_PRODUCT_NAME(Severity.ERROR, false),
  /** Two modules end up with the same name after aliasing. */
  DUPLICATE_MODULE_NAME(Severity.ERROR, false),
  /** A package involved in a naming conflict is too old to take part in aliasing. */
  TOOLS_VERSION_TOO_OLD_FOR_ALIASING(Severity.WARNING, false),
  /** Two build identities would produce the same artifacts. */
  DESTINATION_CONFLICT(Severity.ERROR, true),
  /** The dependency graph is not acyclic. */
  CYCLIC_DEPENDENCY(Severity.ERROR, true),
  ;

  private final Severity severity;
  private final boolean fatal;

  DiagnosticKind(Severity severity, boolean fatal) {
    this.severity = severity;
    this.fatal = fatal;
  }

  public Severity getSeverity() {
    return severity;
  }

  public boolean isFatal() {
    return fatal;
  }
}
