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

import com.facebook.buildplan.model.PackageIdentity;
import com.facebook.buildplan.util.immutables.PlanStyleImmutable;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A structured problem report. Only the fields relevant to {@link #getKind()} are set; turning a
 * diagnostic into prose is left to whoever displays it.
 */
@Value.Immutable
@PlanStyleImmutable
abstract class AbstractDiagnostic {

  public abstract DiagnosticKind getKind();

  /** The package the problem is attributed to. */
  public abstract Optional<PackageIdentity> getPackageIdentity();

  public abstract Optional<String> getProduct();

  public abstract Optional<String> getModule();

  /** The original module name an alias request was made for. */
  public abstract Optional<String> getOriginalName();

  /** The requested or conflicting alias values, in the order they were found. */
  public abstract ImmutableList<String> getAliases();

  /** Packages involved in a conflict, sorted. */
  public abstract ImmutableList<PackageIdentity> getPackages();

  /** Nodes involved in a structural problem, e.g. the members of a cycle. */
  public abstract ImmutableList<String> getPath();

  public Severity getSeverity() {
    return getKind().getSeverity();
  }

  public boolean isError() {
    return getSeverity() == Severity.ERROR;
  }

  @Override
  public String toString() {
    List<String> fields = new ArrayList<>();
    getPackageIdentity().ifPresent(value -> fields.add("package=" + value));
    getProduct().ifPresent(value -> fields.add("product=" + value));
    getModule().ifPresent(value -> fields.add("module=" + value));
    getOriginalName().ifPresent(value -> fields.add("original=" + value));
    if (!getAliases().isEmpty()) {
      fields.add("aliases=" + getAliases());
    }
    if (!getPackages().isEmpty()) {
      fields.add("packages=" + getPackages());
    }
    if (!getPath().isEmpty()) {
      fields.add("path=" + Joiner.on(" -> ").join(getPath()));
    }
    return String.format("%s %s{%s}", getSeverity(), getKind(), Joiner.on(", ").join(fields));
  }
}
