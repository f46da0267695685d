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

import com.facebook.buildplan.util.immutables.PlanStyleTuple;
import com.google.common.base.Preconditions;
import org.immutables.value.Value;

/**
 * A dependency edge together with its position in the declaring module's dependency list. Every
 * traversal orders sibling edges by {@link #getDeclarationIndex()}.
 */
@Value.Immutable(builder = false)
@PlanStyleTuple
abstract class AbstractDeclaredDependency implements Comparable<AbstractDeclaredDependency> {

  public abstract int getDeclarationIndex();

  public abstract DependencyEdge getEdge();

  @Value.Check
  protected void check() {
    Preconditions.checkArgument(getDeclarationIndex() >= 0, "Negative declaration index");
  }

  @Override
  public int compareTo(AbstractDeclaredDependency that) {
    return Integer.compare(this.getDeclarationIndex(), that.getDeclarationIndex());
  }
}
