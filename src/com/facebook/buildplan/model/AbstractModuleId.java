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
import com.google.common.collect.ComparisonChain;
import org.immutables.value.Value;

/** Key of a module in the resolved graph: its package plus its original (unaliased) name. */
@Value.Immutable(builder = false)
@PlanStyleTuple
abstract class AbstractModuleId implements Comparable<AbstractModuleId> {

  public abstract PackageIdentity getPackageIdentity();

  public abstract String getName();

  @Override
  public int compareTo(AbstractModuleId that) {
    if (this == that) {
      return 0;
    }
    return ComparisonChain.start()
        .compare(this.getPackageIdentity(), that.getPackageIdentity())
        .compare(this.getName(), that.getName())
        .result();
  }

  @Override
  public String toString() {
    return getPackageIdentity() + "/" + getName();
  }
}
