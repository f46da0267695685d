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

import com.facebook.buildplan.model.ModuleId;
import com.facebook.buildplan.util.immutables.PlanStyleTuple;
import com.google.common.collect.ComparisonChain;
import java.util.Locale;
import org.immutables.value.Value;

/** A module at a destination. The same module may be built once for each destination. */
@Value.Immutable(builder = false)
@PlanStyleTuple
abstract class AbstractBuildIdentity implements PlanNode, Comparable<AbstractBuildIdentity> {

  public abstract ModuleId getModule();

  @Override
  public abstract Destination getDestination();

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitModule((BuildIdentity) this);
  }

  @Override
  public int compareTo(AbstractBuildIdentity that) {
    return ComparisonChain.start()
        .compare(this.getModule(), that.getModule())
        .compare(this.getDestination(), that.getDestination())
        .result();
  }

  @Override
  public String toString() {
    return getModule() + "@" + getDestination().name().toLowerCase(Locale.ROOT);
  }
}
