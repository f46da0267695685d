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

import com.facebook.buildplan.model.ProductId;
import com.facebook.buildplan.model.ProductKind;
import com.facebook.buildplan.util.immutables.PlanStyleImmutable;
import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;

/** A linked or bundled product at one destination, backed by module builds at that destination. */
@Value.Immutable
@PlanStyleImmutable
abstract class AbstractProductBuildDescription {

  public abstract ProductIdentity getIdentity();

  public abstract ProductKind getKind();

  public abstract BuildParameters getBuildParameters();

  public abstract String getArtifactName();

  /** The module builds the product is made of, in export order. */
  public abstract ImmutableList<BuildIdentity> getModules();

  public ProductId getProductId() {
    return getIdentity().getProduct();
  }

  public String getName() {
    return getProductId().getName();
  }

  public Destination getDestination() {
    return getIdentity().getDestination();
  }

  public String getArtifactKey() {
    return getBuildParameters().getBuildDirectoryName() + "/" + getArtifactName();
  }

  @Override
  public String toString() {
    return getIdentity() + " as " + getArtifactKey();
  }
}
