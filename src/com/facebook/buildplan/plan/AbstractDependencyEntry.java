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

import com.facebook.buildplan.model.ResolvedProduct;
import com.facebook.buildplan.util.immutables.PlanStyleImmutable;
import com.google.common.base.Preconditions;
import java.util.Locale;
import java.util.Optional;
import org.immutables.value.Value;

/** One element of {@link GraphTraversal#recursiveDependencies(ModuleBuildDescription)}. */
@Value.Immutable
@PlanStyleImmutable
abstract class AbstractDependencyEntry {

  public enum Kind {
    PRODUCT,
    MODULE,
  }

  public abstract Kind getKind();

  public abstract Destination getDestination();

  public abstract Optional<ResolvedProduct> getProduct();

  /** Present for {@link Kind#MODULE} entries; products have no module build of their own. */
  public abstract Optional<ModuleBuildDescription> getDescription();

  @Value.Check
  protected void check() {
    if (getKind() == Kind.PRODUCT) {
      Preconditions.checkState(getProduct().isPresent() && !getDescription().isPresent());
    } else {
      Preconditions.checkState(getDescription().isPresent() && !getProduct().isPresent());
    }
  }

  public static DependencyEntry ofProduct(ResolvedProduct product, Destination destination) {
    return DependencyEntry.builder()
        .setKind(Kind.PRODUCT)
        .setDestination(destination)
        .setProduct(product)
        .build();
  }

  public static DependencyEntry ofModule(ModuleBuildDescription description) {
    return DependencyEntry.builder()
        .setKind(Kind.MODULE)
        .setDestination(description.getDestination())
        .setDescription(description)
        .build();
  }

  @Override
  public String toString() {
    return getKind()
        + " "
        + (getKind() == Kind.PRODUCT
            ? getProduct().get().getId() + "@" + getDestination().name().toLowerCase(Locale.ROOT)
            : getDescription().get().getIdentity());
  }
}
