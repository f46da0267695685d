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

import com.facebook.buildplan.util.immutables.PlanStyleImmutable;
import com.google.common.collect.ImmutableMap;
import org.immutables.value.Value;

/**
 * A dependency on a product. The depending module may ask for some of the modules in the product's
 * graph to be renamed: {@link #getRequestedAliases()} maps an original module name to its new
 * name.
 */
@Value.Immutable
@PlanStyleImmutable
abstract class AbstractProductEdge implements DependencyEdge {

  public abstract String getProductName();

  public abstract PackageIdentity getPackageIdentity();

  public abstract ImmutableMap<String, String> getRequestedAliases();

  public static ProductEdge of(String productName, PackageIdentity packageIdentity) {
    return ProductEdge.builder()
        .setProductName(productName)
        .setPackageIdentity(packageIdentity)
        .build();
  }

  @Value.Lazy
  public ProductId getProductId() {
    return ProductId.of(getPackageIdentity(), getProductName());
  }

  public boolean hasRequestedAliases() {
    return !getRequestedAliases().isEmpty();
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitProduct((ProductEdge) this);
  }

  @Override
  public String toString() {
    return hasRequestedAliases()
        ? String.format("product %s aliasing %s", getProductId(), getRequestedAliases())
        : String.format("product %s", getProductId());
  }
}
