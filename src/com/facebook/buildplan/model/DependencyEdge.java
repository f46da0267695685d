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

/**
 * A declared dependency of a module. There are exactly two kinds, {@link ModuleEdge} and {@link
 * ProductEdge}; code that needs to tell them apart goes through {@link Visitor}.
 */
public interface DependencyEdge {

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {

    /** A dependency on another module of the same package. */
    R visitModule(ModuleEdge edge);

    /** A dependency on a product, usually of another package. */
    R visitProduct(ProductEdge edge);
  }
}
