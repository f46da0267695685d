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

/** A node of the destination-annotated graph: either a module or a product at a destination. */
public interface PlanNode {

  Destination getDestination();

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitModule(BuildIdentity identity);

    R visitProduct(ProductIdentity identity);
  }
}
