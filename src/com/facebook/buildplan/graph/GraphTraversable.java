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

package com.facebook.buildplan.graph;

import java.util.Iterator;

/** Supplies the children of a node to the traversals in this package. */
@FunctionalInterface
public interface GraphTraversable<T> {

  /**
   * @return the child nodes of {@code node}, in the order they should be explored. Not allowed to
   *     contain {@code null}.
   */
  Iterator<T> findChildren(T node);
}
