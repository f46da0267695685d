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

public enum ProductKind {
  /** A library whose linkage is left to the build; it has no product build of its own. */
  LIBRARY,
  STATIC_LIBRARY,
  DYNAMIC_LIBRARY,
  EXECUTABLE,
  MACRO,
  PLUGIN,
  TEST,
  TOOL,
  ;

  public boolean isAlwaysHost() {
    return this == MACRO || this == PLUGIN || this == TOOL;
  }

  public boolean isMacroOrPlugin() {
    return this == MACRO || this == PLUGIN;
  }

  public boolean hasProductBuild() {
    return this != LIBRARY;
  }
}
