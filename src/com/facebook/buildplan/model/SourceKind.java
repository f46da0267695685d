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

/** Classification of the sources in a module, as far as renaming its symbols is concerned. */
public enum SourceKind {
  /** Sources whose symbols follow the module name and are renamed with it. */
  NATIVE,
  /** Sources (C, assembly, ...) whose symbol names stay the same when the module is renamed. */
  FOREIGN,
}
