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

package com.facebook.buildplan.alias;

import com.facebook.buildplan.model.ResolvedModule;

/**
 * Answers whether renaming a module renames every symbol its sources define. Source discovery
 * happens before planning, so implementations only consult already-classified sources.
 */
@FunctionalInterface
public interface SourceSubstitutability {

  /** Trusts the source kinds recorded on the module. */
  SourceSubstitutability DECLARED_SOURCES = ResolvedModule::hasOnlySubstitutableSources;

  boolean hasOnlySubstitutableSources(ResolvedModule module);
}
