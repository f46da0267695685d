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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.Optional;

/**
 * Module-scoped mapping from the name a module uses for one of its modules (usually the original
 * name) to the name that module is actually built under. No two keys share a value.
 */
public final class AliasMap {

  private final ImmutableSortedMap<String, String> entries;

  private AliasMap(ImmutableSortedMap<String, String> entries) {
    this.entries = entries;
  }

  public static AliasMap of(Map<String, String> entries) {
    Preconditions.checkArgument(
        entries.values().stream().distinct().count() == entries.size(),
        "Alias map %s maps two names to the same alias",
        entries);
    return new AliasMap(ImmutableSortedMap.copyOf(entries));
  }

  public static AliasMap of(String originalName, String alias) {
    return new AliasMap(ImmutableSortedMap.of(originalName, alias));
  }

  public Optional<String> get(String originalName) {
    return Optional.ofNullable(entries.get(originalName));
  }

  public boolean containsKey(String originalName) {
    return entries.containsKey(originalName);
  }

  public boolean containsValue(String alias) {
    return entries.containsValue(alias);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public ImmutableSortedMap<String, String> asMap() {
    return entries;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof AliasMap && entries.equals(((AliasMap) obj).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
