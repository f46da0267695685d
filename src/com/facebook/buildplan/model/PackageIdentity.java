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

import com.google.common.base.Preconditions;
import java.util.Locale;

/**
 * Identity of a package in the resolved graph. Identities compare case-insensitively: they are
 * normalized to lower case when created.
 */
public final class PackageIdentity implements Comparable<PackageIdentity> {

  private final String identity;

  private PackageIdentity(String identity) {
    this.identity = identity;
  }

  public static PackageIdentity of(String identity) {
    String normalized = identity.trim().toLowerCase(Locale.ROOT);
    Preconditions.checkArgument(!normalized.isEmpty(), "Empty package identity");
    return new PackageIdentity(normalized);
  }

  public String getIdentity() {
    return identity;
  }

  @Override
  public int compareTo(PackageIdentity that) {
    return this.identity.compareTo(that.identity);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof PackageIdentity)) {
      return false;
    }
    return identity.equals(((PackageIdentity) obj).identity);
  }

  @Override
  public int hashCode() {
    return identity.hashCode();
  }

  @Override
  public String toString() {
    return identity;
  }
}
