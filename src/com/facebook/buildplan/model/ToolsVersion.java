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

import com.facebook.buildplan.util.HumanReadableException;
import com.google.common.base.Splitter;
import com.google.common.collect.ComparisonChain;
import java.util.List;
import java.util.Objects;

/** The tools version a package was authored against, e.g. {@code 5.9} or {@code 5.2.1}. */
public final class ToolsVersion implements Comparable<ToolsVersion> {

  /** Tools version assumed for packages that do not declare one. */
  public static final ToolsVersion CURRENT = new ToolsVersion(5, 9, 0);

  private final int major;
  private final int minor;
  private final int patch;

  private ToolsVersion(int major, int minor, int patch) {
    this.major = major;
    this.minor = minor;
    this.patch = patch;
  }

  public static ToolsVersion of(int major, int minor) {
    return of(major, minor, 0);
  }

  public static ToolsVersion of(int major, int minor, int patch) {
    if (major < 0 || minor < 0 || patch < 0) {
      throw new IllegalArgumentException(
          String.format("Negative component in tools version %d.%d.%d", major, minor, patch));
    }
    return new ToolsVersion(major, minor, patch);
  }

  public static ToolsVersion parse(String version) {
    List<String> parts = Splitter.on('.').trimResults().splitToList(version.trim());
    if (parts.isEmpty() || parts.size() > 3) {
      throw new HumanReadableException("Invalid tools version '%s'.", version);
    }
    int[] components = new int[3];
    for (int i = 0; i < parts.size(); i++) {
      try {
        components[i] = Integer.parseInt(parts.get(i));
      } catch (NumberFormatException e) {
        throw new HumanReadableException(e, "Invalid tools version '%s'.", version);
      }
      if (components[i] < 0) {
        throw new HumanReadableException("Invalid tools version '%s'.", version);
      }
    }
    return new ToolsVersion(components[0], components[1], components[2]);
  }

  public int getMajor() {
    return major;
  }

  public int getMinor() {
    return minor;
  }

  public int getPatch() {
    return patch;
  }

  public boolean isAtLeast(ToolsVersion other) {
    return compareTo(other) >= 0;
  }

  @Override
  public int compareTo(ToolsVersion that) {
    return ComparisonChain.start()
        .compare(this.major, that.major)
        .compare(this.minor, that.minor)
        .compare(this.patch, that.patch)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ToolsVersion)) {
      return false;
    }
    ToolsVersion that = (ToolsVersion) obj;
    return major == that.major && minor == that.minor && patch == that.patch;
  }

  @Override
  public int hashCode() {
    return Objects.hash(major, minor, patch);
  }

  @Override
  public String toString() {
    return patch == 0 ? major + "." + minor : major + "." + minor + "." + patch;
  }
}
