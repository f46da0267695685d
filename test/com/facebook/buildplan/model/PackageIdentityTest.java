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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

import com.google.common.collect.ImmutableSortedSet;
import org.junit.Test;

public class PackageIdentityTest {

  @Test
  public void identitiesAreCaseInsensitive() {
    assertThat(PackageIdentity.of("FooPkg"), equalTo(PackageIdentity.of("foopkg")));
    assertThat(PackageIdentity.of(" Swift-Log ").getIdentity(), equalTo("swift-log"));
  }

  @Test
  public void identitiesSortLexicographically() {
    ImmutableSortedSet<PackageIdentity> sorted =
        ImmutableSortedSet.of(
            PackageIdentity.of("zpkg"), PackageIdentity.of("Apkg"), PackageIdentity.of("mpkg"));
    assertThat(
        sorted,
        contains(
            PackageIdentity.of("apkg"), PackageIdentity.of("mpkg"), PackageIdentity.of("zpkg")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void emptyIdentityIsRejected() {
    PackageIdentity.of("  ");
  }
}
