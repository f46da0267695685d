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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import org.junit.Test;

public class AliasMapTest {

  @Test
  public void lookupsByOriginalName() {
    AliasMap map = AliasMap.of(ImmutableMap.of("Utils", "AppUtils", "Log", "AppLog"));

    assertThat(map.get("Utils"), equalTo(Optional.of("AppUtils")));
    assertThat(map.get("AppUtils"), equalTo(Optional.empty()));
    assertTrue(map.containsKey("Log"));
    assertTrue(map.containsValue("AppLog"));
    assertFalse(map.containsValue("Log"));
    assertThat(map.size(), equalTo(2));
  }

  @Test
  public void entriesAreSortedByOriginalName() {
    AliasMap map = AliasMap.of(ImmutableMap.of("Zed", "A", "Alpha", "B"));

    assertThat(map.asMap().keySet(), contains("Alpha", "Zed"));
    assertThat(map.toString(), equalTo("{Alpha=B, Zed=A}"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void twoNamesCannotShareAnAlias() {
    AliasMap.of(ImmutableMap.of("Utils", "Shared", "Log", "Shared"));
  }

  @Test
  public void mapsWithSameEntriesAreEqual() {
    assertThat(
        AliasMap.of("Utils", "AppUtils"),
        equalTo(AliasMap.of(ImmutableMap.of("Utils", "AppUtils"))));
    assertTrue(AliasMap.of(ImmutableMap.of()).isEmpty());
  }
}
