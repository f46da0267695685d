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

package com.facebook.buildplan.config;

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.Reader;
import java.util.Map;
import org.ini4j.Ini;
import org.ini4j.Profile;

/** Reads {@code .ini} content into a section → (key → value) map. */
public class Inis {

  private Inis() {}

  public static ImmutableMap<String, ImmutableMap<String, String>> read(Reader reader)
      throws IOException {
    Ini ini = new Ini();
    org.ini4j.Config config = new org.ini4j.Config();
    config.setEscape(false);
    config.setEscapeNewline(true);
    ini.setConfig(config);
    ini.load(reader);

    ImmutableMap.Builder<String, ImmutableMap<String, String>> sectionsToEntries =
        ImmutableMap.builder();
    for (Map.Entry<String, Profile.Section> section : ini.entrySet()) {
      ImmutableMap.Builder<String, String> entries = ImmutableMap.builder();
      for (String key : section.getValue().keySet()) {
        String value = section.getValue().get(key);
        entries.put(key, value == null ? "" : value);
      }
      sectionsToEntries.put(section.getKey(), entries.build());
    }
    return sectionsToEntries.build();
  }
}
