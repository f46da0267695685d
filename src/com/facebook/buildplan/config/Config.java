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

import com.facebook.buildplan.log.Logger;
import com.facebook.buildplan.util.HumanReadableException;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Structured representation of data read from a stack of {@code .ini} files, where each file can
 * override values defined by the previous ones.
 */
public class Config {

  private static final Logger LOG = Logger.get(Config.class);

  private final ImmutableMap<String, ImmutableMap<String, String>> sectionToEntries;

  @SafeVarargs
  public Config(ImmutableMap<String, ImmutableMap<String, String>>... maps) {
    this(ImmutableList.copyOf(maps));
  }

  public Config(
      ImmutableList<ImmutableMap<String, ImmutableMap<String, String>>> sectionToEntries) {
    this.sectionToEntries = sectionToEntriesFromMaps(sectionToEntries);
  }

  /**
   * Reads each of {@code files} in order, later files overriding earlier ones, then applies
   * {@code overrides} on top.
   */
  public static Config createFromFiles(
      Iterable<Path> files, ImmutableMap<String, ImmutableMap<String, String>> overrides)
      throws IOException {
    ImmutableList.Builder<ImmutableMap<String, ImmutableMap<String, String>>> builder =
        ImmutableList.builder();
    for (Path file : files) {
      try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        ImmutableMap<String, ImmutableMap<String, String>> parsedConfiguration = Inis.read(reader);
        LOG.debug("Loaded a configuration file %s: %s", file, parsedConfiguration);
        builder.add(parsedConfiguration);
      }
    }
    LOG.debug("Adding configuration overrides: %s", overrides);
    builder.add(overrides);
    return new Config(builder.build());
  }

  public static Config createFromReader(Reader reader) throws IOException {
    return new Config(Inis.read(reader));
  }

  private static ImmutableMap<String, ImmutableMap<String, String>> sectionToEntriesFromMaps(
      ImmutableList<ImmutableMap<String, ImmutableMap<String, String>>> maps) {
    Map<String, Map<String, String>> sectionToEntries = new LinkedHashMap<>();
    for (ImmutableMap<String, ImmutableMap<String, String>> map : maps) {
      for (Map.Entry<String, ImmutableMap<String, String>> section : map.entrySet()) {
        sectionToEntries
            .computeIfAbsent(section.getKey(), key -> new LinkedHashMap<>())
            .putAll(section.getValue());
      }
    }

    ImmutableMap.Builder<String, ImmutableMap<String, String>> builder = ImmutableMap.builder();
    for (Map.Entry<String, Map<String, String>> entry : sectionToEntries.entrySet()) {
      builder.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    return builder.build();
  }

  public ImmutableMap<String, ImmutableMap<String, String>> getSectionToEntries() {
    return sectionToEntries;
  }

  public ImmutableMap<String, String> get(String sectionName) {
    ImmutableMap<String, String> section = sectionToEntries.get(sectionName);
    return section == null ? ImmutableMap.of() : section;
  }

  public Optional<String> getValue(String sectionName, String propertyName) {
    String value = get(sectionName).get(propertyName);
    if (value == null) {
      return Optional.empty();
    }
    value = value.trim();
    return value.isEmpty() ? Optional.empty() : Optional.of(value);
  }

  public boolean getBooleanValue(String sectionName, String propertyName, boolean defaultValue) {
    Optional<String> value = getValue(sectionName, propertyName);
    if (!value.isPresent()) {
      return defaultValue;
    }
    switch (value.get().toLowerCase(Locale.US)) {
      case "true":
      case "yes":
        return true;
      case "false":
      case "no":
        return false;
      default:
        throw new HumanReadableException(
            "Unknown value for %s in [%s]: %s; should be yes/no true/false!",
            propertyName,
            sectionName,
            value.get());
    }
  }

  public <T extends Enum<T>> Optional<T> getEnum(
      String sectionName, String propertyName, Class<T> clazz) {
    Optional<String> value = getValue(sectionName, propertyName);
    if (!value.isPresent()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Enum.valueOf(clazz, value.get().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      throw new HumanReadableException(
          e,
          "Section [%s] configuration key '%s' should be one of %s, not '%s'.",
          sectionName,
          propertyName,
          ImmutableList.copyOf(clazz.getEnumConstants()),
          value.get());
    }
  }

  public String getRequiredValue(String sectionName, String propertyName) {
    return getValue(sectionName, propertyName)
        .orElseThrow(
            () ->
                new HumanReadableException(
                    ".ini file must set a value for %s in [%s].", propertyName, sectionName));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Config)) {
      return false;
    }
    Config that = (Config) obj;
    return Objects.equal(this.sectionToEntries, that.sectionToEntries);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(sectionToEntries);
  }
}
