// This file is part of ChronoQL.
// Copyright (C) 2024  The ChronoQL Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.chronoql.query.plan;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.chronoql.configuration.Configuration;
import net.chronoql.configuration.UnitTestConfiguration;
import net.chronoql.utils.JSON;

public class TestSelectOptions {

  @Test
  public void builder() throws Exception {
    SelectOptions options = SelectOptions.newBuilder().build();
    assertEquals(0, options.getMaxBuckets());
    assertEquals(0, options.getMaxSeries());
    assertEquals(0, options.getMaxPoints());
    assertFalse(options.isDedupe());

    options = SelectOptions.newBuilder()
        .setMaxBuckets(100)
        .setMaxSeries(10)
        .setMaxPoints(5000)
        .setDedupe(true)
        .build();
    assertEquals(100, options.getMaxBuckets());
    assertEquals(10, options.getMaxSeries());
    assertEquals(5000, options.getMaxPoints());
    assertTrue(options.isDedupe());
    assertEquals("{maxBuckets=100, maxSeries=10, maxPoints=5000, "
        + "dedupe=true}", options.toString());

    try {
      SelectOptions.newBuilder().setMaxBuckets(-1).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      SelectOptions.newBuilder().setMaxSeries(-1).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      SelectOptions.newBuilder().setMaxPoints(-1).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void parse() throws Exception {
    SelectOptions options = JSON.parseToObject(
        "{\"maxBuckets\":250,\"maxPoints\":42,\"dedupe\":true,"
        + "\"someOtherField\":\"ignored\"}", SelectOptions.class);
    assertEquals(250, options.getMaxBuckets());
    assertEquals(0, options.getMaxSeries());
    assertEquals(42, options.getMaxPoints());
    assertTrue(options.isDedupe());

    options = JSON.parseToObject("{}", SelectOptions.class);
    assertEquals(0, options.getMaxBuckets());
    assertFalse(options.isDedupe());

    try {
      JSON.parseToObject("{\"maxBuckets\":-5}", SelectOptions.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void fromConfigurationDefaults() throws Exception {
    final Configuration config = UnitTestConfiguration.getConfiguration();
    final SelectOptions options = SelectOptions.fromConfiguration(config);
    assertEquals(0, options.getMaxBuckets());
    assertEquals(0, options.getMaxSeries());
    assertEquals(0, options.getMaxPoints());
    assertFalse(options.isDedupe());
    assertTrue(config.hasProperty(SelectOptions.MAX_BUCKETS_KEY));
    assertTrue(config.hasProperty(SelectOptions.DEDUPE_KEY));

    // registering twice is fine
    SelectOptions.fromConfiguration(config);
  }

  @Test
  public void fromConfigurationSettings() throws Exception {
    final Configuration config = UnitTestConfiguration.getConfiguration(
        ImmutableMap.of(
            SelectOptions.MAX_BUCKETS_KEY, "100",
            SelectOptions.MAX_SERIES_KEY, "25",
            SelectOptions.DEDUPE_KEY, "true"));
    SelectOptions options = SelectOptions.fromConfiguration(config);
    assertEquals(100, options.getMaxBuckets());
    assertEquals(25, options.getMaxSeries());
    assertEquals(0, options.getMaxPoints());
    assertTrue(options.isDedupe());

    config.addOverride(SelectOptions.MAX_BUCKETS_KEY, 500);
    options = SelectOptions.fromConfiguration(config);
    assertEquals(500, options.getMaxBuckets());
  }
}
