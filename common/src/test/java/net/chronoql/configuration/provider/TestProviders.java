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
package net.chronoql.configuration.provider;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.io.Files;

import net.chronoql.configuration.ConfigurationException;
import net.chronoql.configuration.ConfigurationOverride;

public class TestProviders {

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void propertiesFile() throws Exception {
    final File file = folder.newFile("chronoql.conf");
    Files.asCharSink(file, StandardCharsets.UTF_8).write(
        "query.select.max_buckets = 100 \n"
        + "# comment\n"
        + "query.select.dedupe=true\n");

    final PropertiesFileProvider provider =
        new PropertiesFileProvider(file.getPath());
    assertEquals(file.getPath(), provider.source());

    final ConfigurationOverride setting =
        provider.getSetting("query.select.max_buckets");
    assertEquals("100", setting.getValue());
    assertEquals(file.getPath(), setting.getSource());
    assertEquals("true",
        provider.getSetting("query.select.dedupe").getValue());
    assertNull(provider.getSetting("query.select.max_points"));
    provider.close();
  }

  @Test
  public void propertiesFileErrors() throws Exception {
    try {
      new PropertiesFileProvider(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new PropertiesFileProvider("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new PropertiesFileProvider(new File(folder.getRoot(), "nope.conf")
          .getPath());
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  @Test
  public void environment() throws Exception {
    assertEquals("QUERY_SELECT_MAX_BUCKETS",
        EnvironmentProvider.toEnvironmentKey("query.select.max_buckets"));

    final EnvironmentProvider provider = new EnvironmentProvider() {
      @Override
      protected String getenv(final String key) {
        return "QUERY_SELECT_MAX_BUCKETS".equals(key) ? "42" : null;
      }
    };
    final ConfigurationOverride setting =
        provider.getSetting("query.select.max_buckets");
    assertEquals("42", setting.getValue());
    assertEquals(EnvironmentProvider.SOURCE, setting.getSource());
    assertNull(provider.getSetting("query.select.dedupe"));
  }

  @Test
  public void systemProperties() throws Exception {
    final String key = "chronoql.test.provider." + System.nanoTime();
    final SystemPropertiesProvider provider = new SystemPropertiesProvider();
    assertNull(provider.getSetting(key));
    System.setProperty(key, "foo");
    try {
      final ConfigurationOverride setting = provider.getSetting(key);
      assertEquals("foo", setting.getValue());
      assertEquals(SystemPropertiesProvider.SOURCE, setting.getSource());
    } finally {
      System.clearProperty(key);
    }
  }
}
