// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.rollupdb.application.modules;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.google.inject.name.Names;

import com.rollupdb.base.MorePreconditions;
import com.rollupdb.tsdb.BaseTsdb;
import com.rollupdb.tsdb.DummyTsdb;
import com.rollupdb.tsdb.RollupSchedule;
import com.rollupdb.tsdb.Tsdb;
import com.rollupdb.tsdb.memory.InMemoryTsdb;
import com.rollupdb.util.Clock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Binding module for the time-series database.
 *
 * This module reads two properties:
 * <ul>
 *   <li>{@code tsdb.rollups} - Rollup schedule, e.g. {@code 10s:360,1h:168}.  Defaults to
 *       {@link RollupSchedule#DEFAULT}.
 *   <li>{@code tsdb.backend} - One of {@code memory} or {@code dummy}.  Defaults to
 *       {@code memory}.
 * </ul>
 *
 * Bindings provided by this module:
 * <ul>
 *   <li>{@code @Named(BaseTsdb.ROLLUPS) RollupSchedule} - The rollup schedule.
 *   <li>{@code Clock} - The clock writes are stamped with.
 *   <li>{@code Tsdb} - The configured backend, as a singleton.
 * </ul>
 */
public class TsdbModule extends AbstractModule {

  private static final Logger LOG = Logger.getLogger(TsdbModule.class.getName());

  public static final String ROLLUPS_PROPERTY = "tsdb.rollups";
  public static final String BACKEND_PROPERTY = "tsdb.backend";

  private static final String DEFAULT_BACKEND = "memory";

  private static final Map<String, Class<? extends Tsdb>> BACKENDS =
      ImmutableMap.<String, Class<? extends Tsdb>>of(
          "memory", InMemoryTsdb.class,
          "dummy", DummyTsdb.class);

  private final RollupSchedule schedule;
  private final Class<? extends Tsdb> backend;
  private final Clock clock;

  /**
   * Creates a module binding an in-memory database with the default schedule.
   */
  public TsdbModule() {
    this(RollupSchedule.DEFAULT, InMemoryTsdb.class, Clock.SYSTEM_CLOCK);
  }

  public TsdbModule(RollupSchedule schedule, Class<? extends Tsdb> backend, Clock clock) {
    this.schedule = checkNotNull(schedule);
    this.backend = checkNotNull(backend);
    this.clock = checkNotNull(clock);
  }

  /**
   * Creates a module configured from properties.
   *
   * @param properties Properties to read {@code tsdb.*} settings from.
   * @return The configured module.
   * @throws IllegalArgumentException if a setting is malformed
   */
  public static TsdbModule fromProperties(Properties properties) {
    checkNotNull(properties);

    String rollups = properties.getProperty(ROLLUPS_PROPERTY);
    RollupSchedule schedule = rollups == null
        ? RollupSchedule.DEFAULT
        : RollupSchedule.parse(rollups);

    String backendName = properties.getProperty(BACKEND_PROPERTY, DEFAULT_BACKEND).trim();
    Class<? extends Tsdb> backend = BACKENDS.get(backendName);
    Preconditions.checkArgument(backend != null, "Unknown tsdb backend '%s', expected one of %s",
        backendName, BACKENDS.keySet());

    LOG.info(String.format("Configured %s tsdb with rollups %s", backendName, schedule));
    return new TsdbModule(schedule, backend, Clock.SYSTEM_CLOCK);
  }

  /**
   * Creates a module configured from a properties file on the classpath.  A missing resource
   * leaves every setting at its default.
   *
   * @param resourcePath The resource path to read properties from.
   * @return The configured module.
   * @throws IOException if the resource exists but could not be read
   */
  public static TsdbModule fromResource(String resourcePath) throws IOException {
    MorePreconditions.checkNotBlank(resourcePath);

    Properties properties = new Properties();
    InputStream in = TsdbModule.class.getClassLoader().getResourceAsStream(resourcePath);
    if (in == null) {
      LOG.warning("No tsdb properties at " + resourcePath + ", using defaults");
    } else {
      try {
        properties.load(in);
      } finally {
        in.close();
      }
    }
    return fromProperties(properties);
  }

  @VisibleForTesting
  RollupSchedule getSchedule() {
    return schedule;
  }

  @VisibleForTesting
  Class<? extends Tsdb> getBackend() {
    return backend;
  }

  @Override
  protected void configure() {
    bind(RollupSchedule.class)
        .annotatedWith(Names.named(BaseTsdb.ROLLUPS))
        .toInstance(schedule);
    bind(Clock.class).toInstance(clock);
    bind(Tsdb.class).to(backend).in(Singleton.class);
  }
}
