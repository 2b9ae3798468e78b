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

package com.rollupdb.tsdb.memory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.inject.Inject;
import com.google.inject.name.Named;

import com.rollupdb.tsdb.BaseTsdb;
import com.rollupdb.tsdb.DataPoint;
import com.rollupdb.tsdb.Environment;
import com.rollupdb.tsdb.MetricKind;
import com.rollupdb.tsdb.RollupSchedule;
import com.rollupdb.tsdb.RollupSeries;
import com.rollupdb.tsdb.ScoreTable;
import com.rollupdb.util.Clock;

/**
 * An in-memory time-series database.
 *
 * <p>WARNING: Buckets are never evicted, regardless of the retention configured in the
 * schedule, so memory use grows without bound.  Use this for tests and single process tooling,
 * not as production storage.
 */
public class InMemoryTsdb extends BaseTsdb {

  private static final Logger LOG = Logger.getLogger(InMemoryTsdb.class.getName());

  private final BucketTable<Long> counters = new BucketTable<Long>("counters") {
    @Override protected Long emptyValue() {
      return 0L;
    }
    @Override protected Long combine(@Nullable Long existing, Long update) {
      return existing == null ? update : existing + update;
    }
    @Override protected Long snapshot(Long value) {
      return value;
    }
  };

  private final BucketTable<Set<String>> sets = new BucketTable<Set<String>>("sets") {
    @Override protected Set<String> emptyValue() {
      return ImmutableSet.of();
    }
    @Override protected Set<String> combine(@Nullable Set<String> existing, Set<String> update) {
      Set<String> combined = existing == null ? Sets.<String>newHashSet() : existing;
      combined.addAll(update);
      return combined;
    }
    @Override protected Set<String> snapshot(Set<String> value) {
      return ImmutableSet.copyOf(value);
    }
  };

  private final BucketTable<ScoreTable> frequencies = new BucketTable<ScoreTable>("frequencies") {
    @Override protected ScoreTable emptyValue() {
      return new ScoreTable();
    }
    @Override protected ScoreTable combine(@Nullable ScoreTable existing, ScoreTable update) {
      ScoreTable combined = existing == null ? new ScoreTable() : existing;
      combined.addAll(update);
      return combined;
    }
    @Override protected ScoreTable snapshot(ScoreTable value) {
      return value.copy();
    }
  };

  /**
   * Creates an in-memory database stamping writes with the system clock.
   */
  public InMemoryTsdb(RollupSchedule schedule) {
    this(schedule, Clock.SYSTEM_CLOCK);
  }

  @Inject
  public InMemoryTsdb(@Named(ROLLUPS) RollupSchedule schedule, Clock clock) {
    super(schedule, clock);
    LOG.info("In-memory tsdb created with rollups " + schedule
        + "; data is never evicted, do not use in production");
  }

  @Override
  public void flush() {
    counters.clear();
    sets.clear();
    frequencies.clear();
    LOG.info("Flushed all in-memory tsdb data");
  }

  @Override
  protected void incrementCounters(MetricKind kind, String key, long timestamp, long amount,
      Set<Environment> environments) {
    counters.write(kind, key, getSchedule().getRollups(), environments, timestamp, amount);
  }

  @Override
  protected Map<String, List<DataPoint<Long>>> readCounters(MetricKind kind, List<String> keys,
      RollupSeries series, Environment environment) {
    return counters.read(kind, keys, series, environment);
  }

  @Override
  protected void mergeCounters(MetricKind kind, String destination, List<String> sources,
      @Nullable Set<Environment> environments) {
    counters.merge(kind, destination, sources, environments);
  }

  @Override
  protected void deleteCounters(Set<MetricKind> kinds, Set<String> keys,
      Map<Long, ImmutableList<Long>> series) {
    counters.delete(kinds, keys, series);
  }

  @Override
  protected void recordMembers(MetricKind kind, String key, Set<String> members, long timestamp,
      Set<Environment> environments) {
    sets.write(kind, key, getSchedule().getRollups(), environments, timestamp, members);
  }

  @Override
  protected Map<String, List<DataPoint<Set<String>>>> readMembers(MetricKind kind,
      List<String> keys, RollupSeries series, Environment environment) {
    return sets.read(kind, keys, series, environment);
  }

  @Override
  protected void mergeMembers(MetricKind kind, String destination, List<String> sources,
      @Nullable Set<Environment> environments) {
    sets.merge(kind, destination, sources, environments);
  }

  @Override
  protected void deleteMembers(Set<MetricKind> kinds, Set<String> keys,
      Map<Long, ImmutableList<Long>> series) {
    sets.delete(kinds, keys, series);
  }

  @Override
  protected void recordScores(MetricKind kind, String key, Map<String, Double> scores,
      long timestamp, Set<Environment> environments) {
    frequencies.write(kind, key, getSchedule().getRollups(), environments, timestamp,
        new ScoreTable(scores));
  }

  @Override
  protected Map<String, List<DataPoint<ScoreTable>>> readScores(MetricKind kind,
      List<String> keys, RollupSeries series, Environment environment) {
    return frequencies.read(kind, keys, series, environment);
  }

  @Override
  protected void mergeScores(MetricKind kind, String destination, List<String> sources,
      @Nullable Set<Environment> environments) {
    frequencies.merge(kind, destination, sources, environments);
  }

  @Override
  protected void deleteScores(Set<MetricKind> kinds, Set<String> keys,
      Map<Long, ImmutableList<Long>> series) {
    frequencies.delete(kinds, keys, series);
  }

  @VisibleForTesting
  BucketTable<Long> counters() {
    return counters;
  }

  @VisibleForTesting
  BucketTable<Set<String>> sets() {
    return sets;
  }

  @VisibleForTesting
  BucketTable<ScoreTable> frequencies() {
    return frequencies;
  }
}
