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

package com.rollupdb.tsdb;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import com.google.inject.name.Named;

import com.rollupdb.util.Clock;

/**
 * A database that stores nothing.  Writes, merges and deletes are discarded; reads answer as if
 * no data was ever written, with the same shape as a real backend.  Useful where metrics are
 * disabled.
 */
public class DummyTsdb extends BaseTsdb {

  private static final Logger LOG = Logger.getLogger(DummyTsdb.class.getName());

  private static final Supplier<Long> ZERO = new Supplier<Long>() {
    @Override public Long get() {
      return 0L;
    }
  };

  private static final Supplier<Set<String>> NO_MEMBERS = new Supplier<Set<String>>() {
    @Override public Set<String> get() {
      return ImmutableSet.of();
    }
  };

  private static final Supplier<ScoreTable> NO_SCORES = new Supplier<ScoreTable>() {
    @Override public ScoreTable get() {
      return new ScoreTable();
    }
  };

  @Inject
  public DummyTsdb(@Named(ROLLUPS) RollupSchedule schedule, Clock clock) {
    super(schedule, clock);
    LOG.info("Using dummy tsdb, all metrics will be discarded");
  }

  @Override
  public void flush() {
    // Nothing stored.
  }

  @Override
  protected void incrementCounters(MetricKind kind, String key, long timestamp, long amount,
      Set<Environment> environments) {
  }

  @Override
  protected Map<String, List<DataPoint<Long>>> readCounters(MetricKind kind, List<String> keys,
      RollupSeries series, Environment environment) {
    return empty(keys, series, ZERO);
  }

  @Override
  protected void mergeCounters(MetricKind kind, String destination, List<String> sources,
      @Nullable Set<Environment> environments) {
  }

  @Override
  protected void deleteCounters(Set<MetricKind> kinds, Set<String> keys,
      Map<Long, ImmutableList<Long>> series) {
  }

  @Override
  protected void recordMembers(MetricKind kind, String key, Set<String> members, long timestamp,
      Set<Environment> environments) {
  }

  @Override
  protected Map<String, List<DataPoint<Set<String>>>> readMembers(MetricKind kind,
      List<String> keys, RollupSeries series, Environment environment) {
    return empty(keys, series, NO_MEMBERS);
  }

  @Override
  protected void mergeMembers(MetricKind kind, String destination, List<String> sources,
      @Nullable Set<Environment> environments) {
  }

  @Override
  protected void deleteMembers(Set<MetricKind> kinds, Set<String> keys,
      Map<Long, ImmutableList<Long>> series) {
  }

  @Override
  protected void recordScores(MetricKind kind, String key, Map<String, Double> scores,
      long timestamp, Set<Environment> environments) {
  }

  @Override
  protected Map<String, List<DataPoint<ScoreTable>>> readScores(MetricKind kind,
      List<String> keys, RollupSeries series, Environment environment) {
    return empty(keys, series, NO_SCORES);
  }

  @Override
  protected void mergeScores(MetricKind kind, String destination, List<String> sources,
      @Nullable Set<Environment> environments) {
  }

  @Override
  protected void deleteScores(Set<MetricKind> kinds, Set<String> keys,
      Map<Long, ImmutableList<Long>> series) {
  }

  private static <V> Map<String, List<DataPoint<V>>> empty(List<String> keys,
      RollupSeries series, Supplier<V> identity) {
    ImmutableMap.Builder<String, List<DataPoint<V>>> results = ImmutableMap.builder();
    for (String key : keys) {
      ImmutableList.Builder<DataPoint<V>> points = ImmutableList.builder();
      for (long epoch : series.getEpochs()) {
        points.add(DataPoint.of(epoch, identity.get()));
      }
      results.put(key, points.build());
    }
    return results.build();
  }
}
