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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import com.rollupdb.util.Clock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base class for {@link Tsdb} backends.  Validates arguments, resolves defaulted timestamps against
 * a {@link Clock}, applies the dual write into {@link Environment#AGGREGATE} and derives every
 * query from a small set of per value family primitives.
 *
 * <p>Backends implement four primitives per value family: write at every rollup for a set of
 * environments, read a series of buckets, merge keys and delete buckets.
 */
public abstract class BaseTsdb implements Tsdb {

  private static final Logger LOG = Logger.getLogger(BaseTsdb.class.getName());

  /**
   * {@literal @Named} binding key for the rollup schedule.
   */
  public static final String ROLLUPS = "com.rollupdb.tsdb.BaseTsdb.ROLLUPS";

  private final RollupSchedule schedule;
  private final Clock clock;

  protected BaseTsdb(RollupSchedule schedule, Clock clock) {
    this.schedule = checkNotNull(schedule);
    this.clock = checkNotNull(clock);
  }

  @Override
  public RollupSchedule getSchedule() {
    return schedule;
  }

  /**
   * Returns the current time in seconds, according to this database's clock.
   */
  protected long now() {
    return clock.nowSeconds();
  }

  // Counters.

  @Override
  public void increment(MetricKind kind, String key) {
    increment(kind, key, null, 1, Environment.AGGREGATE);
  }

  @Override
  public void increment(MetricKind kind, String key, @Nullable Long timestamp, long amount,
      Environment environment) {
    checkNotNull(kind);
    checkNotNull(key);
    incrementCounters(kind, key, resolve(timestamp), amount, writeEnvironments(environment));
  }

  @Override
  public Map<String, List<DataPoint<Long>>> getRange(MetricKind kind, Collection<String> keys,
      long start, long end, @Nullable Long granularity, Environment environment) {
    checkNotNull(kind);
    checkNotNull(environment);
    return readCounters(kind, distinct(keys), series(start, end, granularity), environment);
  }

  @Override
  public Map<String, Long> getSums(MetricKind kind, Collection<String> keys, long start,
      long end, @Nullable Long granularity, Environment environment) {
    return DataPoints.sums(getRange(kind, keys, start, end, granularity, environment));
  }

  @Override
  public void merge(MetricKind kind, String destination, Collection<String> sources,
      @Nullable Set<Environment> environments) {
    checkNotNull(kind);
    checkNotNull(destination);
    List<String> mergeable = mergeableSources(destination, sources);
    if (!mergeable.isEmpty()) {
      logMerge("counters", kind, destination, mergeable);
      mergeCounters(kind, destination, mergeable, mergeEnvironments(environments));
    }
  }

  @Override
  public void delete(Collection<MetricKind> kinds, Collection<String> keys, @Nullable Long start,
      @Nullable Long end, @Nullable Long timestamp) {
    checkNotNull(kinds);
    checkNotNull(keys);
    deleteCounters(ImmutableSet.copyOf(kinds), ImmutableSet.copyOf(keys),
        activeSeries(start, end, timestamp));
  }

  // Distinct counts.

  @Override
  public void record(MetricKind kind, String key, Collection<String> members) {
    record(kind, key, members, null, Environment.AGGREGATE);
  }

  @Override
  public void record(MetricKind kind, String key, Collection<String> members,
      @Nullable Long timestamp, Environment environment) {
    checkNotNull(kind);
    checkNotNull(key);
    recordMembers(kind, key, ImmutableSet.copyOf(members), resolve(timestamp),
        writeEnvironments(environment));
  }

  @Override
  public Map<String, List<DataPoint<Long>>> getDistinctCountsSeries(MetricKind kind,
      Collection<String> keys, long start, long end, @Nullable Long granularity,
      Environment environment) {
    Map<String, List<DataPoint<Set<String>>>> members =
        readMembersChecked(kind, keys, start, end, granularity, environment);

    ImmutableMap.Builder<String, List<DataPoint<Long>>> counts = ImmutableMap.builder();
    for (Map.Entry<String, List<DataPoint<Set<String>>>> entry : members.entrySet()) {
      ImmutableList.Builder<DataPoint<Long>> points = ImmutableList.builder();
      for (DataPoint<Set<String>> point : entry.getValue()) {
        points.add(DataPoint.of(point.getTimestamp(), (long) point.getValue().size()));
      }
      counts.put(entry.getKey(), points.build());
    }
    return counts.build();
  }

  @Override
  public Map<String, Long> getDistinctCountsTotals(MetricKind kind, Collection<String> keys,
      long start, long end, @Nullable Long granularity, Environment environment) {
    Map<String, List<DataPoint<Set<String>>>> members =
        readMembersChecked(kind, keys, start, end, granularity, environment);

    ImmutableMap.Builder<String, Long> totals = ImmutableMap.builder();
    for (Map.Entry<String, List<DataPoint<Set<String>>>> entry : members.entrySet()) {
      Set<String> union = Sets.newHashSet();
      for (DataPoint<Set<String>> point : entry.getValue()) {
        union.addAll(point.getValue());
      }
      totals.put(entry.getKey(), (long) union.size());
    }
    return totals.build();
  }

  @Override
  public long getDistinctCountsUnion(MetricKind kind, Collection<String> keys, long start,
      long end, @Nullable Long granularity, Environment environment) {
    Map<String, List<DataPoint<Set<String>>>> members =
        readMembersChecked(kind, keys, start, end, granularity, environment);

    Set<String> union = Sets.newHashSet();
    for (List<DataPoint<Set<String>>> points : members.values()) {
      for (DataPoint<Set<String>> point : points) {
        union.addAll(point.getValue());
      }
    }
    return union.size();
  }

  @Override
  public void mergeDistinctCounts(MetricKind kind, String destination, Collection<String> sources,
      @Nullable Set<Environment> environments) {
    checkNotNull(kind);
    checkNotNull(destination);
    List<String> mergeable = mergeableSources(destination, sources);
    if (!mergeable.isEmpty()) {
      logMerge("distinct counts", kind, destination, mergeable);
      mergeMembers(kind, destination, mergeable, mergeEnvironments(environments));
    }
  }

  @Override
  public void deleteDistinctCounts(Collection<MetricKind> kinds, Collection<String> keys,
      @Nullable Long start, @Nullable Long end, @Nullable Long timestamp) {
    checkNotNull(kinds);
    checkNotNull(keys);
    deleteMembers(ImmutableSet.copyOf(kinds), ImmutableSet.copyOf(keys),
        activeSeries(start, end, timestamp));
  }

  private Map<String, List<DataPoint<Set<String>>>> readMembersChecked(MetricKind kind,
      Collection<String> keys, long start, long end, @Nullable Long granularity,
      Environment environment) {
    checkNotNull(kind);
    checkNotNull(environment);
    return readMembers(kind, distinct(keys), series(start, end, granularity), environment);
  }

  // Frequencies.

  @Override
  public void recordFrequencyMulti(List<FrequencyRequest> requests) {
    recordFrequencyMulti(requests, null, Environment.AGGREGATE);
  }

  @Override
  public void recordFrequencyMulti(List<FrequencyRequest> requests, @Nullable Long timestamp,
      Environment environment) {
    checkNotNull(requests);
    long resolved = resolve(timestamp);
    Set<Environment> environments = writeEnvironments(environment);
    for (FrequencyRequest request : requests) {
      for (Map.Entry<String, ImmutableMap<String, Double>> entry
          : request.getScores().entrySet()) {
        recordScores(request.getKind(), entry.getKey(), entry.getValue(), resolved, environments);
      }
    }
  }

  @Override
  public Map<String, List<ScoredMember>> getMostFrequent(MetricKind kind, Collection<String> keys,
      long start, long end, @Nullable Long granularity, @Nullable Integer limit,
      Environment environment) {
    checkLimit(limit);
    Map<String, List<DataPoint<ScoreTable>>> scores =
        readScoresChecked(kind, distinct(keys), start, end, granularity, environment);

    ImmutableMap.Builder<String, List<ScoredMember>> results = ImmutableMap.builder();
    for (Map.Entry<String, List<DataPoint<ScoreTable>>> entry : scores.entrySet()) {
      ScoreTable accumulated = new ScoreTable();
      for (DataPoint<ScoreTable> point : entry.getValue()) {
        accumulated.addAll(point.getValue());
      }
      results.put(entry.getKey(), accumulated.mostCommon(limit));
    }
    return results.build();
  }

  @Override
  public Map<String, List<DataPoint<Map<String, Double>>>> getMostFrequentSeries(
      MetricKind kind, Collection<String> keys, long start, long end,
      @Nullable Long granularity, @Nullable Integer limit, Environment environment) {
    checkLimit(limit);
    Map<String, List<DataPoint<ScoreTable>>> scores =
        readScoresChecked(kind, distinct(keys), start, end, granularity, environment);

    ImmutableMap.Builder<String, List<DataPoint<Map<String, Double>>>> results =
        ImmutableMap.builder();
    for (Map.Entry<String, List<DataPoint<ScoreTable>>> entry : scores.entrySet()) {
      ImmutableList.Builder<DataPoint<Map<String, Double>>> points = ImmutableList.builder();
      for (DataPoint<ScoreTable> point : entry.getValue()) {
        points.add(DataPoint.<Map<String, Double>>of(point.getTimestamp(),
            point.getValue().mostCommonAsMap(limit)));
      }
      results.put(entry.getKey(), points.build());
    }
    return results.build();
  }

  @Override
  public Map<String, List<DataPoint<Map<String, Double>>>> getFrequencySeries(MetricKind kind,
      Map<String, ? extends Collection<String>> items, long start, long end,
      @Nullable Long granularity, Environment environment) {
    checkNotNull(items);
    Map<String, List<DataPoint<ScoreTable>>> scores = readScoresChecked(kind,
        ImmutableList.copyOf(items.keySet()), start, end, granularity, environment);

    ImmutableMap.Builder<String, List<DataPoint<Map<String, Double>>>> results =
        ImmutableMap.builder();
    for (Map.Entry<String, List<DataPoint<ScoreTable>>> entry : scores.entrySet()) {
      Set<String> members = ImmutableSet.copyOf(items.get(entry.getKey()));
      ImmutableList.Builder<DataPoint<Map<String, Double>>> points = ImmutableList.builder();
      for (DataPoint<ScoreTable> point : entry.getValue()) {
        ImmutableMap.Builder<String, Double> memberScores = ImmutableMap.builder();
        for (String member : members) {
          memberScores.put(member, point.getValue().get(member));
        }
        points.add(DataPoint.<Map<String, Double>>of(point.getTimestamp(), memberScores.build()));
      }
      results.put(entry.getKey(), points.build());
    }
    return results.build();
  }

  @Override
  public Map<String, Map<String, Double>> getFrequencyTotals(MetricKind kind,
      Map<String, ? extends Collection<String>> items, long start, long end,
      @Nullable Long granularity, Environment environment) {
    Map<String, List<DataPoint<Map<String, Double>>>> series =
        getFrequencySeries(kind, items, start, end, granularity, environment);

    ImmutableMap.Builder<String, Map<String, Double>> totals = ImmutableMap.builder();
    for (Map.Entry<String, List<DataPoint<Map<String, Double>>>> entry : series.entrySet()) {
      Map<String, Double> memberTotals = Maps.newLinkedHashMap();
      for (String member : items.get(entry.getKey())) {
        memberTotals.put(member, 0.0);
      }
      for (DataPoint<Map<String, Double>> point : entry.getValue()) {
        for (Map.Entry<String, Double> score : point.getValue().entrySet()) {
          memberTotals.put(score.getKey(), memberTotals.get(score.getKey()) + score.getValue());
        }
      }
      totals.put(entry.getKey(), ImmutableMap.copyOf(memberTotals));
    }
    return totals.build();
  }

  @Override
  public void mergeFrequencies(MetricKind kind, String destination, Collection<String> sources,
      @Nullable Set<Environment> environments) {
    checkNotNull(kind);
    checkNotNull(destination);
    List<String> mergeable = mergeableSources(destination, sources);
    if (!mergeable.isEmpty()) {
      logMerge("frequencies", kind, destination, mergeable);
      mergeScores(kind, destination, mergeable, mergeEnvironments(environments));
    }
  }

  @Override
  public void deleteFrequencies(Collection<MetricKind> kinds, Collection<String> keys,
      @Nullable Long start, @Nullable Long end, @Nullable Long timestamp) {
    checkNotNull(kinds);
    checkNotNull(keys);
    deleteScores(ImmutableSet.copyOf(kinds), ImmutableSet.copyOf(keys),
        activeSeries(start, end, timestamp));
  }

  private Map<String, List<DataPoint<ScoreTable>>> readScoresChecked(MetricKind kind,
      List<String> keys, long start, long end, @Nullable Long granularity,
      Environment environment) {
    checkNotNull(kind);
    checkNotNull(environment);
    return readScores(kind, keys, series(start, end, granularity), environment);
  }

  // Backend primitives.

  /**
   * Adds {@code amount} to the counter of {@code key} in each environment, at every rollup.
   */
  protected abstract void incrementCounters(MetricKind kind, String key, long timestamp,
      long amount, Set<Environment> environments);

  /**
   * Reads one counter per epoch of {@code series} for each key, absent buckets as zero.
   */
  protected abstract Map<String, List<DataPoint<Long>>> readCounters(MetricKind kind,
      List<String> keys, RollupSeries series, Environment environment);

  /**
   * Folds the counters of {@code sources} into {@code destination} and drops the sources.
   *
   * @param environments Environments to fold, always including the aggregate, or {@code null}
   *     for every environment the sources hold.
   */
  protected abstract void mergeCounters(MetricKind kind, String destination,
      List<String> sources, @Nullable Set<Environment> environments);

  /**
   * Removes the counters at the given epochs, keyed by granularity, in every environment.
   */
  protected abstract void deleteCounters(Set<MetricKind> kinds, Set<String> keys,
      Map<Long, ImmutableList<Long>> series);

  protected abstract void recordMembers(MetricKind kind, String key, Set<String> members,
      long timestamp, Set<Environment> environments);

  protected abstract Map<String, List<DataPoint<Set<String>>>> readMembers(MetricKind kind,
      List<String> keys, RollupSeries series, Environment environment);

  protected abstract void mergeMembers(MetricKind kind, String destination,
      List<String> sources, @Nullable Set<Environment> environments);

  protected abstract void deleteMembers(Set<MetricKind> kinds, Set<String> keys,
      Map<Long, ImmutableList<Long>> series);

  protected abstract void recordScores(MetricKind kind, String key, Map<String, Double> scores,
      long timestamp, Set<Environment> environments);

  protected abstract Map<String, List<DataPoint<ScoreTable>>> readScores(MetricKind kind,
      List<String> keys, RollupSeries series, Environment environment);

  protected abstract void mergeScores(MetricKind kind, String destination,
      List<String> sources, @Nullable Set<Environment> environments);

  protected abstract void deleteScores(Set<MetricKind> kinds, Set<String> keys,
      Map<Long, ImmutableList<Long>> series);

  // Helpers.

  private long resolve(@Nullable Long timestamp) {
    return timestamp != null ? timestamp : now();
  }

  private RollupSeries series(long start, long end, @Nullable Long granularity) {
    return schedule.selectRollup(start, end, granularity, now());
  }

  private Map<Long, ImmutableList<Long>> activeSeries(@Nullable Long start, @Nullable Long end,
      @Nullable Long timestamp) {
    return schedule.activeSeries(start, end, timestamp, now());
  }

  private static List<String> distinct(Collection<String> keys) {
    checkNotNull(keys);
    return ImmutableSet.copyOf(keys).asList();
  }

  private static void checkLimit(@Nullable Integer limit) {
    Preconditions.checkArgument(limit == null || limit >= 0, "Limit cannot be negative: %s", limit);
  }

  /**
   * Returns the environments a write to {@code environment} lands in.
   */
  static Set<Environment> writeEnvironments(Environment environment) {
    checkNotNull(environment);
    return ImmutableSet.of(environment, Environment.AGGREGATE);
  }

  @Nullable
  private static Set<Environment> mergeEnvironments(@Nullable Set<Environment> environments) {
    if (environments == null) {
      return null;
    }
    return ImmutableSet.<Environment>builder()
        .add(Environment.AGGREGATE)
        .addAll(environments)
        .build();
  }

  private static List<String> mergeableSources(String destination, Collection<String> sources) {
    checkNotNull(sources);
    List<String> mergeable = Lists.newArrayList();
    for (String source : ImmutableSet.copyOf(sources)) {
      if (!source.equals(destination)) {
        mergeable.add(source);
      }
    }
    return mergeable;
  }

  private static void logMerge(String family, MetricKind kind, String destination,
      List<String> sources) {
    if (LOG.isLoggable(Level.FINE)) {
      LOG.fine(String.format("Merging %s of %s %s into %s", family, kind, sources, destination));
    }
  }
}
