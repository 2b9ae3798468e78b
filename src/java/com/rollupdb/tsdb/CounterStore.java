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

import javax.annotation.Nullable;

/**
 * Additive integer counters, bucketed at every granularity of a {@link RollupSchedule}.
 *
 * <p>All timestamps are UNIX seconds.  Any operation may throw
 * {@link BackendUnavailableException} when the backing storage cannot be reached.
 */
public interface CounterStore {

  /**
   * Increments the counter of {@code key} by one, now, in the aggregate environment.
   */
  void increment(MetricKind kind, String key);

  /**
   * Adds {@code amount} to the counter of {@code key} at every rollup.  When
   * {@code environment} is concrete the same amount is also added to the aggregate environment.
   * The bucket is created even when {@code amount} is zero.  Negative amounts are applied as-is.
   *
   * @param kind Metric namespace.
   * @param key Entity key.
   * @param timestamp Time of the event, or {@code null} for now.
   * @param amount Amount to add.
   * @param environment Environment the event occurred in.
   */
  void increment(MetricKind kind, String key, @Nullable Long timestamp, long amount,
      Environment environment);

  /**
   * Reads counters for {@code keys} over {@code [start, end)}.
   *
   * @param granularity Granularity to read, or {@code null} to pick the finest rollup that
   *     retains {@code start}.
   * @return One point per bucket epoch for each key, ascending, with zeros for empty buckets.
   * @throws InvalidRangeException if {@code end < start}
   */
  Map<String, List<DataPoint<Long>>> getRange(MetricKind kind, Collection<String> keys,
      long start, long end, @Nullable Long granularity, Environment environment);

  /**
   * Sums the counters of each key over {@code [start, end)}.
   *
   * @see #getRange(MetricKind, Collection, long, long, Long, Environment)
   */
  Map<String, Long> getSums(MetricKind kind, Collection<String> keys, long start, long end,
      @Nullable Long granularity, Environment environment);

  /**
   * Folds the counters of {@code sources} into {@code destination}, then removes every bucket of
   * the sources.  A source equal to the destination is skipped.
   *
   * @param environments Environments to fold in addition to the aggregate, or {@code null} for
   *     every environment the sources hold.  Source buckets in other environments are discarded.
   */
  void merge(MetricKind kind, String destination, Collection<String> sources,
      @Nullable Set<Environment> environments);

  /**
   * Removes the counters of every {@code (kind, key)} pair at every rollup and every environment.
   * See {@link RollupSchedule#activeSeries} for how the range arguments pick buckets.
   */
  void delete(Collection<MetricKind> kinds, Collection<String> keys, @Nullable Long start,
      @Nullable Long end, @Nullable Long timestamp);
}
