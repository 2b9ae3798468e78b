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
 * Per-bucket sets of members, answering distinct count (cardinality) queries.
 *
 * <p>Any operation may throw {@link BackendUnavailableException}.
 */
public interface DistinctCountStore {

  /**
   * Records {@code members} against {@code key}, now, in the aggregate environment.
   */
  void record(MetricKind kind, String key, Collection<String> members);

  /**
   * Unions {@code members} into the buckets of {@code key} at every rollup, and into the aggregate
   * environment when {@code environment} is concrete.
   *
   * @param timestamp Time of the observation, or {@code null} for now.
   */
  void record(MetricKind kind, String key, Collection<String> members, @Nullable Long timestamp,
      Environment environment);

  /**
   * Returns the number of distinct members in each bucket of {@code [start, end)}.
   *
   * @throws InvalidRangeException if {@code end < start}
   */
  Map<String, List<DataPoint<Long>>> getDistinctCountsSeries(MetricKind kind,
      Collection<String> keys, long start, long end, @Nullable Long granularity,
      Environment environment);

  /**
   * Returns the number of distinct members each key saw over the whole range.  A member seen in
   * several buckets counts once.
   *
   * @throws InvalidRangeException if {@code end < start}
   */
  Map<String, Long> getDistinctCountsTotals(MetricKind kind, Collection<String> keys, long start,
      long end, @Nullable Long granularity, Environment environment);

  /**
   * Returns the number of distinct members seen by any of {@code keys} over the range.  A member
   * seen by several keys counts once.
   *
   * @throws InvalidRangeException if {@code end < start}
   */
  long getDistinctCountsUnion(MetricKind kind, Collection<String> keys, long start, long end,
      @Nullable Long granularity, Environment environment);

  /**
   * Unions the sets of {@code sources} into {@code destination}, then removes the sources.
   *
   * @see CounterStore#merge(MetricKind, String, Collection, Set)
   */
  void mergeDistinctCounts(MetricKind kind, String destination, Collection<String> sources,
      @Nullable Set<Environment> environments);

  /**
   * Removes member sets.
   *
   * @see CounterStore#delete(Collection, Collection, Long, Long, Long)
   */
  void deleteDistinctCounts(Collection<MetricKind> kinds, Collection<String> keys,
      @Nullable Long start, @Nullable Long end, @Nullable Long timestamp);
}
