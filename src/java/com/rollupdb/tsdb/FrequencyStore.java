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
 * Per-bucket frequency tables mapping members to accumulated scores, answering top-k and weighted
 * total queries.  Ranked answers follow {@link ScoredMember#BY_RANK}.
 *
 * <p>Any operation may throw {@link BackendUnavailableException}.
 */
public interface FrequencyStore {

  /**
   * Records {@code requests} now, in the aggregate environment.
   */
  void recordFrequencyMulti(List<FrequencyRequest> requests);

  /**
   * Adds every member score of every request into the matching bucket at every rollup, and into
   * the aggregate environment when {@code environment} is concrete.
   *
   * @param timestamp Time of the observations, or {@code null} for now.
   */
  void recordFrequencyMulti(List<FrequencyRequest> requests, @Nullable Long timestamp,
      Environment environment);

  /**
   * Returns the highest scoring members of each key, scores accumulated over the whole range.
   *
   * @param limit Maximum members per key, or {@code null} for all of them.
   * @throws InvalidRangeException if {@code end < start}
   */
  Map<String, List<ScoredMember>> getMostFrequent(MetricKind kind, Collection<String> keys,
      long start, long end, @Nullable Long granularity, @Nullable Integer limit,
      Environment environment);

  /**
   * Returns the highest scoring members of each bucket of the range.  Scores are not accumulated
   * across buckets; each map iterates in rank order.
   *
   * @throws InvalidRangeException if {@code end < start}
   */
  Map<String, List<DataPoint<Map<String, Double>>>> getMostFrequentSeries(MetricKind kind,
      Collection<String> keys, long start, long end, @Nullable Long granularity,
      @Nullable Integer limit, Environment environment);

  /**
   * Returns the scores of the requested members in each bucket of the range.  Members that were
   * never scored in a bucket are reported as {@code 0.0}.
   *
   * @param items Members to report, keyed by entity key.
   * @throws InvalidRangeException if {@code end < start}
   */
  Map<String, List<DataPoint<Map<String, Double>>>> getFrequencySeries(MetricKind kind,
      Map<String, ? extends Collection<String>> items, long start, long end,
      @Nullable Long granularity, Environment environment);

  /**
   * Returns the scores of the requested members summed over the range.
   *
   * @see #getFrequencySeries(MetricKind, Map, long, long, Long, Environment)
   */
  Map<String, Map<String, Double>> getFrequencyTotals(MetricKind kind,
      Map<String, ? extends Collection<String>> items, long start, long end,
      @Nullable Long granularity, Environment environment);

  /**
   * Sums the scores of {@code sources} into {@code destination}, then removes the sources.
   *
   * @see CounterStore#merge(MetricKind, String, Collection, Set)
   */
  void mergeFrequencies(MetricKind kind, String destination, Collection<String> sources,
      @Nullable Set<Environment> environments);

  /**
   * Removes frequency tables.
   *
   * @see CounterStore#delete(Collection, Collection, Long, Long, Long)
   */
  void deleteFrequencies(Collection<MetricKind> kinds, Collection<String> keys,
      @Nullable Long start, @Nullable Long end, @Nullable Long timestamp);
}
