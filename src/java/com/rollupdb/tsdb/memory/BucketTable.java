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
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.Striped;

import com.rollupdb.tsdb.DataPoint;
import com.rollupdb.tsdb.Environment;
import com.rollupdb.tsdb.Epochs;
import com.rollupdb.tsdb.MetricKind;
import com.rollupdb.tsdb.Rollup;
import com.rollupdb.tsdb.RollupSeries;

/**
 * All buckets of one value family, held in a single map ordered by {@link BucketCoordinate}.
 *
 * <p>Locking is per {@code (kind, key)} shard: every read and write of a key holds that key's
 * stripe lock, so individual bucket updates never interleave.  A merge holds the destination and
 * one source shard at a time.  The map itself is concurrent, so operations on different shards
 * proceed in parallel.
 *
 * @param <V> The type of value held by each bucket.
 */
abstract class BucketTable<V> {

  private static final Logger LOG = Logger.getLogger(BucketTable.class.getName());

  private static final int LOCK_STRIPES = 64;

  private final String name;
  private final ConcurrentNavigableMap<BucketCoordinate, V> buckets =
      new ConcurrentSkipListMap<BucketCoordinate, V>();
  private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

  BucketTable(String name) {
    this.name = name;
  }

  /**
   * Returns the value an absent bucket reads as.
   */
  protected abstract V emptyValue();

  /**
   * Combines {@code update} into {@code existing}, returning the value to store.  Implementations
   * may mutate {@code existing} but must never store {@code update} itself if it is mutable.
   */
  protected abstract V combine(@Nullable V existing, V update);

  /**
   * Returns a copy of {@code value} that is safe to hand out after the shard lock is released.
   */
  protected abstract V snapshot(V value);

  /**
   * Combines {@code update} into the bucket of {@code key} for each environment, at every rollup.
   */
  void write(MetricKind kind, String key, Iterable<Rollup> rollups,
      Iterable<Environment> environments, long timestamp, V update) {
    Lock lock = locks.get(shard(kind, key));
    lock.lock();
    try {
      for (Rollup rollup : rollups) {
        long granularity = rollup.getGranularity();
        long epoch = Epochs.bucketEpoch(timestamp, granularity);
        for (Environment environment : environments) {
          combineInto(new BucketCoordinate(kind, key, environment, granularity, epoch), update);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads one point per epoch of {@code series} for each key.
   */
  Map<String, List<DataPoint<V>>> read(MetricKind kind, List<String> keys, RollupSeries series,
      Environment environment) {
    ImmutableMap.Builder<String, List<DataPoint<V>>> results = ImmutableMap.builder();
    for (String key : keys) {
      ImmutableList.Builder<DataPoint<V>> points = ImmutableList.builder();
      Lock lock = locks.get(shard(kind, key));
      lock.lock();
      try {
        for (long epoch : series.getEpochs()) {
          V value = buckets.get(
              new BucketCoordinate(kind, key, environment, series.getGranularity(), epoch));
          points.add(DataPoint.of(epoch, value == null ? emptyValue() : snapshot(value)));
        }
      } finally {
        lock.unlock();
      }
      results.put(key, points.build());
    }
    return results.build();
  }

  /**
   * Combines every bucket of each source into the same bucket of {@code destination}, then drops
   * all buckets of the source.
   *
   * @param environments Environments to combine, or {@code null} for those the source holds.
   */
  void merge(MetricKind kind, String destination, List<String> sources,
      @Nullable Set<Environment> environments) {
    for (String source : sources) {
      List<Lock> held = Lists.newArrayList(
          locks.bulkGet(ImmutableList.of(shard(kind, destination), shard(kind, source))));
      for (Lock lock : held) {
        lock.lock();
      }
      try {
        int moved = 0;
        for (Environment environment
            : environments != null ? environments : environments(kind, source)) {
          for (Map.Entry<BucketCoordinate, V> bucket
              : keyRange(kind, source, environment).entrySet()) {
            combineInto(bucket.getKey().withKey(destination), bucket.getValue());
            moved++;
          }
        }
        NavigableMap<BucketCoordinate, V> remaining = keyRange(kind, source);
        int dropped = remaining.size() - moved;
        remaining.clear();

        if (LOG.isLoggable(Level.FINE)) {
          LOG.fine(String.format("%s: merged %d buckets of %s/%s into %s, discarded %d",
              name, moved, kind, source, destination, dropped));
        }
      } finally {
        for (Lock lock : Lists.reverse(held)) {
          lock.unlock();
        }
      }
    }
  }

  /**
   * Removes the buckets at the given epochs, keyed by granularity, in every environment.
   */
  void delete(Set<MetricKind> kinds, Set<String> keys, Map<Long, ImmutableList<Long>> series) {
    int removed = 0;
    for (MetricKind kind : kinds) {
      for (String key : keys) {
        Lock lock = locks.get(shard(kind, key));
        lock.lock();
        try {
          Set<Environment> environments = Sets.newHashSet(environments(kind, key));
          environments.add(Environment.AGGREGATE);
          for (Map.Entry<Long, ImmutableList<Long>> rollup : series.entrySet()) {
            long granularity = rollup.getKey();
            for (Environment environment : environments) {
              for (long timestamp : rollup.getValue()) {
                BucketCoordinate coordinate = new BucketCoordinate(kind, key, environment,
                    granularity, Epochs.bucketEpoch(timestamp, granularity));
                if (buckets.remove(coordinate) != null) {
                  removed++;
                }
              }
            }
          }
        } finally {
          lock.unlock();
        }
      }
    }
    if (LOG.isLoggable(Level.FINE)) {
      LOG.fine(String.format("%s: deleted %d buckets of %s %s", name, removed, kinds, keys));
    }
  }

  void clear() {
    buckets.clear();
  }

  @VisibleForTesting
  int size() {
    return buckets.size();
  }

  /**
   * Returns the environments {@code key} holds buckets in.
   */
  @VisibleForTesting
  Set<Environment> environments(MetricKind kind, String key) {
    Set<Environment> environments = Sets.newTreeSet();
    for (BucketCoordinate coordinate : keyRange(kind, key).keySet()) {
      environments.add(coordinate.getEnvironment());
    }
    return environments;
  }

  private void combineInto(BucketCoordinate coordinate, V update) {
    buckets.put(coordinate, combine(buckets.get(coordinate), update));
  }

  private NavigableMap<BucketCoordinate, V> keyRange(MetricKind kind, String key) {
    return buckets.subMap(BucketCoordinate.first(kind, key), true,
        BucketCoordinate.last(kind, key), true);
  }

  private NavigableMap<BucketCoordinate, V> keyRange(MetricKind kind, String key,
      Environment environment) {
    return buckets.subMap(BucketCoordinate.first(kind, key, environment), true,
        BucketCoordinate.last(kind, key, environment), true);
  }

  private static List<Object> shard(MetricKind kind, String key) {
    return ImmutableList.<Object>of(kind, key);
  }
}
