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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;

import com.rollupdb.tsdb.Environment;
import com.rollupdb.tsdb.MetricKind;

/**
 * The full address of a bucket.  Coordinates sort by kind, key, environment, granularity and
 * epoch, so all buckets of one key (or one key and environment) form a contiguous range.
 */
final class BucketCoordinate implements Comparable<BucketCoordinate> {

  private static final Environment LAST_ENVIRONMENT = Environment.of(Long.MAX_VALUE);

  private final MetricKind kind;
  private final String key;
  private final Environment environment;
  private final long granularity;
  private final long epoch;

  BucketCoordinate(MetricKind kind, String key, Environment environment, long granularity,
      long epoch) {
    this.kind = Preconditions.checkNotNull(kind);
    this.key = Preconditions.checkNotNull(key);
    this.environment = Preconditions.checkNotNull(environment);
    this.granularity = granularity;
    this.epoch = epoch;
  }

  /**
   * Returns the smallest coordinate of the given key.
   */
  static BucketCoordinate first(MetricKind kind, String key) {
    return first(kind, key, Environment.AGGREGATE);
  }

  /**
   * Returns the largest coordinate of the given key.
   */
  static BucketCoordinate last(MetricKind kind, String key) {
    return last(kind, key, LAST_ENVIRONMENT);
  }

  static BucketCoordinate first(MetricKind kind, String key, Environment environment) {
    return new BucketCoordinate(kind, key, environment, Long.MIN_VALUE, Long.MIN_VALUE);
  }

  static BucketCoordinate last(MetricKind kind, String key, Environment environment) {
    return new BucketCoordinate(kind, key, environment, Long.MAX_VALUE, Long.MAX_VALUE);
  }

  /**
   * Returns the coordinate of the same bucket under another key.
   */
  BucketCoordinate withKey(String otherKey) {
    return new BucketCoordinate(kind, otherKey, environment, granularity, epoch);
  }

  MetricKind getKind() {
    return kind;
  }

  String getKey() {
    return key;
  }

  Environment getEnvironment() {
    return environment;
  }

  long getGranularity() {
    return granularity;
  }

  long getEpoch() {
    return epoch;
  }

  @Override
  public int compareTo(BucketCoordinate other) {
    return ComparisonChain.start()
        .compare(kind, other.kind)
        .compare(key, other.key)
        .compare(environment, other.environment)
        .compare(granularity, other.granularity)
        .compare(epoch, other.epoch)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BucketCoordinate)) {
      return false;
    }
    BucketCoordinate other = (BucketCoordinate) obj;
    return kind.equals(other.kind)
        && key.equals(other.key)
        && environment.equals(other.environment)
        && granularity == other.granularity
        && epoch == other.epoch;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, key, environment, granularity, epoch);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("key", key)
        .add("environment", environment)
        .add("granularity", granularity)
        .add("epoch", epoch)
        .toString();
  }
}
