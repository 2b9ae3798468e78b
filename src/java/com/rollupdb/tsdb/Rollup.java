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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import com.rollupdb.base.MorePreconditions;

/**
 * A single time granularity at which metrics are aggregated, along with the number of most
 * recent buckets a backend is expected to retain at that granularity.
 */
public final class Rollup {

  private final long granularity;
  private final int retention;

  private Rollup(long granularity, int retention) {
    this.granularity = MorePreconditions.checkPositive(granularity,
        "Rollup granularity must be positive, got %s");
    this.retention = (int) MorePreconditions.checkPositive(retention,
        "Rollup retention must be positive, got %s");
  }

  /**
   * Creates a rollup.
   *
   * @param granularity Width of each bucket, in seconds.
   * @param retention Number of buckets retained.
   * @return The rollup.
   */
  public static Rollup of(long granularity, int retention) {
    return new Rollup(granularity, retention);
  }

  /**
   * Returns the bucket width in seconds.
   */
  public long getGranularity() {
    return granularity;
  }

  public int getRetention() {
    return retention;
  }

  /**
   * Returns the number of seconds covered by all retained buckets.
   */
  public long getRetentionWindow() {
    return granularity * retention;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Rollup)) {
      return false;
    }
    Rollup other = (Rollup) obj;
    return granularity == other.granularity && retention == other.retention;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(granularity, retention);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("granularity", granularity)
        .add("retention", retention)
        .toString();
  }
}
