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

import com.google.common.collect.ImmutableList;

import com.rollupdb.base.MorePreconditions;

/**
 * Pure functions mapping timestamps onto bucket epochs.  All timestamps and granularities are in
 * seconds.
 */
public final class Epochs {

  private Epochs() {
    // utility
  }

  /**
   * Returns the start of the bucket that contains {@code timestamp}.  Uses floor division, so
   * timestamps before the UNIX epoch land in the bucket below them.
   *
   * @param timestamp UNIX time in seconds.
   * @param granularity Bucket width in seconds.
   * @return The bucket epoch.
   */
  public static long bucketEpoch(long timestamp, long granularity) {
    MorePreconditions.checkPositive(granularity, "Granularity must be positive, got %s");
    return Math.floorDiv(timestamp, granularity) * granularity;
  }

  /**
   * Enumerates, in ascending order, the epochs of every bucket that overlaps {@code [start, end)}.
   *
   * @param start Inclusive range start.
   * @param end Exclusive range end.
   * @param granularity Bucket width in seconds.
   * @return The bucket epochs, empty when {@code start == end}.
   * @throws InvalidRangeException if {@code end < start}
   */
  public static ImmutableList<Long> series(long start, long end, long granularity) {
    checkRange(start, end);
    ImmutableList.Builder<Long> epochs = ImmutableList.builder();
    for (long epoch = bucketEpoch(start, granularity); epoch < end; epoch += granularity) {
      epochs.add(epoch);
    }
    return epochs.build();
  }

  /**
   * Checks that a range is well formed.
   *
   * @throws InvalidRangeException if {@code end < start}
   */
  public static void checkRange(long start, long end) {
    if (end < start) {
      throw new InvalidRangeException(start, end);
    }
  }
}
