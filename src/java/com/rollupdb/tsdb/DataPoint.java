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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A value read from a single bucket, stamped with the bucket's epoch.
 *
 * @param <V> The type of value held by the bucket.
 */
public final class DataPoint<V> {

  private final long timestamp;
  private final V value;

  private DataPoint(long timestamp, V value) {
    this.timestamp = timestamp;
    this.value = Preconditions.checkNotNull(value);
  }

  public static <V> DataPoint<V> of(long timestamp, V value) {
    return new DataPoint<V>(timestamp, value);
  }

  /**
   * Returns the epoch of the bucket this point was read from, in seconds.
   */
  public long getTimestamp() {
    return timestamp;
  }

  public V getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DataPoint)) {
      return false;
    }
    DataPoint<?> other = (DataPoint<?>) obj;
    return timestamp == other.timestamp && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(timestamp, value);
  }

  @Override
  public String toString() {
    return "(" + timestamp + ", " + value + ")";
  }
}
