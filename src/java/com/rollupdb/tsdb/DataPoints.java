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

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Utility functions for working with series of {@link DataPoint}s.
 */
public final class DataPoints {

  private DataPoints() {
    // utility
  }

  /**
   * Re-buckets counter series into a coarser granularity, summing the points that fall into the
   * same coarse bucket.  Input series must be in ascending time order, as returned by the stores.
   *
   * @param series Counter series keyed by entity key.
   * @param granularity The coarser granularity, in seconds.
   * @return The re-bucketed series, keys in their original order.
   */
  public static Map<String, List<DataPoint<Long>>> rollup(
      Map<String, ? extends List<DataPoint<Long>>> series, long granularity) {
    Preconditions.checkNotNull(series);

    ImmutableMap.Builder<String, List<DataPoint<Long>>> rolledUp = ImmutableMap.builder();
    for (Map.Entry<String, ? extends List<DataPoint<Long>>> entry : series.entrySet()) {
      List<DataPoint<Long>> points = Lists.newArrayList();
      for (DataPoint<Long> point : entry.getValue()) {
        long epoch = Epochs.bucketEpoch(point.getTimestamp(), granularity);
        DataPoint<Long> last = Iterables.getLast(points, null);
        if (last != null && last.getTimestamp() == epoch) {
          points.set(points.size() - 1, DataPoint.of(epoch, last.getValue() + point.getValue()));
        } else {
          points.add(DataPoint.of(epoch, point.getValue()));
        }
      }
      rolledUp.put(entry.getKey(), ImmutableList.copyOf(points));
    }
    return rolledUp.build();
  }

  /**
   * Sums the values of each counter series.
   *
   * @param series Counter series keyed by entity key.
   * @return The total of each series, keys in their original order.
   */
  public static Map<String, Long> sums(Map<String, ? extends List<DataPoint<Long>>> series) {
    return ImmutableMap.copyOf(Maps.transformValues(series,
        new Function<List<DataPoint<Long>>, Long>() {
          @Override public Long apply(List<DataPoint<Long>> points) {
            long sum = 0;
            for (DataPoint<Long> point : points) {
              sum += point.getValue();
            }
            return sum;
          }
        }));
  }
}
