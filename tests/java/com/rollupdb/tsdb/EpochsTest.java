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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EpochsTest {

  private static final long[] GRANULARITIES = {1, 10, 60, 3600};

  @Test
  public void testBucketEpoch() {
    assertEquals(120L, Epochs.bucketEpoch(125, 10));
    assertEquals(120L, Epochs.bucketEpoch(120, 10));
    assertEquals(0L, Epochs.bucketEpoch(3599, 3600));
    assertEquals(3600L, Epochs.bucketEpoch(3600, 3600));
  }

  @Test
  public void testBucketEpochBeforeUnixEpoch() {
    assertEquals(-10L, Epochs.bucketEpoch(-1, 10));
    assertEquals(-10L, Epochs.bucketEpoch(-10, 10));
    assertEquals(-20L, Epochs.bucketEpoch(-11, 10));
  }

  @Test
  public void testBucketEpochIdempotent() {
    for (long granularity : GRANULARITIES) {
      for (long timestamp = -5000; timestamp < 5000; timestamp += 7) {
        long epoch = Epochs.bucketEpoch(timestamp, granularity);
        assertEquals(epoch, Epochs.bucketEpoch(epoch, granularity));
        assertTrue(epoch <= timestamp);
        assertTrue(timestamp < epoch + granularity);
      }
    }
  }

  @Test
  public void testBucketEpochMonotonic() {
    for (long granularity : GRANULARITIES) {
      long previous = Epochs.bucketEpoch(-5000, granularity);
      for (long timestamp = -4999; timestamp < 5000; timestamp++) {
        long epoch = Epochs.bucketEpoch(timestamp, granularity);
        assertTrue(epoch >= previous);
        previous = epoch;
      }
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBucketEpochRejectsZeroGranularity() {
    Epochs.bucketEpoch(100, 0);
  }

  @Test
  public void testSeries() {
    assertEquals(ImmutableList.of(100L, 110L, 120L), Epochs.series(100, 130, 10));
    assertEquals(ImmutableList.of(100L, 110L, 120L), Epochs.series(105, 130, 10));
    assertEquals(ImmutableList.of(100L, 110L, 120L), Epochs.series(100, 121, 10));
    assertEquals(ImmutableList.of(100L), Epochs.series(100, 101, 10));
  }

  @Test
  public void testSeriesEmptyRange() {
    assertEquals(ImmutableList.<Long>of(), Epochs.series(100, 100, 10));
  }

  @Test
  public void testSeriesInvalidRange() {
    try {
      Epochs.series(130, 100, 10);
      fail("A range ending before it starts should be rejected.");
    } catch (InvalidRangeException e) {
      assertEquals(130, e.getStart());
      assertEquals(100, e.getEnd());
    }
  }
}
