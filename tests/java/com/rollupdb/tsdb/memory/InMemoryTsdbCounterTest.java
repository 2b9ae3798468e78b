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
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.Before;
import org.junit.Test;

import com.rollupdb.tsdb.DataPoint;
import com.rollupdb.tsdb.Environment;
import com.rollupdb.tsdb.InvalidRangeException;
import com.rollupdb.tsdb.MetricKind;
import com.rollupdb.tsdb.Rollup;
import com.rollupdb.tsdb.RollupSchedule;
import com.rollupdb.util.testing.FakeClock;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class InMemoryTsdbCounterTest {

  // An exact multiple of every granularity in the schedule.
  private static final long NOW = 1080000000L;

  private static final RollupSchedule SCHEDULE =
      RollupSchedule.of(Rollup.of(10, 360), Rollup.of(3600, 168));

  private static final MetricKind KIND = MetricKind.of("events-per-group");
  private static final MetricKind OTHER_KIND = MetricKind.of("events-per-release");

  private static final Environment AGGREGATE = Environment.AGGREGATE;
  private static final Environment PROD = Environment.of(1);
  private static final Environment STAGING = Environment.of(2);

  private FakeClock clock;
  private InMemoryTsdb tsdb;

  @Before
  public void setUp() {
    clock = new FakeClock();
    clock.setNowSeconds(NOW);
    tsdb = new InMemoryTsdb(SCHEDULE, clock);
  }

  @Test
  public void testIncrementAndGetRange() {
    tsdb.increment(KIND, "g1", NOW, 5, AGGREGATE);
    tsdb.increment(KIND, "g1", NOW + 10, 3, AGGREGATE);
    tsdb.increment(KIND, "g1", NOW + 12, 1, AGGREGATE);

    Map<String, List<DataPoint<Long>>> range =
        tsdb.getRange(KIND, ImmutableList.of("g1", "g2"), NOW, NOW + 30, 10L, AGGREGATE);

    assertEquals(
        ImmutableMap.of(
            "g1", ImmutableList.of(
                DataPoint.of(NOW, 5L), DataPoint.of(NOW + 10, 4L), DataPoint.of(NOW + 20, 0L)),
            "g2", ImmutableList.of(
                DataPoint.of(NOW, 0L), DataPoint.of(NOW + 10, 0L), DataPoint.of(NOW + 20, 0L))),
        range);
  }

  @Test
  public void testIncrementWritesEveryRollup() {
    tsdb.increment(KIND, "g1", NOW, 5, AGGREGATE);
    tsdb.increment(KIND, "g1", NOW + 10, 3, AGGREGATE);

    assertEquals(ImmutableList.of(DataPoint.of(NOW, 8L)),
        tsdb.getRange(KIND, ImmutableList.of("g1"), NOW, NOW + 1, 3600L, AGGREGATE).get("g1"));
  }

  @Test
  public void testDefaultsToNowAndOne() {
    tsdb.increment(KIND, "g1");
    tsdb.increment(KIND, "g1");

    assertEquals(ImmutableList.of(DataPoint.of(NOW, 2L)),
        tsdb.getRange(KIND, ImmutableList.of("g1"), NOW, NOW + 10, 10L, AGGREGATE).get("g1"));
  }

  @Test
  public void testDefaultTimestampFollowsClock() {
    tsdb.increment(KIND, "g1");
    clock.advance(25, TimeUnit.SECONDS);
    tsdb.increment(KIND, "g1");

    assertEquals(
        ImmutableList.of(DataPoint.of(NOW, 1L), DataPoint.of(NOW + 10, 0L),
            DataPoint.of(NOW + 20, 1L)),
        tsdb.getRange(KIND, ImmutableList.of("g1"), NOW, NOW + 30, 10L, AGGREGATE).get("g1"));

    // Once the ten second rollup no longer retains NOW, reads fall back to hours.
    clock.advance(2, TimeUnit.HOURS);
    assertEquals(ImmutableList.of(DataPoint.of(NOW, 2L)),
        tsdb.getRange(KIND, ImmutableList.of("g1"), NOW, NOW + 10, null, AGGREGATE).get("g1"));
  }

  @Test
  public void testRangeHasOnePointPerEpoch() {
    tsdb.increment(KIND, "g1", NOW - 60, 1, AGGREGATE);

    List<DataPoint<Long>> points =
        tsdb.getRange(KIND, ImmutableList.of("g1"), NOW - 60, NOW + 10, null, AGGREGATE)
            .get("g1");
    assertEquals(7, points.size());
    for (int i = 0; i < points.size(); i++) {
      assertEquals(NOW - 60 + i * 10, points.get(i).getTimestamp());
    }
    assertEquals(Long.valueOf(1), points.get(0).getValue());
  }

  @Test
  public void testResultKeepsRequestedKeyOrder() {
    Map<String, List<DataPoint<Long>>> range = tsdb.getRange(KIND,
        ImmutableList.of("zeta", "alpha", "zeta"), NOW, NOW + 10, 10L, AGGREGATE);
    assertEquals(ImmutableList.of("zeta", "alpha"), ImmutableList.copyOf(range.keySet()));
  }

  @Test
  public void testAggregateIsSumOfEnvironmentsAtEveryStep() {
    long[][] writes = {{1, 3}, {2, 4}, {1, 7}, {2, 1}, {1, -2}};
    for (long[] write : writes) {
      tsdb.increment(KIND, "g1", NOW, write[1], Environment.of(write[0]));

      long prod = count("g1", PROD);
      long staging = count("g1", STAGING);
      assertEquals(prod + staging, count("g1", AGGREGATE));
    }
    assertEquals(8, count("g1", PROD));
    assertEquals(5, count("g1", STAGING));
  }

  @Test
  public void testAggregateWriteIsNotDoubled() {
    tsdb.increment(KIND, "g1", NOW, 4, AGGREGATE);
    assertEquals(4, count("g1", AGGREGATE));
  }

  @Test
  public void testZeroAmountCreatesBuckets() {
    tsdb.increment(KIND, "g1", NOW, 0, PROD);
    // One bucket per rollup, per environment.
    assertEquals(4, tsdb.counters().size());
    assertEquals(0, count("g1", PROD));
  }

  @Test
  public void testNegativeAmountsAreApplied() {
    tsdb.increment(KIND, "g1", NOW, 5, AGGREGATE);
    tsdb.increment(KIND, "g1", NOW, -7, AGGREGATE);
    assertEquals(-2, count("g1", AGGREGATE));
  }

  @Test
  public void testUnknownKindReadsZero() {
    tsdb.increment(KIND, "g1", NOW, 5, AGGREGATE);
    assertEquals(0, count(OTHER_KIND, "g1", AGGREGATE));
  }

  @Test
  public void testGetSums() {
    tsdb.increment(KIND, "g1", NOW, 5, AGGREGATE);
    tsdb.increment(KIND, "g1", NOW + 20, 6, AGGREGATE);
    tsdb.increment(KIND, "g2", NOW + 40, 1, AGGREGATE);

    assertEquals(ImmutableMap.of("g1", 11L, "g2", 0L),
        tsdb.getSums(KIND, ImmutableList.of("g1", "g2"), NOW, NOW + 30, 10L, AGGREGATE));
  }

  @Test
  public void testMergePreservesTotals() {
    tsdb.increment(KIND, "A", NOW, 5, AGGREGATE);
    tsdb.increment(KIND, "B", NOW, 3, AGGREGATE);

    tsdb.merge(KIND, "A", ImmutableList.of("B"), null);

    assertEquals(8, count("A", AGGREGATE));
    assertEquals(0, count("B", AGGREGATE));
    assertEquals(ImmutableList.of(DataPoint.of(NOW, 8L)),
        tsdb.getRange(KIND, ImmutableList.of("A"), NOW, NOW + 1, 3600L, AGGREGATE).get("A"));
    assertTrue(tsdb.counters().environments(KIND, "B").isEmpty());
  }

  @Test
  public void testMergeMovesEveryBucket() {
    tsdb.increment(KIND, "B", NOW - 3600, 2, AGGREGATE);
    tsdb.increment(KIND, "B", NOW, 3, AGGREGATE);

    tsdb.merge(KIND, "A", ImmutableList.of("B"), null);

    assertEquals(ImmutableList.of(DataPoint.of(NOW - 3600, 2L), DataPoint.of(NOW, 3L)),
        tsdb.getRange(KIND, ImmutableList.of("A"), NOW - 3600, NOW + 1, 3600L, AGGREGATE)
            .get("A"));
  }

  @Test
  public void testMergeAllEnvironmentsKeepsAggregateConsistent() {
    tsdb.increment(KIND, "A", NOW, 2, PROD);
    tsdb.increment(KIND, "B", NOW, 3, PROD);
    tsdb.increment(KIND, "B", NOW, 4, STAGING);

    tsdb.merge(KIND, "A", ImmutableList.of("B"), null);

    assertEquals(5, count("A", PROD));
    assertEquals(4, count("A", STAGING));
    assertEquals(9, count("A", AGGREGATE));
    assertTrue(tsdb.counters().environments(KIND, "B").isEmpty());
  }

  @Test
  public void testMergeListedEnvironmentsDiscardsOthers() {
    tsdb.increment(KIND, "A", NOW, 2, PROD);
    tsdb.increment(KIND, "B", NOW, 3, PROD);
    tsdb.increment(KIND, "B", NOW, 4, STAGING);

    tsdb.merge(KIND, "A", ImmutableList.of("B"), ImmutableSet.of(PROD));

    assertEquals(5, count("A", PROD));
    assertEquals(0, count("A", STAGING));
    assertEquals(9, count("A", AGGREGATE));
    assertEquals(0, count("B", STAGING));
    assertTrue(tsdb.counters().environments(KIND, "B").isEmpty());
  }

  @Test
  public void testMergeIntoSelfIsNoop() {
    tsdb.increment(KIND, "A", NOW, 5, AGGREGATE);
    tsdb.merge(KIND, "A", ImmutableList.of("A"), null);
    assertEquals(5, count("A", AGGREGATE));
  }

  @Test
  public void testMergeLeavesOtherKindsAlone() {
    tsdb.increment(OTHER_KIND, "B", NOW, 3, AGGREGATE);
    tsdb.merge(KIND, "A", ImmutableList.of("B"), null);
    assertEquals(3, count(OTHER_KIND, "B", AGGREGATE));
    assertEquals(0, count(OTHER_KIND, "A", AGGREGATE));
  }

  @Test
  public void testDeleteClearsExactlyTheTargetedRange() {
    tsdb.increment(KIND, "g1", NOW, 1, AGGREGATE);
    tsdb.increment(KIND, "g1", NOW + 10, 2, AGGREGATE);

    tsdb.delete(ImmutableList.of(KIND), ImmutableList.of("g1"), NOW, NOW + 1, null);

    assertEquals(ImmutableList.of(DataPoint.of(NOW, 0L), DataPoint.of(NOW + 10, 2L)),
        tsdb.getRange(KIND, ImmutableList.of("g1"), NOW, NOW + 20, 10L, AGGREGATE).get("g1"));
    // The hourly bucket overlapping the range is cleared too.
    assertEquals(ImmutableList.of(DataPoint.of(NOW, 0L)),
        tsdb.getRange(KIND, ImmutableList.of("g1"), NOW, NOW + 1, 3600L, AGGREGATE).get("g1"));
  }

  @Test
  public void testDeleteSingleInstant() {
    tsdb.increment(KIND, "g1", NOW, 1, AGGREGATE);
    tsdb.increment(KIND, "g1", NOW + 10, 2, AGGREGATE);

    tsdb.delete(ImmutableList.of(KIND), ImmutableList.of("g1"), null, null, NOW + 15);

    assertEquals(ImmutableList.of(DataPoint.of(NOW, 1L), DataPoint.of(NOW + 10, 0L)),
        tsdb.getRange(KIND, ImmutableList.of("g1"), NOW, NOW + 20, 10L, AGGREGATE).get("g1"));
  }

  @Test
  public void testDeleteRetainedWindow() {
    tsdb.increment(KIND, "g1", NOW - 100, 1, AGGREGATE);
    tsdb.increment(KIND, "g1", NOW, 2, AGGREGATE);
    tsdb.increment(KIND, "g2", NOW, 3, AGGREGATE);

    tsdb.delete(ImmutableList.of(KIND), ImmutableList.of("g1"), null, null, null);

    assertEquals(0, tsdb.counters().environments(KIND, "g1").size());
    assertEquals(3, count("g2", AGGREGATE));
  }

  @Test
  public void testDeleteCoversEveryEnvironmentAndKind() {
    tsdb.increment(KIND, "g1", NOW, 1, PROD);
    tsdb.increment(KIND, "g1", NOW, 2, STAGING);
    tsdb.increment(OTHER_KIND, "g1", NOW, 3, PROD);

    tsdb.delete(ImmutableList.of(KIND, OTHER_KIND), ImmutableList.of("g1"), NOW, NOW + 10, null);

    assertEquals(0, count("g1", PROD));
    assertEquals(0, count("g1", STAGING));
    assertEquals(0, count("g1", AGGREGATE));
    assertEquals(0, count(OTHER_KIND, "g1", AGGREGATE));
  }

  @Test
  public void testDeleteMissingBucketsIsNoop() {
    tsdb.delete(ImmutableList.of(KIND), ImmutableList.of("nothing"), NOW, NOW + 10, null);
    assertEquals(0, tsdb.counters().size());
  }

  @Test(expected = InvalidRangeException.class)
  public void testGetRangeRejectsInvertedRange() {
    tsdb.getRange(KIND, ImmutableList.of("g1"), NOW + 10, NOW, null, AGGREGATE);
  }

  @Test
  public void testFlush() {
    tsdb.increment(KIND, "g1", NOW, 1, PROD);
    tsdb.record(KIND, "g1", ImmutableSet.of("u1"), NOW, PROD);
    tsdb.flush();

    assertEquals(0, tsdb.counters().size());
    assertEquals(0, tsdb.sets().size());
    assertEquals(0, count("g1", AGGREGATE));
  }

  private long count(String key, Environment environment) {
    return count(KIND, key, environment);
  }

  private long count(MetricKind kind, String key, Environment environment) {
    return tsdb.getSums(kind, ImmutableList.of(key), NOW, NOW + 10, 10L, environment).get(key);
  }
}
