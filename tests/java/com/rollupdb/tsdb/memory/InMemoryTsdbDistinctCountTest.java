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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.Before;
import org.junit.Test;

import com.rollupdb.tsdb.DataPoint;
import com.rollupdb.tsdb.Environment;
import com.rollupdb.tsdb.MetricKind;
import com.rollupdb.tsdb.RollupSchedule;
import com.rollupdb.util.testing.FakeClock;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class InMemoryTsdbDistinctCountTest {

  private static final long NOW = 1080000000L;
  private static final MetricKind USERS = MetricKind.of("users-affected-by-group");

  private static final Environment AGGREGATE = Environment.AGGREGATE;
  private static final Environment PROD = Environment.of(1);
  private static final Environment STAGING = Environment.of(2);

  private InMemoryTsdb tsdb;

  @Before
  public void setUp() {
    FakeClock clock = new FakeClock();
    clock.setNowSeconds(NOW);
    tsdb = new InMemoryTsdb(RollupSchedule.DEFAULT, clock);
  }

  @Test
  public void testUnionCountsOverlappingMembersOnce() {
    tsdb.record(USERS, "g1", ImmutableSet.of("u1", "u2"), NOW, AGGREGATE);
    tsdb.record(USERS, "g2", ImmutableSet.of("u2", "u3"), NOW, AGGREGATE);

    List<String> keys = ImmutableList.of("g1", "g2");
    Map<String, Long> totals = tsdb.getDistinctCountsTotals(USERS, keys, NOW, NOW + 10, 10L,
        AGGREGATE);
    assertEquals(ImmutableMap.of("g1", 2L, "g2", 2L), totals);

    long union = tsdb.getDistinctCountsUnion(USERS, keys, NOW, NOW + 10, 10L, AGGREGATE);
    assertEquals(3, union);
    assertTrue(union < totals.get("g1") + totals.get("g2"));
  }

  @Test
  public void testUnionOfDisjointSetsEqualsSum() {
    tsdb.record(USERS, "g1", ImmutableSet.of("u1", "u2"), NOW, AGGREGATE);
    tsdb.record(USERS, "g2", ImmutableSet.of("u3"), NOW + 10, AGGREGATE);

    List<String> keys = ImmutableList.of("g1", "g2");
    Map<String, Long> totals = tsdb.getDistinctCountsTotals(USERS, keys, NOW, NOW + 20, 10L,
        AGGREGATE);
    assertEquals(totals.get("g1") + totals.get("g2"),
        tsdb.getDistinctCountsUnion(USERS, keys, NOW, NOW + 20, 10L, AGGREGATE));
  }

  @Test
  public void testSeriesCountsEachBucket() {
    tsdb.record(USERS, "g1", ImmutableSet.of("u1"), NOW, AGGREGATE);
    tsdb.record(USERS, "g1", ImmutableSet.of("u1", "u2"), NOW + 10, AGGREGATE);
    tsdb.record(USERS, "g1", ImmutableSet.of("u2"), NOW + 12, AGGREGATE);

    assertEquals(
        ImmutableList.of(
            DataPoint.of(NOW, 1L), DataPoint.of(NOW + 10, 2L), DataPoint.of(NOW + 20, 0L)),
        tsdb.getDistinctCountsSeries(USERS, ImmutableList.of("g1"), NOW, NOW + 30, 10L,
            AGGREGATE).get("g1"));

    // Members seen in several buckets are counted once in the total.
    assertEquals(Long.valueOf(2),
        tsdb.getDistinctCountsTotals(USERS, ImmutableList.of("g1"), NOW, NOW + 30, 10L,
            AGGREGATE).get("g1"));
  }

  @Test
  public void testRecordDefaultsToNow() {
    tsdb.record(USERS, "g1", ImmutableList.of("u1", "u1", "u2"));
    assertEquals(2, tsdb.getDistinctCountsUnion(USERS, ImmutableList.of("g1"), NOW, NOW + 10,
        10L, AGGREGATE));
  }

  @Test
  public void testAggregateIsUnionOfEnvironments() {
    tsdb.record(USERS, "g1", ImmutableSet.of("u1", "u2"), NOW, PROD);
    assertEquals(2, distinct("g1", AGGREGATE));

    tsdb.record(USERS, "g1", ImmutableSet.of("u2", "u3"), NOW, STAGING);
    assertEquals(2, distinct("g1", PROD));
    assertEquals(2, distinct("g1", STAGING));
    assertEquals(3, distinct("g1", AGGREGATE));
  }

  @Test
  public void testEmptyRecordCreatesBuckets() {
    tsdb.record(USERS, "g1", ImmutableSet.<String>of(), NOW, AGGREGATE);
    assertEquals(2, tsdb.sets().size());
    assertEquals(0, distinct("g1", AGGREGATE));
  }

  @Test
  public void testMergeUnionsIntoDestination() {
    tsdb.record(USERS, "g1", ImmutableSet.of("u1", "u2"), NOW, PROD);
    tsdb.record(USERS, "g2", ImmutableSet.of("u2", "u3"), NOW, PROD);
    tsdb.record(USERS, "g3", ImmutableSet.of("u4"), NOW - 3600, PROD);

    tsdb.mergeDistinctCounts(USERS, "g1", ImmutableList.of("g2", "g3", "g1"), null);

    assertEquals(3, distinct("g1", PROD));
    assertEquals(3, distinct("g1", AGGREGATE));
    assertEquals(0, distinct("g2", AGGREGATE));
    assertEquals(4, tsdb.getDistinctCountsUnion(USERS, ImmutableList.of("g1"), NOW - 3600,
        NOW + 1, 3600L, AGGREGATE));
    assertTrue(tsdb.sets().environments(USERS, "g2").isEmpty());
    assertTrue(tsdb.sets().environments(USERS, "g3").isEmpty());
  }

  @Test
  public void testMergeDoesNotAliasSourceSets() {
    tsdb.record(USERS, "g2", ImmutableSet.of("u1"), NOW, AGGREGATE);
    tsdb.mergeDistinctCounts(USERS, "g1", ImmutableList.of("g2"), null);
    tsdb.record(USERS, "g1", ImmutableSet.of("u2"), NOW, AGGREGATE);
    tsdb.record(USERS, "g2", ImmutableSet.of("u3"), NOW, AGGREGATE);

    assertEquals(2, distinct("g1", AGGREGATE));
    assertEquals(1, distinct("g2", AGGREGATE));
  }

  @Test
  public void testDeleteClearsRange() {
    tsdb.record(USERS, "g1", ImmutableSet.of("u1"), NOW, PROD);
    tsdb.record(USERS, "g1", ImmutableSet.of("u2"), NOW + 10, PROD);

    tsdb.deleteDistinctCounts(ImmutableList.of(USERS), ImmutableList.of("g1"), NOW, NOW + 1,
        null);

    assertEquals(
        ImmutableList.of(DataPoint.of(NOW, 0L), DataPoint.of(NOW + 10, 1L)),
        tsdb.getDistinctCountsSeries(USERS, ImmutableList.of("g1"), NOW, NOW + 20, 10L, PROD)
            .get("g1"));
    assertEquals(0, distinct("g1", AGGREGATE));
  }

  @Test
  public void testDeleteLeavesCountersAlone() {
    tsdb.record(USERS, "g1", ImmutableSet.of("u1"), NOW, AGGREGATE);
    tsdb.increment(USERS, "g1", NOW, 1, AGGREGATE);

    tsdb.deleteDistinctCounts(ImmutableList.of(USERS), ImmutableList.of("g1"), null, null, NOW);

    assertEquals(0, distinct("g1", AGGREGATE));
    assertEquals(Long.valueOf(1),
        tsdb.getSums(USERS, ImmutableList.of("g1"), NOW, NOW + 10, 10L, AGGREGATE).get("g1"));
  }

  @Test
  public void testReadsReturnSnapshots() {
    tsdb.record(USERS, "g1", ImmutableSet.of("u1"), NOW, AGGREGATE);
    long before = distinct("g1", AGGREGATE);
    tsdb.record(USERS, "g1", ImmutableSet.of("u2"), NOW, AGGREGATE);
    assertEquals(1, before);
    assertEquals(2, distinct("g1", AGGREGATE));
  }

  private long distinct(String key, Environment environment) {
    return tsdb.getDistinctCountsUnion(USERS, ImmutableList.of(key), NOW, NOW + 10, 10L,
        environment);
  }
}
