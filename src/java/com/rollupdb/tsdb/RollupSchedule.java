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
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;
import com.google.common.primitives.Longs;

import com.rollupdb.base.MorePreconditions;

/**
 * An immutable set of {@link Rollup}s ordered from the finest to the coarsest granularity.  Beyond
 * holding the rollups, the schedule decides which granularity answers a range query and which
 * buckets a delete must touch.
 */
public final class RollupSchedule {

  private static final Logger LOG = Logger.getLogger(RollupSchedule.class.getName());

  /**
   * Ten second buckets for an hour, hourly buckets for a week.
   */
  public static final RollupSchedule DEFAULT =
      of(Rollup.of(10, 360), Rollup.of(TimeUnit.HOURS.toSeconds(1), 24 * 7));

  private static final Ordering<Rollup> BY_GRANULARITY = new Ordering<Rollup>() {
    @Override public int compare(Rollup a, Rollup b) {
      return Longs.compare(a.getGranularity(), b.getGranularity());
    }
  };

  private static final Map<String, TimeUnit> UNITS = ImmutableMap.of(
      "s", TimeUnit.SECONDS,
      "m", TimeUnit.MINUTES,
      "h", TimeUnit.HOURS,
      "d", TimeUnit.DAYS);

  private final ImmutableList<Rollup> rollups;

  private RollupSchedule(Iterable<Rollup> rollups) {
    MorePreconditions.checkNotBlank(rollups, "A rollup schedule needs at least one rollup.");
    List<Rollup> sorted = BY_GRANULARITY.sortedCopy(rollups);
    Set<Long> granularities = Sets.newHashSet();
    for (Rollup rollup : sorted) {
      Preconditions.checkArgument(granularities.add(rollup.getGranularity()),
          "Duplicate rollup granularity: %s", rollup.getGranularity());
    }
    this.rollups = ImmutableList.copyOf(sorted);
  }

  public static RollupSchedule of(Rollup... rollups) {
    return new RollupSchedule(ImmutableList.copyOf(rollups));
  }

  public static RollupSchedule of(Iterable<Rollup> rollups) {
    return new RollupSchedule(rollups);
  }

  /**
   * Parses a schedule of the form {@code 10s:360,1h:168}: comma separated
   * {@code <amount>[s|m|h|d]:<retention>} entries.  An amount without a unit is in seconds.
   *
   * @param spec The schedule to parse.
   * @return The parsed schedule.
   * @throws IllegalArgumentException if the schedule is malformed
   */
  public static RollupSchedule parse(String spec) {
    MorePreconditions.checkNotBlank(spec, "A rollup schedule spec cannot be blank.");

    List<Rollup> rollups = Lists.newArrayList();
    for (String entry : Splitter.on(',').trimResults().omitEmptyStrings().split(spec)) {
      List<String> parts = Splitter.on(':').trimResults().splitToList(entry);
      Preconditions.checkArgument(parts.size() == 2,
          "Rollup format: <granularity>:<retention> (e.g. 10s:360), got '%s'", entry);
      try {
        rollups.add(Rollup.of(parseGranularity(parts.get(0)), Integer.parseInt(parts.get(1))));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Failed to parse rollup '" + entry + "'.", e);
      }
    }
    return new RollupSchedule(rollups);
  }

  private static long parseGranularity(String granularity) {
    MorePreconditions.checkNotBlank(granularity, "Rollup granularity cannot be blank.");
    String suffix = granularity.substring(granularity.length() - 1).toLowerCase();
    TimeUnit unit = UNITS.get(suffix);
    if (unit == null) {
      return Long.parseLong(granularity);
    }
    return unit.toSeconds(Long.parseLong(granularity.substring(0, granularity.length() - 1)));
  }

  public ImmutableList<Rollup> getRollups() {
    return rollups;
  }

  public Rollup getFinest() {
    return rollups.get(0);
  }

  public Rollup getCoarsest() {
    return Iterables.getLast(rollups);
  }

  /**
   * Picks the finest rollup whose retention window, measured back from {@code now}, still
   * reaches {@code start}.  When no rollup reaches that far back the coarsest is returned; the
   * older end of such a range may already have been evicted by a retaining backend.
   *
   * @param start Start of the range being read.
   * @param now The current time.
   * @return The rollup best suited to read from {@code start}.
   */
  public Rollup optimalRollup(long start, long now) {
    for (Rollup rollup : rollups) {
      if (now - start < rollup.getRetentionWindow()) {
        return rollup;
      }
    }
    if (LOG.isLoggable(Level.FINE)) {
      LOG.fine(String.format("No rollup retains data back to %d (now %d), using %s",
          start, now, getCoarsest()));
    }
    return getCoarsest();
  }

  /**
   * Chooses a granularity for {@code [start, end)} and lists the epochs to read.
   *
   * @param start Inclusive range start.
   * @param end Exclusive range end.
   * @param granularity Granularity to use, or {@code null} to pick one with
   *     {@link #optimalRollup(long, long)}.
   * @param now The current time.
   * @return The chosen granularity and epochs.
   * @throws InvalidRangeException if {@code end < start}
   */
  public RollupSeries selectRollup(long start, long end, @Nullable Long granularity, long now) {
    Epochs.checkRange(start, end);
    long chosen = granularity != null ? granularity : optimalRollup(start, now).getGranularity();
    return new RollupSeries(chosen, Epochs.series(start, end, chosen));
  }

  /**
   * Lists, for every rollup in this schedule, the bucket epochs a delete should clear.
   *
   * <ul>
   *   <li>With only {@code timestamp}, the single bucket holding it.
   *   <li>Without {@code start}, everything still retained before {@code end} (or before the
   *       {@code timestamp}, or {@code now}).
   *   <li>Without {@code end}, up to and including the bucket of {@code timestamp} (or
   *       {@code now}).
   * </ul>
   *
   * @return Epochs keyed by granularity, finest first.
   * @throws InvalidRangeException if the resulting range ends before it starts
   */
  public ImmutableMap<Long, ImmutableList<Long>> activeSeries(@Nullable Long start,
      @Nullable Long end, @Nullable Long timestamp, long now) {

    ImmutableMap.Builder<Long, ImmutableList<Long>> series = ImmutableMap.builder();
    for (Rollup rollup : rollups) {
      long granularity = rollup.getGranularity();
      if (start == null && end == null && timestamp != null) {
        series.put(granularity, ImmutableList.of(Epochs.bucketEpoch(timestamp, granularity)));
        continue;
      }

      long reference = timestamp != null ? timestamp : now;
      long rangeEnd = end != null ? end : Epochs.bucketEpoch(reference, granularity) + granularity;
      long rangeStart = start != null
          ? start
          : earliestTimestamp(rollup, end != null ? end : reference);
      series.put(granularity, Epochs.series(rangeStart, rangeEnd, granularity));
    }
    return series.build();
  }

  /**
   * Returns the epoch of the oldest bucket {@code rollup} retains when the newest bucket holds
   * {@code timestamp}.
   */
  public static long earliestTimestamp(Rollup rollup, long timestamp) {
    long lifespan = rollup.getGranularity() * (rollup.getRetention() - 1);
    return Epochs.bucketEpoch(timestamp - lifespan, rollup.getGranularity());
  }

  /**
   * Returns the time at which the bucket holding {@code timestamp} falls out of
   * {@code rollup}'s retention window.  Retaining backends use this as the bucket's expiry.
   */
  public static long expiry(Rollup rollup, long timestamp) {
    return Epochs.bucketEpoch(timestamp, rollup.getGranularity()) + rollup.getRetentionWindow();
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof RollupSchedule) && rollups.equals(((RollupSchedule) obj).rollups);
  }

  @Override
  public int hashCode() {
    return rollups.hashCode();
  }

  @Override
  public String toString() {
    List<String> entries = Lists.newArrayList();
    for (Rollup rollup : rollups) {
      entries.add(rollup.getGranularity() + "s:" + rollup.getRetention());
    }
    return Joiner.on(',').join(entries);
  }
}
