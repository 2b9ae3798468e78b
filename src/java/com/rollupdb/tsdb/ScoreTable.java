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
import java.util.SortedMap;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * A frequency table: an ordered map from member to accumulated score.  Tables combine by summing
 * the scores of each member.
 *
 * <p>WARNING: This is not thread-safe.
 */
public class ScoreTable {

  private final SortedMap<String, Double> scores = Maps.newTreeMap();

  public ScoreTable() {
  }

  public ScoreTable(Map<String, Double> scores) {
    addAll(scores);
  }

  /**
   * Adds {@code score} to the score of {@code member}, creating the member if needed.
   *
   * @param member The member to score.
   * @param score The amount to add; may be negative.
   * @return The member's new score.
   */
  public double add(String member, double score) {
    Preconditions.checkNotNull(member);
    Double current = scores.get(member);
    double updated = (current == null ? 0.0 : current) + score;
    scores.put(member, updated);
    return updated;
  }

  /**
   * Adds every score in {@code other} to this table.
   */
  public void addAll(Map<String, Double> other) {
    for (Map.Entry<String, Double> entry : other.entrySet()) {
      add(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Adds every score in {@code other} to this table.
   */
  public void addAll(ScoreTable other) {
    addAll(other.scores);
  }

  /**
   * Returns the score of {@code member}, or {@code 0.0} if it was never scored.
   */
  public double get(String member) {
    Double score = scores.get(member);
    return score == null ? 0.0 : score;
  }

  public int size() {
    return scores.size();
  }

  public boolean isEmpty() {
    return scores.isEmpty();
  }

  /**
   * Returns the highest scoring members, ranked by {@link ScoredMember#BY_RANK}.
   *
   * @param limit Maximum number of members to return, or {@code null} for all of them.
   * @return The ranked members.
   */
  public ImmutableList<ScoredMember> mostCommon(@Nullable Integer limit) {
    Preconditions.checkArgument(limit == null || limit >= 0, "Limit cannot be negative: %s", limit);

    List<ScoredMember> members = Lists.newArrayListWithCapacity(scores.size());
    for (Map.Entry<String, Double> entry : scores.entrySet()) {
      members.add(ScoredMember.of(entry.getKey(), entry.getValue()));
    }
    if (limit == null) {
      return ImmutableList.copyOf(ScoredMember.BY_RANK.sortedCopy(members));
    }
    return ImmutableList.copyOf(ScoredMember.BY_RANK.leastOf(members, limit));
  }

  /**
   * Returns the highest scoring members as a map iterating in rank order.
   *
   * @see #mostCommon(Integer)
   */
  public ImmutableMap<String, Double> mostCommonAsMap(@Nullable Integer limit) {
    ImmutableMap.Builder<String, Double> ranked = ImmutableMap.builder();
    for (ScoredMember member : mostCommon(limit)) {
      ranked.put(member.getMember(), member.getScore());
    }
    return ranked.build();
  }

  /**
   * Returns a snapshot of the table, ordered by member.
   */
  public ImmutableSortedMap<String, Double> asMap() {
    return ImmutableSortedMap.copyOfSorted(scores);
  }

  /**
   * Returns an independent copy of this table.
   */
  public ScoreTable copy() {
    return new ScoreTable(scores);
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof ScoreTable) && scores.equals(((ScoreTable) obj).scores);
  }

  @Override
  public int hashCode() {
    return scores.hashCode();
  }

  @Override
  public String toString() {
    return scores.toString();
  }
}
