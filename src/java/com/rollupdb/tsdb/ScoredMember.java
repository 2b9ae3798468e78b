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
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;

/**
 * A member of a frequency table along with its accumulated score.
 */
public final class ScoredMember {

  /**
   * Ranks members by descending score.  Equal scores are ordered lexicographically by member so
   * that top-k answers are stable across backends and runs.
   */
  public static final Ordering<ScoredMember> BY_RANK = new Ordering<ScoredMember>() {
    @Override public int compare(ScoredMember a, ScoredMember b) {
      return ComparisonChain.start()
          .compare(b.score, a.score)
          .compare(a.member, b.member)
          .result();
    }
  };

  private final String member;
  private final double score;

  private ScoredMember(String member, double score) {
    this.member = Preconditions.checkNotNull(member);
    this.score = score;
  }

  public static ScoredMember of(String member, double score) {
    return new ScoredMember(member, score);
  }

  public String getMember() {
    return member;
  }

  public double getScore() {
    return score;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ScoredMember)) {
      return false;
    }
    ScoredMember other = (ScoredMember) obj;
    return member.equals(other.member) && Double.compare(score, other.score) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(member, score);
  }

  @Override
  public String toString() {
    return member + "=" + score;
  }
}
