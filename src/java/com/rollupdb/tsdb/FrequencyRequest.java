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

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * A batch of member scores to record against the keys of one {@link MetricKind}.
 */
public final class FrequencyRequest {

  private final MetricKind kind;
  private final ImmutableMap<String, ImmutableMap<String, Double>> scores;

  private FrequencyRequest(MetricKind kind,
      ImmutableMap<String, ImmutableMap<String, Double>> scores) {
    this.kind = Preconditions.checkNotNull(kind);
    this.scores = Preconditions.checkNotNull(scores);
  }

  /**
   * Creates a request from member scores keyed by entity key.
   */
  public static FrequencyRequest of(MetricKind kind,
      Map<String, ? extends Map<String, Double>> scores) {
    ImmutableMap.Builder<String, ImmutableMap<String, Double>> copy = ImmutableMap.builder();
    for (Map.Entry<String, ? extends Map<String, Double>> entry : scores.entrySet()) {
      copy.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    return new FrequencyRequest(kind, copy.build());
  }

  public static Builder builder(MetricKind kind) {
    return new Builder(kind);
  }

  public MetricKind getKind() {
    return kind;
  }

  /**
   * Returns the scores to record, keyed by entity key then member.
   */
  public ImmutableMap<String, ImmutableMap<String, Double>> getScores() {
    return scores;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("scores", scores)
        .toString();
  }

  /**
   * Accumulates member scores; repeated scores for the same key and member are summed.
   */
  public static class Builder {
    private final MetricKind kind;
    private final Map<String, ScoreTable> scores = Maps.newLinkedHashMap();

    Builder(MetricKind kind) {
      this.kind = Preconditions.checkNotNull(kind);
    }

    public Builder add(String key, String member, double score) {
      Preconditions.checkNotNull(key);
      ScoreTable table = scores.get(key);
      if (table == null) {
        table = new ScoreTable();
        scores.put(key, table);
      }
      table.add(member, score);
      return this;
    }

    public FrequencyRequest build() {
      Map<String, Map<String, Double>> copy = Maps.newLinkedHashMap();
      for (Map.Entry<String, ScoreTable> entry : scores.entrySet()) {
        copy.put(entry.getKey(), entry.getValue().asMap());
      }
      return of(kind, copy);
    }
  }
}
