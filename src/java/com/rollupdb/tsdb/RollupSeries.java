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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import com.rollupdb.base.MorePreconditions;

/**
 * The granularity chosen to answer a range query and the bucket epochs it reads, ascending.
 */
public final class RollupSeries {

  private final long granularity;
  private final ImmutableList<Long> epochs;

  public RollupSeries(long granularity, List<Long> epochs) {
    this.granularity = MorePreconditions.checkPositive(granularity);
    this.epochs = ImmutableList.copyOf(Preconditions.checkNotNull(epochs));
  }

  public long getGranularity() {
    return granularity;
  }

  public ImmutableList<Long> getEpochs() {
    return epochs;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RollupSeries)) {
      return false;
    }
    RollupSeries other = (RollupSeries) obj;
    return granularity == other.granularity && epochs.equals(other.epochs);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(granularity, epochs);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("granularity", granularity)
        .add("epochs", epochs)
        .toString();
  }
}
