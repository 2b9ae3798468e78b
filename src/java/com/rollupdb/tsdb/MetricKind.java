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

import com.rollupdb.base.MorePreconditions;

/**
 * Identifies an independent metric namespace, for example "events seen per group".  Callers
 * define their own kinds; the stores never assume a particular set of them.
 */
public final class MetricKind implements Comparable<MetricKind> {

  private final String name;

  private MetricKind(String name) {
    this.name = MorePreconditions.checkNotBlank(name, "A metric kind must have a name.");
  }

  /**
   * Creates a metric kind.
   *
   * @param name Non-blank name of the kind.
   * @return A kind with the given name.
   */
  public static MetricKind of(String name) {
    return new MetricKind(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public int compareTo(MetricKind other) {
    return name.compareTo(other.name);
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof MetricKind) && name.equals(((MetricKind) obj).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
