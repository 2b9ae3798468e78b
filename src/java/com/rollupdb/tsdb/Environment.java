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

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;

/**
 * The environment dimension of a bucket.  Every write to a concrete environment is mirrored into
 * {@link #AGGREGATE}, which therefore always holds the combination of all environments.
 */
public final class Environment implements Comparable<Environment> {

  /**
   * Sentinel for "no environment", i.e. all environments combined.  Sorts before every concrete
   * environment.
   */
  public static final Environment AGGREGATE = new Environment(null);

  @Nullable private final Long id;

  private Environment(@Nullable Long id) {
    this.id = id;
  }

  /**
   * Returns the environment with the given identifier.
   *
   * @param id Application-defined environment identifier.
   * @return The concrete environment.
   */
  public static Environment of(long id) {
    return new Environment(id);
  }

  public boolean isAggregate() {
    return id == null;
  }

  /**
   * Returns the environment identifier.
   *
   * @throws IllegalStateException if this is the {@link #AGGREGATE} environment
   */
  public long getId() {
    if (id == null) {
      throw new IllegalStateException("The aggregate environment has no id.");
    }
    return id;
  }

  @Override
  public int compareTo(Environment other) {
    return ComparisonChain.start()
        .compare(id, other.id, Ordering.<Long>natural().nullsFirst())
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof Environment) && Objects.equal(id, ((Environment) obj).id);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id);
  }

  @Override
  public String toString() {
    return isAggregate() ? "aggregate" : "env:" + id;
  }
}
