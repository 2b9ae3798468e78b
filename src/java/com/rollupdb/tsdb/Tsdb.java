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

/**
 * A time-series database: counters, distinct counts and frequency tables sharing one
 * {@link RollupSchedule}.  Callers depend on this interface only; backends are swappable.
 */
public interface Tsdb extends CounterStore, DistinctCountStore, FrequencyStore {

  /**
   * Returns the rollups this database buckets every write into.
   */
  RollupSchedule getSchedule();

  /**
   * Drops all stored data.
   */
  void flush();
}
