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

package com.rollupdb.util;

import java.io.Serializable;
import java.util.concurrent.TimeUnit;

/**
 * An abstraction of the wall clock used to stamp writes and anchor retention windows.
 */
public interface Clock {

  /**
   * A clock that returns the actual time reported by the system.
   * This clock is guaranteed to be serializable.
   */
  Clock SYSTEM_CLOCK = new SerializableClock() {
    @Override public long nowMillis() {
      return System.currentTimeMillis();
    }
    @Override public long nowSeconds() {
      return TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis());
    }
  };

  /**
   * Returns the current time in milliseconds since the epoch.
   *
   * @return The current time in milliseconds since the epoch.
   * @see System#currentTimeMillis()
   */
  long nowMillis();

  /**
   * Returns the current time in whole seconds since the epoch, truncated.
   *
   * @return The current UNIX time in seconds.
   */
  long nowSeconds();
}

/**
 * A typedef to support anonymous {@link Clock} implementations that are also {@link Serializable}.
 */
interface SerializableClock extends Clock, Serializable { }
