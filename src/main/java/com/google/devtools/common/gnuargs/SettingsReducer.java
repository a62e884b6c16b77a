// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.devtools.common.gnuargs;

/**
 * Applies one {@link ArgEvent} to a settings record owned by the caller. A utility writes a single
 * reducer that switches over event identities, so every way an argument changes the settings is
 * visible in one place. One event may update several fields; a later event overrides what an
 * earlier one set.
 *
 * <p>Reducers may return the record they were given, after mutating it, or a new one.
 *
 * @param <S> the settings type
 */
@FunctionalInterface
public interface SettingsReducer<S> {

  /**
   * Returns the settings after {@code event}.
   *
   * @throws OptionsParsingException if the event's value cannot be converted, typically rethrown
   *     from {@link ArgEvent#getConvertedValue}
   */
  S apply(S settings, ArgEvent event) throws OptionsParsingException;

  /** Folds {@code events} into {@code initial}, in order. */
  static <S> S fold(S initial, Iterable<ArgEvent> events, SettingsReducer<S> reducer)
      throws OptionsParsingException {
    S settings = initial;
    for (ArgEvent event : events) {
      settings = reducer.apply(settings, event);
    }
    return settings;
  }
}
