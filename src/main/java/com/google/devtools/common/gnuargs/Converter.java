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
 * A converter is a little helper object that can take the raw String value of an {@link ArgEvent}
 * and turn it into an instance of type T (the type parameter to the converter). Settings reducers
 * call converters through {@link ArgEvent#getConvertedValue}, which attaches the option to any
 * failure.
 */
public interface Converter<T> {

  /**
   * Convert a string into type T. Please note that we assume that converting the same string (if
   * successful) will produce objects which are equal ({@link Object#equals}).
   */
  T convert(String input) throws OptionsParsingException;

  /**
   * The type description appears in error messages. E.g.: "a string", "a non-negative integer",
   * etc.
   */
  String getTypeDescription();
}
