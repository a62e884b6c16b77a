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

import com.google.devtools.common.gnuargs.OptionsParsingException.ErrorKind;
import com.google.devtools.common.gnuargs.PrefixResolver.Resolution;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A converter superclass for converters that parse enums.
 *
 * <p>Just subclass this class, creating a zero argument constructor that calls {@link
 * #EnumConverter(Class, String)}.
 *
 * <p>Each enum member is accepted under its {@link ValueSet#ofEnum value name}, the lowercased
 * constant with underscores written as hyphens, or under any unambiguous prefix of it.
 */
public abstract class EnumConverter<T extends Enum<T>> implements Converter<T> {

  private final Class<T> enumType;
  private final String typeName;
  private final Map<String, T> byValueName = new LinkedHashMap<>();

  /**
   * Creates a new enum converter. You *must* implement a zero-argument constructor that delegates
   * to this constructor, passing in the appropriate parameters.
   *
   * @param enumType The type of your enumeration; usually a class literal like MyEnum.class
   * @param typeName The intuitive name of your enumeration, for example, the type name for
   *     QuotingStyle might be "quoting style".
   */
  protected EnumConverter(Class<T> enumType, String typeName) {
    this.enumType = enumType;
    this.typeName = typeName;
    for (T value : enumType.getEnumConstants()) {
      byValueName.put(ValueSet.memberName(value), value);
    }
  }

  /** Implements {@link #convert(String)}. */
  @Override
  public T convert(String input) throws OptionsParsingException {
    Resolution<T> resolution = PrefixResolver.resolve(input, byValueName);
    if (resolution.isMatch()) {
      return resolution.getValue();
    }
    if (resolution.getKind() == PrefixResolver.Kind.AMBIGUOUS) {
      throw OptionsParsingException.ambiguousValue(typeName, input, resolution.getCandidates());
    }
    throw new OptionsParsingException(
        ErrorKind.INVALID_VALUE,
        "Not a valid " + typeName + ": '" + input + "' (should be " + getTypeDescription() + ")",
        input);
  }

  /** Returns the value set that accepts exactly the words this converter accepts. */
  public ValueSet toValueSet() {
    return ValueSet.ofEnum(enumType);
  }

  /** Implements {@link #getTypeDescription()}. */
  @Override
  public final String getTypeDescription() {
    return Converters.joinEnglishList(byValueName.keySet());
  }
}
