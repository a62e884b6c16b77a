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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.devtools.common.gnuargs.OptionsParsingException.ErrorKind;
import javax.annotation.Nullable;

/**
 * The representation of one recognized argument: an option occurrence or one operand assigned to
 * a positional slot. The value is kept unconverted; {@link #getConvertedValue} turns it into a
 * typed value on demand.
 *
 * <p>Every occurrence is reported, including repeats of the same option. Deciding which occurrence
 * wins is left to the {@link SettingsReducer}.
 */
@AutoValue
public abstract class ArgEvent {

  /** Whether the event comes from an option or from an operand. */
  public enum Kind {
    OPTION,
    OPERAND,
  }

  static ArgEvent option(
      OptionSpec option,
      @Nullable OptionSpelling spelling,
      @Nullable String value,
      String commandLineForm) {
    return new AutoValue_ArgEvent(
        Kind.OPTION, option.getId(), value, Preconditions.checkNotNull(commandLineForm), spelling);
  }

  static ArgEvent operand(PositionalSlot slot, String value) {
    return new AutoValue_ArgEvent(Kind.OPERAND, slot.getName(), value, value, null);
  }

  public abstract Kind getKind();

  /** The option identity or the positional slot name. */
  public abstract String getId();

  /**
   * The raw value: the option's value after enumerated-value resolution, the implicit value of a
   * bare spelling, or the operand text. Null for flags and for bare optional-value spellings that
   * declare no implicit value.
   */
  @Nullable
  public abstract String getValue();

  /** How the occurrence was written, e.g. {@code --so=time}, {@code -n 5} or {@code file.txt}. */
  public abstract String getCommandLineForm();

  /** The declared spelling that matched; null for operands and numeric shorthands. */
  @Nullable
  public abstract OptionSpelling getSpelling();

  public boolean isOption() {
    return getKind() == Kind.OPTION;
  }

  public boolean hasValue() {
    return getValue() != null;
  }

  /** Whether this event carries the given option identity or slot name. */
  public boolean is(String id) {
    return getId().equals(id);
  }

  /**
   * Converts the value with {@code converter}.
   *
   * @throws OptionsParsingException naming this occurrence, of kind {@link
   *     ErrorKind#INVALID_VALUE} if the value is missing, otherwise of the converter's kind
   */
  public <T> T getConvertedValue(Converter<T> converter) throws OptionsParsingException {
    String context =
        isOption()
            ? "While parsing option " + getCommandLineForm()
            : "While parsing " + getId() + " operand";
    String value = getValue();
    if (value == null) {
      throw new OptionsParsingException(
          ErrorKind.INVALID_VALUE,
          context + ": expected " + converter.getTypeDescription(),
          getCommandLineForm());
    }
    try {
      return converter.convert(value);
    } catch (OptionsParsingException e) {
      // The converter doesn't know the option name, so we supply it here by re-throwing:
      throw e.withContext(context);
    }
  }
}
