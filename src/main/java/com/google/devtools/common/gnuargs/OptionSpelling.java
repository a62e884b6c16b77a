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
import com.google.common.base.CharMatcher;
import com.google.devtools.common.gnuargs.ArgumentParser.ConstructionException;
import javax.annotation.Nullable;

/**
 * One textual form by which an option can be written on the command line, together with the value
 * requirement of that form. A single option may have several spellings whose arities differ; for
 * example {@code mktemp} declares {@code -p DIR} (required) and {@code --tmpdir[=DIR]} (optional).
 *
 * <p>Spellings are most conveniently created from GNU usage-style declarations:
 *
 * <pre>
 *   -c                 short flag
 *   -n NUM             short option with a required value
 *   -p[DIR]            short option whose value may only be attached
 *   --lines=NUM        long option with a required value
 *   --color[=WHEN]     long option whose value may only be attached with '='
 *   ---presume-input-pipe
 *                      hidden long flag, typed as ---presume-input-pipe
 * </pre>
 */
@AutoValue
public abstract class OptionSpelling {

  private static final CharMatcher VALUE_NAME_CHARS =
      CharMatcher.inRange('A', 'Z')
          .or(CharMatcher.inRange('a', 'z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_-"));

  /** Creates a short flag, e.g. {@code -v}. */
  public static OptionSpelling shortFlag(char c) {
    return create(false, String.valueOf(c), false, ValueArity.NONE, null, null);
  }

  /** Creates a value-taking short spelling, e.g. {@code -n NUM}. */
  public static OptionSpelling shortOption(char c, ValueArity arity, String valueName) {
    return create(false, String.valueOf(c), false, arity, valueName, null);
  }

  /** Creates a long flag, e.g. {@code --verbose}. */
  public static OptionSpelling longFlag(String name) {
    return create(true, name, false, ValueArity.NONE, null, null);
  }

  /** Creates a value-taking long spelling, e.g. {@code --lines=NUM}. */
  public static OptionSpelling longOption(String name, ValueArity arity, String valueName) {
    return create(true, name, false, arity, valueName, null);
  }

  /**
   * Parses a usage-style declaration into a spelling.
   *
   * @throws ConstructionException if the declaration is malformed
   */
  public static OptionSpelling parse(String declaration) {
    if (declaration.startsWith("---")) {
      OptionSpelling visible = parse(declaration.substring(1));
      if (visible.isHidden()) {
        throw new ConstructionException("Invalid option declaration '" + declaration + "'");
      }
      return visible.hidden();
    }
    if (declaration.startsWith("--")) {
      String rest = declaration.substring(2);
      int bracket = rest.indexOf("[=");
      if (bracket >= 0) {
        if (!rest.endsWith("]")) {
          throw new ConstructionException("Unterminated optional value in '" + declaration + "'");
        }
        return longOption(
            rest.substring(0, bracket),
            ValueArity.OPTIONAL,
            rest.substring(bracket + 2, rest.length() - 1));
      }
      int equals = rest.indexOf('=');
      if (equals >= 0) {
        return longOption(
            rest.substring(0, equals), ValueArity.REQUIRED, rest.substring(equals + 1));
      }
      return longFlag(rest);
    }
    if (declaration.startsWith("-") && declaration.length() >= 2) {
      char c = declaration.charAt(1);
      String rest = declaration.substring(2);
      if (rest.isEmpty()) {
        return shortFlag(c);
      }
      if (rest.startsWith(" ")) {
        return shortOption(c, ValueArity.REQUIRED, rest.substring(1));
      }
      if (rest.startsWith("[") && rest.endsWith("]")) {
        return shortOption(c, ValueArity.OPTIONAL, rest.substring(1, rest.length() - 1));
      }
    }
    throw new ConstructionException("Invalid option declaration '" + declaration + "'");
  }

  private static OptionSpelling create(
      boolean isLong,
      String name,
      boolean hidden,
      ValueArity arity,
      @Nullable String valueName,
      @Nullable String implicitValue) {
    if (isLong) {
      // A hidden long name keeps the third hyphen, so it never shares a prefix with visible names.
      String bare = hidden && name.startsWith("-") ? name.substring(1) : name;
      if (bare.isEmpty() || bare.startsWith("-") || name.indexOf('=') >= 0) {
        throw new ConstructionException("Invalid long option name '" + name + "'");
      }
    } else if (name.charAt(0) == '-' || name.charAt(0) == '=' || name.charAt(0) == ' ') {
      throw new ConstructionException("Invalid short option character '" + name + "'");
    }
    if (arity.takesValue()) {
      if (valueName == null || valueName.isEmpty() || !VALUE_NAME_CHARS.matchesAllOf(valueName)) {
        throw new ConstructionException(
            String.format("Option '%s' takes a value but declares no value name", name));
      }
    } else if (valueName != null) {
      throw new ConstructionException(
          String.format("Option '%s' takes no value but declares value name %s", name, valueName));
    }
    if (implicitValue != null && arity == ValueArity.REQUIRED) {
      throw new ConstructionException(
          String.format("Option '%s' requires a value and cannot have an implicit one", name));
    }
    return new AutoValue_OptionSpelling(isLong, name, hidden, arity, valueName, implicitValue);
  }

  /** Whether this is a {@code --name} spelling rather than a {@code -c} one. */
  public abstract boolean isLongForm();

  /**
   * The name without the leading {@code --} of a long spelling or {@code -} of a short one. A
   * hidden long spelling keeps its third hyphen, as in {@code -presume-input-pipe}.
   */
  public abstract String getName();

  /** Hidden spellings are matched like any other but are left out of help listings. */
  public abstract boolean isHidden();

  public abstract ValueArity getArity();

  /** The placeholder shown in usage text, e.g. {@code NUM}; null for flags. */
  @Nullable
  public abstract String getValueName();

  /**
   * The value used when this spelling is given without one: always for {@link ValueArity#NONE}
   * spellings of a value-carrying option, and for a bare {@link ValueArity#OPTIONAL} spelling.
   */
  @Nullable
  public abstract String getImplicitValue();

  /** Returns a copy of this spelling that supplies {@code implicitValue} when given bare. */
  public OptionSpelling withImplicitValue(String implicitValue) {
    return create(isLongForm(), getName(), isHidden(), getArity(), getValueName(), implicitValue);
  }

  /**
   * Returns a copy of this long spelling that is hidden from help listings. Users type the hidden
   * spelling with three hyphens, e.g. {@code ---follow-name}.
   */
  public OptionSpelling hidden() {
    if (!isLongForm()) {
      throw new ConstructionException("Only long spellings can be hidden: -" + getName());
    }
    if (isHidden()) {
      return this;
    }
    return create(true, "-" + getName(), true, getArity(), getValueName(), getImplicitValue());
  }

  char getShortChar() {
    return getName().charAt(0);
  }

  /** The spelling as a user types it: {@code -c} or {@code --name}. */
  public String getCommandLineForm() {
    return (isLongForm() ? "--" : "-") + getName();
  }

  /** The spelling as usage text shows it, e.g. {@code --color[=WHEN]} or {@code -n NUM}. */
  public String getUsageForm() {
    String form = getCommandLineForm();
    switch (getArity()) {
      case REQUIRED:
        return form + (isLongForm() ? "=" : " ") + getValueName();
      case OPTIONAL:
        return form + (isLongForm() ? "[=" : "[") + getValueName() + "]";
      default:
        return form;
    }
  }

  @Override
  public final String toString() {
    return getUsageForm();
  }
}
