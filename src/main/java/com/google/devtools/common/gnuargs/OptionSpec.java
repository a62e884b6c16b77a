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

import com.google.common.collect.ImmutableList;
import com.google.devtools.common.gnuargs.ArgumentParser.ConstructionException;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * One logical option of a utility: a stable identity, the spellings it can be written with, and
 * optionally the enumerated set its value must come from.
 *
 * <pre>
 * OptionSpec.builder("format")
 *     .spelling("--format=WORD")
 *     .spelling("-l", "long")
 *     .spelling("-m", "commas")
 *     .values(ValueSet.ofEnum(Format.class))
 *     .build();
 * </pre>
 */
@Immutable
public final class OptionSpec {

  private final String id;
  private final ImmutableList<OptionSpelling> spellings;
  @Nullable private final ValueSet values;
  private final String help;

  private OptionSpec(
      String id, ImmutableList<OptionSpelling> spellings, @Nullable ValueSet values, String help) {
    this.id = id;
    this.spellings = spellings;
    this.values = values;
    this.help = help;
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  /** Builder for {@link OptionSpec}. */
  public static final class Builder {
    private final String id;
    private final List<OptionSpelling> spellings = new ArrayList<>();
    @Nullable private ValueSet values;
    private String help = "";

    private Builder(String id) {
      this.id = id;
    }

    /** Adds a spelling from a usage-style declaration, see {@link OptionSpelling#parse}. */
    @CanIgnoreReturnValue
    public Builder spelling(String declaration) {
      return spelling(OptionSpelling.parse(declaration));
    }

    /** Adds a spelling that supplies {@code implicitValue} when given without a value. */
    @CanIgnoreReturnValue
    public Builder spelling(String declaration, String implicitValue) {
      return spelling(OptionSpelling.parse(declaration).withImplicitValue(implicitValue));
    }

    @CanIgnoreReturnValue
    public Builder spelling(OptionSpelling spelling) {
      spellings.add(spelling);
      return this;
    }

    /** Restricts the option's value to {@code values}, matched by unambiguous prefix. */
    @CanIgnoreReturnValue
    public Builder values(ValueSet values) {
      this.values = values;
      return this;
    }

    /** One line of description for the help collaborator. */
    @CanIgnoreReturnValue
    public Builder help(String help) {
      this.help = help;
      return this;
    }

    public OptionSpec build() {
      if (id.isEmpty()) {
        throw new ConstructionException("Options must have a non-empty identity");
      }
      if (spellings.isEmpty()) {
        throw new ConstructionException("Option '" + id + "' declares no spelling");
      }
      for (OptionSpelling spelling : spellings) {
        String implicitValue = spelling.getImplicitValue();
        if (values != null && implicitValue != null && !values.isMember(implicitValue)) {
          throw new ConstructionException(
              String.format(
                  "Implicit value '%s' of %s is not one of the values of option '%s'",
                  implicitValue, spelling.getCommandLineForm(), id));
        }
        if (values != null && !spelling.getArity().takesValue() && implicitValue == null) {
          throw new ConstructionException(
              String.format(
                  "Flag %s of enumerated option '%s' needs an implicit value",
                  spelling.getCommandLineForm(), id));
        }
      }
      return new OptionSpec(id, ImmutableList.copyOf(spellings), values, help);
    }
  }

  /** The identity carried by every event this option produces. */
  public String getId() {
    return id;
  }

  /** All spellings in declaration order, hidden ones included. */
  public ImmutableList<OptionSpelling> getSpellings() {
    return spellings;
  }

  /** The spellings a help listing should show. */
  public ImmutableList<OptionSpelling> getVisibleSpellings() {
    return spellings.stream().filter(s -> !s.isHidden()).collect(ImmutableList.toImmutableList());
  }

  @Nullable
  public ValueSet getValues() {
    return values;
  }

  public String getHelp() {
    return help;
  }

  @Override
  public String toString() {
    return String.format("option '%s' %s", id, spellings);
  }
}
