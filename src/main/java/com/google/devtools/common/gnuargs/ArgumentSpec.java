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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.devtools.common.gnuargs.ArgumentParser.ConstructionException;
import com.google.devtools.common.gnuargs.ParsedArguments.Request;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The complete, validated description of the arguments one utility accepts: its options, its
 * positional slots and its deprecated numeric shorthands. The lookup tables are computed once at
 * construction; an instance is read-only afterwards and may be shared by any number of parses.
 */
@Immutable
public final class ArgumentSpec {

  /**
   * Which reading wins when an argument like {@code -5} is both a declared short option and a
   * numeric shorthand the utility binds.
   */
  public enum NumericPrecedence {
    SHORT_OPTION_FIRST,
    SHORTHAND_FIRST,
  }

  /**
   * A spelling together with the option it belongs to. Two bindings are equal when they are {@link
   * #equivalentForParsing}, which lets the prefix resolver treat long spellings of one option as a
   * single candidate.
   */
  static final class Binding {
    final OptionSpec option;
    final OptionSpelling spelling;

    Binding(OptionSpec option, OptionSpelling spelling) {
      this.option = option;
      this.spelling = spelling;
    }

    /**
     * Whether the two bindings produce the same events for the same input: same option, same value
     * arity and same implicit value.
     */
    boolean equivalentForParsing(Binding other) {
      return option.getId().equals(other.option.getId())
          && spelling.getArity() == other.spelling.getArity()
          && Objects.equals(spelling.getImplicitValue(), other.spelling.getImplicitValue());
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Binding && equivalentForParsing((Binding) o);
    }

    @Override
    public int hashCode() {
      return Objects.hash(option.getId(), spelling.getArity(), spelling.getImplicitValue());
    }

    @Override
    public String toString() {
      return spelling.getUsageForm() + " of " + option.getId();
    }
  }

  private final ImmutableList<OptionSpec> options;
  private final ImmutableMap<String, OptionSpec> optionsById;
  private final ImmutableMap<String, Binding> longBindings;
  private final ImmutableMap<Character, Binding> shortBindings;
  private final ImmutableList<PositionalSlot> positionals;
  private final ImmutableList<NumericShorthand> shorthands;
  private final NumericPrecedence numericPrecedence;
  private final ImmutableMap<String, Request> requests;

  private ArgumentSpec(
      ImmutableList<OptionSpec> options,
      ImmutableMap<String, OptionSpec> optionsById,
      ImmutableMap<String, Binding> longBindings,
      ImmutableMap<Character, Binding> shortBindings,
      ImmutableList<PositionalSlot> positionals,
      ImmutableList<NumericShorthand> shorthands,
      NumericPrecedence numericPrecedence,
      ImmutableMap<String, Request> requests) {
    this.options = options;
    this.optionsById = optionsById;
    this.longBindings = longBindings;
    this.shortBindings = shortBindings;
    this.positionals = positionals;
    this.shorthands = shorthands;
    this.numericPrecedence = numericPrecedence;
    this.requests = requests;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder holding everything this spec declares. */
  public Builder toBuilder() {
    Builder builder = builder().numericPrecedence(numericPrecedence);
    options.forEach(builder::addOption);
    positionals.forEach(builder::addPositional);
    shorthands.forEach(builder::addShorthand);
    builder.requests.putAll(requests);
    return builder;
  }

  /**
   * Returns a copy of this spec with the given positional slots in place of the declared ones.
   * Utilities whose operand shape depends on an option, like {@code cp -t DIR SOURCE...}, parse
   * with the variant that matches the invocation.
   */
  public ArgumentSpec withPositionals(PositionalSlot... slots) {
    Builder builder = toBuilder();
    builder.positionals.clear();
    Arrays.stream(slots).forEach(builder::addPositional);
    return builder.build();
  }

  /** Builder for {@link ArgumentSpec}; {@link #build} validates the whole description. */
  public static final class Builder {
    private final List<OptionSpec> options = new ArrayList<>();
    private final List<PositionalSlot> positionals = new ArrayList<>();
    private final List<NumericShorthand> shorthands = new ArrayList<>();
    private NumericPrecedence numericPrecedence = NumericPrecedence.SHORT_OPTION_FIRST;
    private final Map<String, Request> requests = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addOption(OptionSpec option) {
      options.add(Preconditions.checkNotNull(option));
      return this;
    }

    /**
     * Adds the option that asks for usage text, e.g. {@code --help}. Matching it ends the parse
     * before operands are checked, so {@code cp --help} needs no operands.
     */
    @CanIgnoreReturnValue
    public Builder addHelpOption(OptionSpec option) {
      addOption(option);
      requests.put(option.getId(), Request.HELP);
      return this;
    }

    /** Adds the option that asks for version text, e.g. {@code --version}. */
    @CanIgnoreReturnValue
    public Builder addVersionOption(OptionSpec option) {
      addOption(option);
      requests.put(option.getId(), Request.VERSION);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addPositional(PositionalSlot slot) {
      positionals.add(Preconditions.checkNotNull(slot));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addShorthand(NumericShorthand shorthand) {
      shorthands.add(Preconditions.checkNotNull(shorthand));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder numericPrecedence(NumericPrecedence numericPrecedence) {
      this.numericPrecedence = Preconditions.checkNotNull(numericPrecedence);
      return this;
    }

    /**
     * Validates and freezes the description.
     *
     * @throws ConstructionException if the description is structurally inconsistent
     */
    public ArgumentSpec build() {
      Map<String, OptionSpec> byId = new LinkedHashMap<>();
      Map<String, Binding> longs = new LinkedHashMap<>();
      Map<Character, Binding> shorts = new LinkedHashMap<>();
      for (OptionSpec option : options) {
        if (byId.putIfAbsent(option.getId(), option) != null) {
          throw new ConstructionException("Duplicate option identity '" + option.getId() + "'");
        }
        for (OptionSpelling spelling : option.getSpellings()) {
          Binding binding = new Binding(option, spelling);
          Binding previous =
              spelling.isLongForm()
                  ? longs.putIfAbsent(spelling.getName(), binding)
                  : shorts.putIfAbsent(spelling.getShortChar(), binding);
          if (previous != null) {
            throw new ConstructionException(
                String.format(
                    "Spelling %s is declared by both '%s' and '%s'",
                    spelling.getCommandLineForm(), previous.option.getId(), option.getId()));
          }
        }
      }
      for (NumericShorthand shorthand : shorthands) {
        if (!byId.containsKey(shorthand.getOptionId())) {
          throw new ConstructionException(
              String.format(
                  "Numeric shorthand %sN is bound to undeclared option '%s'",
                  shorthand.getSign().getSymbol(), shorthand.getOptionId()));
        }
      }
      validatePositionals(positionals);
      return new ArgumentSpec(
          ImmutableList.copyOf(options),
          ImmutableMap.copyOf(byId),
          ImmutableMap.copyOf(longs),
          ImmutableMap.copyOf(shorts),
          ImmutableList.copyOf(positionals),
          ImmutableList.copyOf(shorthands),
          numericPrecedence,
          ImmutableMap.copyOf(requests));
    }

    private static void validatePositionals(List<PositionalSlot> slots) {
      List<String> names = new ArrayList<>();
      PositionalSlot lastUnbounded = null;
      for (int i = 0; i < slots.size(); i++) {
        PositionalSlot slot = slots.get(i);
        if (names.contains(slot.getName())) {
          throw new ConstructionException("Duplicate positional slot '" + slot.getName() + "'");
        }
        names.add(slot.getName());
        if (slot.isGreedy()) {
          if (i != slots.size() - 1) {
            throw new ConstructionException(
                "Greedy slot '" + slot.getName() + "' must be the last positional slot");
          }
          for (PositionalSlot before : slots.subList(0, i)) {
            if (!before.getArity().isFixed()) {
              throw new ConstructionException(
                  String.format(
                      "Slot '%s' before greedy slot '%s' must take a fixed number of operands",
                      before.getName(), slot.getName()));
            }
          }
        }
        if (slot.getArity().isFixed()) {
          lastUnbounded = null;
        } else if (!slot.getArity().isBounded()) {
          if (lastUnbounded != null) {
            throw new ConstructionException(
                String.format(
                    "Unbounded slots '%s' and '%s' need a fixed slot between them",
                    lastUnbounded.getName(), slot.getName()));
          }
          lastUnbounded = slot;
        }
      }
    }
  }

  public ImmutableList<OptionSpec> getOptions() {
    return options;
  }

  /** The options a help listing should show: those with at least one visible spelling. */
  public ImmutableList<OptionSpec> getVisibleOptions() {
    return options.stream()
        .filter(o -> !o.getVisibleSpellings().isEmpty())
        .collect(ImmutableList.toImmutableList());
  }

  @Nullable
  public OptionSpec getOption(String id) {
    return optionsById.get(id);
  }

  public ImmutableList<PositionalSlot> getPositionals() {
    return positionals;
  }

  public ImmutableList<NumericShorthand> getShorthands() {
    return shorthands;
  }

  public NumericPrecedence getNumericPrecedence() {
    return numericPrecedence;
  }

  /** The request an option stands for, or null for an ordinary option. */
  @Nullable
  public Request getRequest(String optionId) {
    return requests.get(optionId);
  }

  /** Long name to binding, in declaration order. Hidden spellings are included. */
  ImmutableMap<String, Binding> getLongBindings() {
    return longBindings;
  }

  @Nullable
  Binding getShortBinding(char c) {
    return shortBindings.get(c);
  }

  boolean declaresShort(char c) {
    return shortBindings.containsKey(c);
  }
}
