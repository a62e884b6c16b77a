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

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.devtools.common.gnuargs.ArgumentParser.ConstructionException;
import com.google.devtools.common.gnuargs.OptionsParsingException.ErrorKind;
import com.google.devtools.common.gnuargs.PrefixResolver.Resolution;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.concurrent.Immutable;

/**
 * The words an enumerated option value may take. Each accepted word belongs to one member; a
 * member may be reachable through several synonyms, as in {@code ls --color=yes|always|force}.
 * Words are matched by unambiguous prefix, and a prefix shared only by synonyms of one member is
 * not ambiguous.
 */
@Immutable
public final class ValueSet {

  /** Accepted word to member, in declaration order. */
  private final ImmutableMap<String, String> wordToMember;

  private final ImmutableList<String> members;

  private ValueSet(Map<String, String> wordToMember) {
    this.wordToMember = ImmutableMap.copyOf(wordToMember);
    this.members = ImmutableList.copyOf(wordToMember.values().stream().distinct().iterator());
  }

  /** A set where every member is accepted under its own name only. */
  public static ValueSet of(String... members) {
    Builder builder = builder();
    for (String member : members) {
      builder.add(member);
    }
    return builder.build();
  }

  /**
   * A set with one member per enum constant, named by the lowercased constant with underscores
   * turned into hyphens: {@code SINGLE_COLUMN} is {@code single-column}.
   */
  public static <E extends Enum<E>> ValueSet ofEnum(Class<E> enumType) {
    Builder builder = builder();
    for (E constant : enumType.getEnumConstants()) {
      builder.add(memberName(constant));
    }
    return builder.build();
  }

  static String memberName(Enum<?> constant) {
    return Ascii.toLowerCase(constant.name()).replace('_', '-');
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Collects members and their synonyms. */
  public static final class Builder {
    private final Map<String, String> wordToMember = new LinkedHashMap<>();

    /** Adds {@code member}, accepted under its own name and any of {@code synonyms}. */
    @CanIgnoreReturnValue
    public Builder add(String member, String... synonyms) {
      put(member, member);
      for (String synonym : synonyms) {
        put(synonym, member);
      }
      return this;
    }

    private void put(String word, String member) {
      if (word.isEmpty()) {
        throw new ConstructionException("Enumerated values must not be empty");
      }
      String previous = wordToMember.putIfAbsent(word, member);
      if (previous != null) {
        throw new ConstructionException(
            String.format("Value '%s' is declared for both '%s' and '%s'", word, previous, member));
      }
    }

    public ValueSet build() {
      if (wordToMember.isEmpty()) {
        throw new ConstructionException("An enumerated value set needs at least one member");
      }
      return new ValueSet(wordToMember);
    }
  }

  /** The distinct members, in declaration order. */
  public ImmutableList<String> getMembers() {
    return members;
  }

  /** Every accepted word, synonyms included, in declaration order. */
  public ImmutableList<String> getWords() {
    return wordToMember.keySet().asList();
  }

  public boolean isMember(String value) {
    return members.contains(value);
  }

  /**
   * Resolves a raw value to the member it names.
   *
   * @param option the option as written, used in diagnostics
   * @throws OptionsParsingException of kind {@link ErrorKind#AMBIGUOUS_VALUE} or {@link
   *     ErrorKind#INVALID_VALUE}
   */
  public String resolve(String option, String rawValue) throws OptionsParsingException {
    Resolution<String> resolution = PrefixResolver.resolve(rawValue, wordToMember);
    switch (resolution.getKind()) {
      case EXACT:
      case UNIQUE_PREFIX:
        return resolution.getValue();
      case AMBIGUOUS:
        throw OptionsParsingException.ambiguousValue(option, rawValue, resolution.getCandidates());
      case NO_MATCH:
        break;
    }
    throw new OptionsParsingException(
        ErrorKind.INVALID_VALUE,
        String.format(
            "invalid argument '%s' for '%s'; valid arguments are: '%s'",
            rawValue, option, Joiner.on("', '").join(getWords())),
        rawValue);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ValueSet && ((ValueSet) o).wordToMember.equals(wordToMember);
  }

  @Override
  public int hashCode() {
    return wordToMember.hashCode();
  }

  @Override
  public String toString() {
    return Joiner.on(", ").join(getWords());
  }
}
