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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Unambiguous prefix inference, GNU style. Used for long option names and for the words of an
 * enumerated option value, with identical semantics:
 *
 * <ul>
 *   <li>an exact match always wins, even if the candidate also prefixes longer names;
 *   <li>otherwise every name the candidate is a prefix of is collected; none is a miss, one is a
 *       unique prefix;
 *   <li>several names are ambiguous unless they all stand for the same thing. Two spellings of one
 *       option, or two synonyms of one enumerated value, do not compete with each other.
 * </ul>
 */
public final class PrefixResolver {

  private PrefixResolver() {}

  /** The outcome of a resolution. */
  public enum Kind {
    EXACT,
    UNIQUE_PREFIX,
    AMBIGUOUS,
    NO_MATCH,
  }

  /** The result of resolving one candidate against a table. */
  @AutoValue
  public abstract static class Resolution<V> {
    public abstract Kind getKind();

    /** The matched name, for {@link Kind#EXACT} and {@link Kind#UNIQUE_PREFIX}. */
    @Nullable
    public abstract String getName();

    /** The table value of the matched name. */
    @Nullable
    public abstract V getValue();

    /** The competing names, in table order, for {@link Kind#AMBIGUOUS}. */
    public abstract ImmutableList<String> getCandidates();

    public boolean isMatch() {
      return getKind() == Kind.EXACT || getKind() == Kind.UNIQUE_PREFIX;
    }

    private static <V> Resolution<V> match(Kind kind, String name, V value) {
      return new AutoValue_PrefixResolver_Resolution<>(kind, name, value, ImmutableList.of());
    }

    private static <V> Resolution<V> ambiguous(List<String> candidates) {
      return new AutoValue_PrefixResolver_Resolution<>(
          Kind.AMBIGUOUS, null, null, ImmutableList.copyOf(candidates));
    }

    private static <V> Resolution<V> noMatch() {
      return new AutoValue_PrefixResolver_Resolution<>(
          Kind.NO_MATCH, null, null, ImmutableList.of());
    }
  }

  /**
   * Resolves {@code candidate} against the names of {@code table}. Names whose values are {@link
   * Object#equals equal} are treated as one; when such a group is matched by prefix the first name
   * in iteration order is reported.
   */
  public static <V> Resolution<V> resolve(String candidate, Map<String, V> table) {
    Preconditions.checkNotNull(candidate);
    V exact = table.get(candidate);
    if (exact != null) {
      return Resolution.match(Kind.EXACT, candidate, exact);
    }
    List<String> candidates = new ArrayList<>();
    for (String name : table.keySet()) {
      if (name.startsWith(candidate)) {
        candidates.add(name);
      }
    }
    if (candidates.isEmpty()) {
      return Resolution.noMatch();
    }
    String first = candidates.get(0);
    V value = table.get(first);
    for (String other : candidates) {
      if (!Objects.equals(value, table.get(other))) {
        return Resolution.ambiguous(candidates);
      }
    }
    return Resolution.match(Kind.UNIQUE_PREFIX, first, value);
  }

  /** Resolves {@code candidate} against a plain list of distinct names. */
  public static Resolution<String> resolve(String candidate, Collection<String> names) {
    ImmutableMap<String, String> identity = Maps.toMap(names, name -> name);
    return resolve(candidate, identity);
  }
}
