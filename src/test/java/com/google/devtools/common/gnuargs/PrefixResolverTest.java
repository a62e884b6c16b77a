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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.devtools.common.gnuargs.PrefixResolver.Kind;
import com.google.devtools.common.gnuargs.PrefixResolver.Resolution;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PrefixResolver}. */
@RunWith(JUnit4.class)
public class PrefixResolverTest {

  private static final ImmutableList<String> LS_LONG_NAMES =
      ImmutableList.of("color", "context", "classify", "time", "time-style", "tabsize");

  @Test
  public void exactMatchWinsOverLongerNames() {
    Resolution<String> resolution = PrefixResolver.resolve("time", LS_LONG_NAMES);
    assertThat(resolution.getKind()).isEqualTo(Kind.EXACT);
    assertThat(resolution.getName()).isEqualTo("time");
    assertThat(resolution.isMatch()).isTrue();
  }

  @Test
  public void uniquePrefix() {
    Resolution<String> resolution = PrefixResolver.resolve("col", LS_LONG_NAMES);
    assertThat(resolution.getKind()).isEqualTo(Kind.UNIQUE_PREFIX);
    assertThat(resolution.getName()).isEqualTo("color");
    assertThat(resolution.getValue()).isEqualTo("color");
  }

  @Test
  public void ambiguousPrefixListsEveryCandidate() {
    Resolution<String> resolution = PrefixResolver.resolve("c", LS_LONG_NAMES);
    assertThat(resolution.getKind()).isEqualTo(Kind.AMBIGUOUS);
    assertThat(resolution.isMatch()).isFalse();
    assertThat(resolution.getCandidates())
        .containsExactly("color", "context", "classify")
        .inOrder();
    assertThat(resolution.getName()).isNull();
  }

  @Test
  public void prefixOfTwoNamesIsAmbiguous() {
    assertThat(PrefixResolver.resolve("tim", LS_LONG_NAMES).getCandidates())
        .containsExactly("time", "time-style");
  }

  @Test
  public void noMatch() {
    Resolution<String> resolution = PrefixResolver.resolve("foo", LS_LONG_NAMES);
    assertThat(resolution.getKind()).isEqualTo(Kind.NO_MATCH);
    assertThat(resolution.getCandidates()).isEmpty();
  }

  @Test
  public void candidateLongerThanEveryNameIsNoMatch() {
    assertThat(PrefixResolver.resolve("colorful", LS_LONG_NAMES).getKind())
        .isEqualTo(Kind.NO_MATCH);
  }

  @Test
  public void namesWithEqualValuesDoNotCompete() {
    ImmutableMap<String, String> table =
        ImmutableMap.of("always", "always", "auto", "auto", "force", "always", "yes", "always");
    Resolution<String> resolution = PrefixResolver.resolve("a", table);
    assertThat(resolution.getKind()).isEqualTo(Kind.AMBIGUOUS);

    ImmutableMap<String, String> synonyms =
        ImmutableMap.of("quiet", "quiet", "quit-early", "quiet");
    resolution = PrefixResolver.resolve("qui", synonyms);
    assertThat(resolution.getKind()).isEqualTo(Kind.UNIQUE_PREFIX);
    assertThat(resolution.getName()).isEqualTo("quiet");
    assertThat(resolution.getValue()).isEqualTo("quiet");
  }

  @Test
  public void resolutionIsDeterministic() {
    for (int i = 0; i < 3; i++) {
      assertThat(PrefixResolver.resolve("cl", LS_LONG_NAMES).getName()).isEqualTo("classify");
    }
  }
}
