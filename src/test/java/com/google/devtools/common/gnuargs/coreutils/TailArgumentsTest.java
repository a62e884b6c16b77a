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

package com.google.devtools.common.gnuargs.coreutils;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.devtools.common.gnuargs.ArgEvent;
import com.google.devtools.common.gnuargs.ArgumentParser;
import com.google.devtools.common.gnuargs.ArgumentSpec;
import com.google.devtools.common.gnuargs.Converters;
import com.google.devtools.common.gnuargs.EnumConverter;
import com.google.devtools.common.gnuargs.NumericShorthand;
import com.google.devtools.common.gnuargs.OptionSpec;
import com.google.devtools.common.gnuargs.OptionsParsingException;
import com.google.devtools.common.gnuargs.OptionsParsingException.ErrorKind;
import com.google.devtools.common.gnuargs.PositionalArity;
import com.google.devtools.common.gnuargs.PositionalSlot;
import com.google.devtools.common.gnuargs.ValueSet;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** End-to-end tests with the option table of {@code tail}, including its obsolete -N form. */
@RunWith(JUnit4.class)
public class TailArgumentsTest {

  enum FollowMode {
    DESCRIPTOR,
    NAME,
  }

  enum Mode {
    BYTES,
    LINES,
    BLOCKS,
  }

  static class FollowModeConverter extends EnumConverter<FollowMode> {
    FollowModeConverter() {
      super(FollowMode.class, "follow mode");
    }
  }

  /** Id of the option the obsolete {@code -N[lcbf]} and {@code +N[lcbf]} forms produce. */
  private static final String OBSOLETE = "obsolete-count";

  static final ArgumentSpec TAIL =
      ArgumentSpec.builder()
          .addOption(OptionSpec.builder("bytes").spelling("-c NUM").spelling("--bytes=NUM").build())
          .addOption(
              OptionSpec.builder("follow")
                  .spelling("-f", "descriptor")
                  .spelling("--follow[=HOW]", "descriptor")
                  .values(ValueSet.ofEnum(FollowMode.class))
                  .build())
          .addOption(OptionSpec.builder("follow-retry").spelling("-F").build())
          .addOption(
              OptionSpec.builder("max-unchanged-stats").spelling("--max-unchanged-stats=N").build())
          .addOption(OptionSpec.builder("lines").spelling("-n NUM").spelling("--lines=NUM").build())
          .addOption(OptionSpec.builder("pid").spelling("--pid=PID").build())
          .addOption(
              OptionSpec.builder("quiet")
                  .spelling("-q")
                  .spelling("--quiet")
                  .spelling("--silent")
                  .build())
          .addOption(OptionSpec.builder("retry").spelling("--retry").build())
          .addOption(
              OptionSpec.builder("sleep-interval")
                  .spelling("-s NUMBER")
                  .spelling("--sleep-interval=NUMBER")
                  .build())
          .addOption(OptionSpec.builder("verbose").spelling("-v").spelling("--verbose").build())
          .addOption(
              OptionSpec.builder("zero").spelling("-z").spelling("--zero-terminated").build())
          .addOption(
              OptionSpec.builder("presume-input-pipe").spelling("---presume-input-pipe").build())
          .addOption(OptionSpec.builder(OBSOLETE).spelling("---obsolete-count=SPEC").build())
          .addShorthand(
              NumericShorthand.minus(OBSOLETE)
                  .suffixLetters("lcbf")
                  .firstArgumentOnly(true)
                  .transform((sign, digits, suffix) -> sign.getSymbol() + digits + suffix)
                  .build())
          .addShorthand(
              NumericShorthand.plus(OBSOLETE)
                  .suffixLetters("lcbf")
                  .firstArgumentOnly(true)
                  .transform((sign, digits, suffix) -> sign.getSymbol() + digits + suffix)
                  .build())
          .addPositional(PositionalSlot.of("FILE", PositionalArity.atLeast(0)))
          .build();

  private static final ArgumentParser PARSER = ArgumentParser.builder().spec(TAIL).build();

  /** What {@code tail} decides from its arguments. */
  static final class Settings {
    FollowMode follow;
    Mode mode = Mode.LINES;
    long number = 10;
    boolean fromStart;
    long maxUnchangedStats = 5;
    long pid;
    boolean retry;
    long sleepInterval = 1;
    boolean verbose;
    boolean zero;
    boolean presumeInputPipe;
    final List<String> inputs = new ArrayList<>();

    Settings apply(ArgEvent event) throws OptionsParsingException {
      switch (event.getId()) {
        case "bytes":
          mode = Mode.BYTES;
          setCount(event);
          break;
        case "lines":
          mode = Mode.LINES;
          setCount(event);
          break;
        case "follow":
          follow = event.getConvertedValue(new FollowModeConverter());
          break;
        case "follow-retry":
          follow = FollowMode.NAME;
          retry = true;
          break;
        case "max-unchanged-stats":
          maxUnchangedStats = event.getConvertedValue(new Converters.NonNegativeLongConverter());
          break;
        case "pid":
          pid = event.getConvertedValue(new Converters.NonNegativeLongConverter());
          break;
        case "quiet":
          verbose = false;
          break;
        case "retry":
          retry = true;
          break;
        case "sleep-interval":
          sleepInterval = event.getConvertedValue(new Converters.NonNegativeLongConverter());
          break;
        case "verbose":
          verbose = true;
          break;
        case "zero":
          zero = true;
          break;
        case "presume-input-pipe":
          presumeInputPipe = true;
          break;
        case OBSOLETE:
          applyObsolete(event.getValue());
          break;
        case "FILE":
          inputs.add(event.getValue());
          break;
        default:
          throw new IllegalStateException("Unhandled argument " + event.getId());
      }
      return this;
    }

    /** NUM may carry a leading '+' to count from the start of the input. */
    private void setCount(ArgEvent event) throws OptionsParsingException {
      String value = event.getValue();
      fromStart = value.startsWith("+");
      number =
          new Converters.NonNegativeLongConverter().convert(fromStart ? value.substring(1) : value);
    }

    private void applyObsolete(String spec) {
      fromStart = spec.charAt(0) == '+';
      int end = 1;
      while (end < spec.length() && Character.isDigit(spec.charAt(end))) {
        end++;
      }
      number = Long.parseLong(spec.substring(1, end));
      mode = Mode.LINES;
      for (char c : spec.substring(end).toCharArray()) {
        switch (c) {
          case 'c':
            mode = Mode.BYTES;
            break;
          case 'b':
            mode = Mode.BLOCKS;
            break;
          case 'f':
            follow = FollowMode.DESCRIPTOR;
            break;
          default:
            break;
        }
      }
    }
  }

  private static Settings parse(String... args) throws OptionsParsingException {
    return PARSER.parse(ImmutableList.copyOf(args), Settings::new, Settings::apply).getSettings();
  }

  private static OptionsParsingException failure(String... args) {
    return assertThrows(OptionsParsingException.class, () -> parse(args));
  }

  @Test
  public void shorthand() throws Exception {
    Settings settings = parse("-20", "somefile");
    assertThat(settings.number).isEqualTo(20L);
    assertThat(settings.fromStart).isFalse();
    assertThat(settings.mode).isEqualTo(Mode.LINES);
    assertThat(settings.follow).isNull();
    assertThat(settings.inputs).containsExactly("somefile");

    settings = parse("+20", "somefile");
    assertThat(settings.number).isEqualTo(20L);
    assertThat(settings.fromStart).isTrue();

    settings = parse("-100cf", "somefile");
    assertThat(settings.number).isEqualTo(100L);
    assertThat(settings.mode).isEqualTo(Mode.BYTES);
    assertThat(settings.follow).isEqualTo(FollowMode.DESCRIPTOR);
  }

  @Test
  public void shorthandOnlyAsFirstArgument() throws Exception {
    Settings settings = parse("somefile", "-20");
    assertThat(settings.number).isEqualTo(10L);
    assertThat(settings.inputs).containsExactly("somefile", "-20").inOrder();
  }

  @Test
  public void unknownSuffixMakesAnOperand() throws Exception {
    // Not an obsolete count, and '5' is no short option, so it reads as a negative number.
    Settings settings = parse("-5x");
    assertThat(settings.number).isEqualTo(10L);
    assertThat(settings.inputs).containsExactly("-5x");
  }

  @Test
  public void shorthandEventKeepsItsForm() throws Exception {
    ArgEvent event = PARSER.parse(ImmutableList.of("-3l")).getEvents().get(0);
    assertThat(event.getId()).isEqualTo(OBSOLETE);
    assertThat(event.getValue()).isEqualTo("-3l");
    assertThat(event.getCommandLineForm()).isEqualTo("-3l");
    assertThat(event.getSpelling()).isNull();
  }

  @Test
  public void linesAndBytes() throws Exception {
    Settings settings = parse("-n", "5");
    assertThat(settings.number).isEqualTo(5L);
    assertThat(settings.mode).isEqualTo(Mode.LINES);

    settings = parse("-c+7");
    assertThat(settings.number).isEqualTo(7L);
    assertThat(settings.fromStart).isTrue();
    assertThat(settings.mode).isEqualTo(Mode.BYTES);

    settings = parse("--bytes=3", "--lines", "4");
    assertThat(settings.mode).isEqualTo(Mode.LINES);
    assertThat(settings.number).isEqualTo(4L);
  }

  @Test
  public void lineCountMustBeNumeric() {
    OptionsParsingException e = failure("-n", "many");
    assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_VALUE);
    assertThat(e.getInvalidArgument()).isEqualTo("many");
  }

  @Test
  public void follow() throws Exception {
    assertThat(parse("-f").follow).isEqualTo(FollowMode.DESCRIPTOR);
    assertThat(parse("--follow").follow).isEqualTo(FollowMode.DESCRIPTOR);
    assertThat(parse("--follow=name").follow).isEqualTo(FollowMode.NAME);
    assertThat(parse("--fo=n").follow).isEqualTo(FollowMode.NAME);
    assertThat(parse("--follow=descriptor", "-F").follow).isEqualTo(FollowMode.NAME);
    assertThat(parse("-F").retry).isTrue();
    assertThat(failure("--follow=inode").getKind()).isEqualTo(ErrorKind.INVALID_VALUE);
  }

  @Test
  public void followNeverTakesTheNextArgument() throws Exception {
    Settings settings = parse("--follow", "name");
    assertThat(settings.follow).isEqualTo(FollowMode.DESCRIPTOR);
    assertThat(settings.inputs).containsExactly("name");
  }

  @Test
  public void quietAndVerbose() throws Exception {
    assertThat(parse("-v").verbose).isTrue();
    assertThat(parse("-v", "--silent").verbose).isFalse();
    assertThat(parse("--q", "--verb").verbose).isTrue();
    OptionsParsingException e = failure("--s");
    assertThat(e.getKind()).isEqualTo(ErrorKind.AMBIGUOUS_OPTION);
    assertThat(e.getCandidates()).containsExactly("silent", "sleep-interval");
  }

  @Test
  public void hiddenOption() throws Exception {
    assertThat(parse("---presume-input-pipe").presumeInputPipe).isTrue();
    assertThat(parse("---pres").presumeInputPipe).isTrue();
    OptionsParsingException e = failure("--presume-input-pipe");
    assertThat(e.getKind()).isEqualTo(ErrorKind.UNKNOWN_OPTION);
    assertThat(e.getInvalidArgument()).isEqualTo("--presume-input-pipe");
    assertThat(TAIL.getOption("presume-input-pipe").getVisibleSpellings()).isEmpty();
    assertThat(TAIL.getVisibleOptions()).doesNotContain(TAIL.getOption("presume-input-pipe"));
  }

  @Test
  public void hiddenNamesDoNotCompeteWithVisibleOnes() throws Exception {
    assertThat(parse("--p", "42").pid).isEqualTo(42L);
    assertThat(failure("--ob=5").getKind()).isEqualTo(ErrorKind.UNKNOWN_OPTION);
    Settings settings = parse("---obsolete-count=+5c");
    assertThat(settings.number).isEqualTo(5L);
    assertThat(settings.fromStart).isTrue();
    assertThat(settings.mode).isEqualTo(Mode.BYTES);
  }

  @Test
  public void numericOptions() throws Exception {
    Settings settings = parse("--pid=42", "-s", "3", "--max-unchanged-stats=9");
    assertThat(settings.pid).isEqualTo(42L);
    assertThat(settings.sleepInterval).isEqualTo(3L);
    assertThat(settings.maxUnchangedStats).isEqualTo(9L);
    assertThat(failure("--pid").getKind()).isEqualTo(ErrorKind.MISSING_REQUIRED_VALUE);
  }

  @Test
  public void zeroTerminated() throws Exception {
    assertThat(parse("-z").zero).isTrue();
    assertThat(parse("--zero").zero).isTrue();
  }
}
