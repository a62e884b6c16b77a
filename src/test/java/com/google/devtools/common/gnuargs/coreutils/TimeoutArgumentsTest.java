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
import com.google.common.collect.ImmutableMap;
import com.google.devtools.common.gnuargs.ArgEvent;
import com.google.devtools.common.gnuargs.ArgumentParser;
import com.google.devtools.common.gnuargs.ArgumentSpec;
import com.google.devtools.common.gnuargs.Converters;
import com.google.devtools.common.gnuargs.OptionSpec;
import com.google.devtools.common.gnuargs.OptionsParsingException;
import com.google.devtools.common.gnuargs.OptionsParsingException.ErrorKind;
import com.google.devtools.common.gnuargs.ParseResult;
import com.google.devtools.common.gnuargs.ParsedArguments;
import com.google.devtools.common.gnuargs.PositionalArity;
import com.google.devtools.common.gnuargs.PositionalSlot;
import java.time.Duration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * End-to-end tests with the option table of {@code timeout}, whose COMMAND slot captures the rest
 * of the command line untouched.
 */
@RunWith(JUnit4.class)
public class TimeoutArgumentsTest {

  static final ArgumentSpec TIMEOUT =
      ArgumentSpec.builder()
          .addOption(
              OptionSpec.builder("foreground").spelling("-f").spelling("--foreground").build())
          .addOption(
              OptionSpec.builder("kill-after")
                  .spelling("-k DURATION")
                  .spelling("--kill-after=DURATION")
                  .build())
          .addOption(
              OptionSpec.builder("preserve-status")
                  .spelling("-p")
                  .spelling("--preserve-status")
                  .build())
          .addOption(
              OptionSpec.builder("signal")
                  .spelling("-s SIGNAL")
                  .spelling("--signal=SIGNAL")
                  .build())
          .addOption(OptionSpec.builder("verbose").spelling("-v").spelling("--verbose").build())
          .addPositional(PositionalSlot.of("DURATION", PositionalArity.exactly(1)))
          .addPositional(PositionalSlot.greedy("COMMAND", PositionalArity.atLeast(1)))
          .build();

  private static final ArgumentParser PARSER = ArgumentParser.builder().spec(TIMEOUT).build();

  /** What {@code timeout} decides from its arguments. */
  static final class Settings {
    boolean foreground;
    Duration killAfter;
    boolean preserveStatus;
    String signal = "TERM";
    boolean verbose;
    Duration duration;
    int commandWords;

    Settings apply(ArgEvent event) throws OptionsParsingException {
      switch (event.getId()) {
        case "foreground":
          foreground = true;
          break;
        case "kill-after":
          killAfter = event.getConvertedValue(new Converters.DurationConverter());
          break;
        case "preserve-status":
          preserveStatus = true;
          break;
        case "signal":
          signal = event.getValue();
          break;
        case "verbose":
          verbose = true;
          break;
        case "DURATION":
          duration = event.getConvertedValue(new Converters.DurationConverter());
          break;
        case "COMMAND":
          commandWords++;
          break;
        default:
          throw new IllegalStateException("Unhandled argument " + event.getId());
      }
      return this;
    }
  }

  private static ParseResult<Settings> parse(String... args) throws OptionsParsingException {
    return PARSER.parse(ImmutableList.copyOf(args), Settings::new, Settings::apply);
  }

  private static OptionsParsingException failure(String... args) {
    return assertThrows(OptionsParsingException.class, () -> parse(args));
  }

  @Test
  public void commandIsCapturedVerbatim() throws Exception {
    ParseResult<Settings> result = parse("5", "-v", "sleep", "--flag", "arg");
    assertThat(result.getSettings().verbose).isTrue();
    assertThat(result.getSettings().duration).isEqualTo(Duration.ofSeconds(5));
    assertThat(result.getTrailingArguments())
        .containsExactly("sleep", "--flag", "arg")
        .inOrder();
    assertThat(result.getSettings().commandWords).isEqualTo(3);
  }

  @Test
  public void optionsAfterCommandBelongToCommand() throws Exception {
    ParseResult<Settings> result = parse("1m", "cmd", "-v", "-k", "nonsense", "--", "x");
    assertThat(result.getSettings().verbose).isFalse();
    assertThat(result.getSettings().killAfter).isNull();
    assertThat(result.getTrailingArguments())
        .containsExactly("cmd", "-v", "-k", "nonsense", "--", "x")
        .inOrder();
  }

  @Test
  public void undeclaredOptionsInCommandAreNotErrors() throws Exception {
    assertThat(parse("3", "ls", "--colour", "-j").getTrailingArguments()).hasSize(3);
  }

  @Test
  public void optionsBeforeCommand() throws Exception {
    Settings settings = parse("-k", "1.5", "-s", "KILL", "--preserve", "10", "cmd").getSettings();
    assertThat(settings.killAfter).isEqualTo(Duration.ofMillis(1500));
    assertThat(settings.signal).isEqualTo("KILL");
    assertThat(settings.preserveStatus).isTrue();
    assertThat(settings.duration).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  public void eventsKeepInputOrder() throws Exception {
    ParsedArguments parsed = PARSER.parse(ImmutableList.of("-f", "2", "-v", "cmd", "-f"));
    assertThat(parsed.getEvents().stream().map(ArgEvent::getCommandLineForm).toArray())
        .asList()
        .containsExactly("-f", "2", "-v", "cmd", "-f")
        .inOrder();
    assertThat(parsed.getOperands("COMMAND")).containsExactly("cmd", "-f").inOrder();
  }

  @Test
  public void terminatorBeforeDuration() throws Exception {
    ParseResult<Settings> result = parse("--", "5", "-v");
    assertThat(result.getSettings().verbose).isFalse();
    assertThat(result.getTrailingArguments()).containsExactly("-v");
  }

  @Test
  public void missingCommand() {
    OptionsParsingException e = failure("5");
    assertThat(e.getKind()).isEqualTo(ErrorKind.MISSING_OPERAND);
    assertThat(e).hasMessageThat().isEqualTo("missing operand after '5'");
    // The single operand is reserved for COMMAND, which leaves DURATION short.
    assertThat(e.getInvalidArgument()).isEqualTo("DURATION");
    assertThat(failure().getInvalidArgument()).isEqualTo("DURATION");
  }

  @Test
  public void invalidDuration() {
    OptionsParsingException e = failure("soon", "cmd");
    assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_VALUE);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("While parsing DURATION operand: invalid time interval 'soon'");
    assertThat(failure("-k", "1x", "5", "cmd").getInvalidArgument()).isEqualTo("1x");
  }

  @Test
  public void posixModeStillCapturesCommand() throws Exception {
    ArgumentParser posix =
        ArgumentParser.builder()
            .spec(TIMEOUT)
            .environment(ImmutableMap.of(ArgumentParser.POSIXLY_CORRECT, "1"))
            .build();
    ParsedArguments parsed = posix.parse(ImmutableList.of("5", "-v", "cmd"));
    assertThat(parsed.getOperands("DURATION")).containsExactly("5");
    assertThat(parsed.getTrailingArguments()).containsExactly("-v", "cmd").inOrder();
  }
}
