// Copyright 2025 The Zonerelay Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package zonerelay.tools;

import static com.google.common.collect.Iterables.getOnlyElement;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import zonerelay.dns.DnsProviderException;

/** Parses the command line and runs the selected command against the configured provider. */
@Parameters(separators = " =", commandDescription = "Command-line interface to zonerelay")
final class ZoneRelayCli {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static final String HELP_COMMAND = "help";

  @Parameter(
      names = {"-c", "--commands"},
      description = "Returns all command names.")
  private boolean showAllCommands;

  private final String programName;
  private final ImmutableMap<String, ? extends Class<? extends Command>> commands;
  private final ZoneRelayToolComponent component;

  ZoneRelayCli(
      String programName, ImmutableMap<String, ? extends Class<? extends Command>> commands) {
    this(programName, commands, DaggerZoneRelayToolComponent.create());
  }

  @VisibleForTesting
  ZoneRelayCli(
      String programName,
      ImmutableMap<String, ? extends Class<? extends Command>> commands,
      ZoneRelayToolComponent component) {
    this.programName = programName;
    this.commands = commands;
    this.component = component;
  }

  /** Flags of the {@code help} command, which prints usage instead of talking to the provider. */
  @Parameters(commandDescription = "Show the usage of a command")
  private static final class HelpFlags {
    @Parameter(description = "<command>")
    private List<String> commandNames = new ArrayList<>();
  }

  /**
   * Runs the command named in {@code args}.
   *
   * @return the process exit code
   */
  int run(String[] args) throws Exception {
    JCommander jcommander = new JCommander(this);
    jcommander.setProgramName(programName);
    // "@" names the zone apex, so arguments are never read from files.
    jcommander.setExpandAtSign(false);

    // JCommander mutates the command instances, so they are created anew for every run.
    try {
      for (Map.Entry<String, ? extends Class<? extends Command>> entry : commands.entrySet()) {
        Command command = entry.getValue().getDeclaredConstructor().newInstance();
        jcommander.addCommand(entry.getKey(), command);
      }
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException(e);
    }
    HelpFlags helpFlags = new HelpFlags();
    jcommander.addCommand(HELP_COMMAND, helpFlags);

    try {
      jcommander.parse(args);
    } catch (ParameterException e) {
      // Show the usage of the command if one was recognized, and the full usage otherwise.
      printUsage(jcommander, jcommander.getParsedCommand());
      System.err.println(e.getMessage());
      return EXIT_USAGE;
    }

    if (showAllCommands) {
      commands.keySet().forEach(System.out::println);
      return EXIT_SUCCESS;
    }
    String commandName = jcommander.getParsedCommand();
    if (commandName == null) {
      jcommander.usage();
      return EXIT_USAGE;
    }
    if (commandName.equals(HELP_COMMAND)) {
      return showHelp(jcommander, helpFlags.commandNames);
    }

    // Sub-commands are stored as nested JCommander objects, each holding only its command.
    Command command =
        (Command) getOnlyElement(jcommander.getCommands().get(commandName).getObjects());
    command.injectFrom(component);
    try {
      command.run();
    } catch (DnsProviderException e) {
      logger.atFine().withCause(e).log("Command %s failed", commandName);
      System.err.println(e.getMessage());
      return EXIT_FAILURE;
    }
    return EXIT_SUCCESS;
  }

  private int showHelp(JCommander jcommander, List<String> commandNames) {
    if (commandNames.isEmpty()) {
      jcommander.usage();
      return EXIT_SUCCESS;
    }
    if (commandNames.size() > 1 || !commands.containsKey(commandNames.get(0))) {
      System.err.printf(
          "Usage: %s help [command], with one of %s%n", programName, commands.keySet());
      return EXIT_USAGE;
    }
    printUsage(jcommander, commandNames.get(0));
    return EXIT_SUCCESS;
  }

  private static void printUsage(JCommander jcommander, @Nullable String commandName) {
    if (commandName == null) {
      jcommander.usage();
    } else {
      jcommander.getUsageFormatter().usage(commandName);
    }
  }
}
