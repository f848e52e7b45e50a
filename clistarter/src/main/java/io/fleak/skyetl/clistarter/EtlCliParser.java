/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.skyetl.clistarter;

import io.fleak.skyetl.lib.utils.YamlUtils;
import io.fleak.skyetl.runner.config.PipelineConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.*;
import org.apache.commons.lang3.StringUtils;

/** Reads the pipeline YAML named by {@code -c} and applies command-line overrides to it. */
@Slf4j
public class EtlCliParser {
  private static final Options CLI_OPTIONS;

  private static final Option CONFIG_OPT =
      Option.builder("c")
          .longOpt("config")
          .desc("path to the pipeline yaml file")
          .hasArg()
          .required()
          .build();

  private static final Option ID_OPT =
      Option.builder("id").longOpt("runId").desc("run id, generated when absent").hasArg().build();

  private static final Option SOURCE_OPT =
      Option.builder("s").longOpt("source").desc("source file or directory").hasArg().build();

  private static final Option WORKERS_OPT =
      Option.builder("w").longOpt("workers").desc("number of worker lanes").hasArg().build();

  private static final Option DRY_RUN_OPT =
      Option.builder()
          .longOpt("dry-run")
          .desc("load into an in-memory table instead of cassandra")
          .build();

  private static final Option REPORT_OPT =
      Option.builder("r")
          .longOpt("report")
          .desc("write the run report to this file")
          .hasArg()
          .build();

  private static final Option LOG_LEVEL_OPT =
      Option.builder("l").longOpt("log-level").desc("log level of the pipeline").hasArg().build();

  static {
    CLI_OPTIONS = new Options();
    CLI_OPTIONS
        .addOption(CONFIG_OPT)
        .addOption(ID_OPT)
        .addOption(SOURCE_OPT)
        .addOption(WORKERS_OPT)
        .addOption(DRY_RUN_OPT)
        .addOption(REPORT_OPT)
        .addOption(LOG_LEVEL_OPT);
  }

  public static PipelineConfig parseArgs(String[] args) throws ParseException {
    CommandLineParser commandLineParser = new DefaultParser();
    CommandLine commandLine = commandLineParser.parse(CLI_OPTIONS, args);

    String configFile = commandLine.getOptionValue(CONFIG_OPT);
    PipelineConfig config;
    try {
      config = YamlUtils.fromYamlFile(Path.of(configFile), PipelineConfig.class);
    } catch (IOException e) {
      throw new UncheckedIOException("failed to load pipeline config from " + configFile, e);
    }
    log.info("loaded pipeline config from {}", configFile);

    String runId = getOptionalArgValue(commandLine, ID_OPT, s -> s, null);
    if (runId != null) {
      config.setRunId(runId);
    }
    String source = getOptionalArgValue(commandLine, SOURCE_OPT, s -> s, null);
    if (source != null) {
      config.getSource().setLocator(source);
    }
    Integer workers =
        getOptionalArgValue(commandLine, WORKERS_OPT, EtlCliParser::parseWorkers, null);
    if (workers != null) {
      config.setWorkerCount(workers);
    }
    if (commandLine.hasOption(DRY_RUN_OPT)) {
      config.getSink().setType(PipelineConfig.SinkType.MEMORY);
    }
    String report = getOptionalArgValue(commandLine, REPORT_OPT, s -> s, null);
    if (report != null) {
      config.setReportFile(report);
    }
    String logLevel = getOptionalArgValue(commandLine, LOG_LEVEL_OPT, s -> s, null);
    if (logLevel != null) {
      config.setLogLevel(logLevel);
    }
    return config;
  }

  private static Integer parseWorkers(String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("workers must be an integer: " + value, e);
    }
  }

  private static <T> T getOptionalArgValue(
      CommandLine commandLine, Option option, Function<String, T> converter, T defaultValue) {
    String value = commandLine.getOptionValue(option);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    return converter.apply(value);
  }

  public static void printUsage(String prog) {
    HelpFormatter formatter = new HelpFormatter();
    String header = "Options:";
    String footer = "\n";
    formatter.printHelp(prog, header, CLI_OPTIONS, footer, true);
  }
}
