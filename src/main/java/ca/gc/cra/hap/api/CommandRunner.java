package ca.gc.cra.hap.api;

import ca.gc.cra.hap.config.CompositionRoot;
import ca.gc.cra.hap.config.ConfigMerger;
import ca.gc.cra.hap.config.HapConfig;
import ca.gc.cra.hap.config.YamlConfigLoader;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import ca.gc.cra.hap.domain.error.ValidationException;
import ca.gc.cra.hap.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared command flow: parse arguments, load {@code hap.yaml}, merge settings, wire services, run
 * the command body, and map failures to exit codes.
 *
 * <p>Protocol rejections print {@code error=<code>} and {@code reason=<message>} to stdout and exit
 * with {@link ExitCode#REJECTED}.</p>
 */
final class CommandRunner {
  private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

  /** Command body run against wired services. */
  @FunctionalInterface
  interface Command {
    ExitCode run(CommandOptions options, CompositionRoot root) throws IOException;
  }

  private final String name;
  private final String usage;
  private final String help;
  private final Function<HapConfig, CompositionRoot> rootFactory;

  CommandRunner(String name, String usage, String help) {
    this(name, usage, help, CompositionRoot::new);
  }

  CommandRunner(String name, String usage, String help, Function<HapConfig, CompositionRoot> rootFactory) {
    this.name = name;
    this.usage = usage;
    this.help = help;
    this.rootFactory = rootFactory;
  }

  ExitCode execute(String[] args, Command command) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(help.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", name);
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    String explicitConfig = ConfigCliUtils.extractConfigPath(cliKv);
    Path configPath = Path.of(explicitConfig == null ? ConfigCliUtils.DEFAULT_CONFIG : explicitConfig);
    if (explicitConfig != null && !Files.exists(configPath)) {
      log.error("Configuration file does not exist: {}", configPath);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    HapConfig config;
    try {
      Optional<Map<String, String>> yaml = YamlConfigLoader.load(configPath, name);
      effective = ConfigMerger.buildEffectiveConfig(name, yaml, cliKv, HapConfig.defaultsMap(), log::warn);
      config = HapConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    log.debug("Effective configuration for {}: {}", name, config);

    try (CompositionRoot root = rootFactory.apply(config)) {
      return command.run(new CommandOptions(effective, input.flags()), root);
    } catch (ProtocolException ex) {
      CliPrinter.field("error", ex.code().wireName());
      CliPrinter.field("reason", ex.getMessage());
      if (ex instanceof ValidationException validation) {
        validation.violations().forEach(violation -> CliPrinter.field("violation", violation));
      }
      log.info("{} rejected: {}", name, ex.code());
      return ExitCode.REJECTED;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", name, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    } catch (IllegalStateException ex) {
      log.error("{} configuration error: {}", name, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("{} I/O failure", name, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      ErrorCode wrapped = ProtocolException.codeOf(ex);
      if (wrapped != null) {
        CliPrinter.field("error", wrapped.wireName());
        CliPrinter.field("reason", ex.getMessage());
        log.info("{} rejected: {} (wrapped in {})", name, wrapped, ex.getClass().getSimpleName());
        return ExitCode.REJECTED;
      }
      log.error("Unexpected failure in {}", name, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
