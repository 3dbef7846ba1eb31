package org.rulebridge.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.rulebridge.cli.commands.CompareCommand;
import org.rulebridge.cli.commands.TranslateCommand;
import org.rulebridge.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "rulebridge",
    mixinStandardHelpOptions = true,
    version = "RuleBridge 1.0",
    description = "RuleBridge - SVRF to PXL rule deck translator",
    subcommands = {
        TranslateCommand.class,
        CompareCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "rulebridge.conf";

    @Option(
        names = {"--config"},
        description = "Path to custom configuration file (default: rulebridge.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("rulebridge");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            // 1) Highest precedence: explicit CLI option --config
            if (this.configFile != null) {
                if (!this.configFile.exists()) {
                    throw new IllegalStateException("Configuration file specified via --config was not found: "
                            + this.configFile.getAbsolutePath());
                }
                logger.debug("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                this.config = layered(ConfigFactory.parseFile(this.configFile));
            } else {
                // 2) Next: standard Typesafe Config system property -Dconfig.file
                final String systemConfigPath = System.getProperty("config.file");
                if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                    final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                    if (!systemConfigFile.exists()) {
                        throw new IllegalStateException("Configuration file specified via -Dconfig.file was not found: "
                                + systemConfigFile.getAbsolutePath());
                    }
                    logger.debug("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
                    this.config = layered(ConfigFactory.parseFile(systemConfigFile));
                } else {
                    // 3) Then: rulebridge.conf in the current working directory
                    final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                    if (cwdConfigFile.exists()) {
                        logger.debug("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                        this.config = layered(ConfigFactory.parseFile(cwdConfigFile));
                    } else {
                        // 4) Finally: classpath defaults only
                        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                        this.config = layered(ConfigFactory.empty());
                    }
                }
            }
        } catch (ConfigException e) {
            throw new IllegalStateException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    // Config load order: System Props > Env Vars > File > Classpath defaults
    private static Config layered(Config file) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(file)
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
