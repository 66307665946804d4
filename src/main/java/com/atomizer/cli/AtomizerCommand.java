/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.cli;

import com.atomizer.cli.commands.CompileCommand;
import com.atomizer.cli.commands.DumpCommand;
import com.atomizer.cli.commands.ValidateCommand;
import com.atomizer.config.AtomizerConfig;
import com.atomizer.utils.LoggerUtil;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.Callable;

@Command(name = "atomizer", mixinStandardHelpOptions = true,
        version = "Atomizer 1.0",
        description = "Compiles FDO atom stream source and validates it against golden fixtures.",
        subcommands = {
                CompileCommand.class,
                ValidateCommand.class,
                DumpCommand.class
        })
public class AtomizerCommand implements Callable<Integer> {

    /** Exit code for compilation errors and fixture mismatches. */
    public static final int EXIT_FAILURE = 1;
    /** Exit code for unreadable inputs or unwritable outputs. */
    public static final int EXIT_IO_ERROR = 2;
    /** Exit code for unknown option values, e.g. a variant or strategy name. */
    public static final int EXIT_INVALID_OPTION = CommandLine.ExitCode.USAGE;

    @Option(names = {"-c", "--config"}, description = "Properties file overriding atomizer.properties.")
    private Path configFile;

    @Option(names = {"-d", "--debug"}, description = "Enable debug logging.")
    private boolean debug;

    @Option(names = {"-q", "--quiet"}, description = "Suppress log output.")
    private boolean quiet;

    private Properties config;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Configuration shared by the subcommands, loaded on first use.
     */
    public Properties getConfig() throws IOException {
        if (config == null) {
            config = configFile != null ? AtomizerConfig.load(configFile) : AtomizerConfig.load();
            if (debug) {
                LoggerUtil.setDebugEnabled(true);
            }
            LoggerUtil.setSilent(quiet);
        }
        return config;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AtomizerCommand()).execute(args);
        System.exit(exitCode);
    }
}
