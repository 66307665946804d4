/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.cli.commands;

import com.atomizer.cli.AtomizerCommand;
import com.atomizer.fdo.FdoCompiler;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles an atom stream source file to a binary stream.")
public class CompileCommand implements Callable<Integer> {

    @ParentCommand
    private AtomizerCommand parent;

    @Parameters(index = "0", description = "The atom stream source file.")
    private Path input;

    @Parameters(index = "1", description = "The binary output file.")
    private Path output;

    @Option(names = {"-v", "--variant"}, description = "debug or production (default: fdo.compiler.variant).")
    private String variant;

    @Option(names = {"-s", "--strategy"}, description = "Production strategy: styled or full.")
    private String strategy;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Properties config;
        try {
            config = parent.getConfig();
        } catch (IOException e) {
            spec.commandLine().getErr().println("Failed to load configuration: " + e.getMessage());
            return AtomizerCommand.EXIT_IO_ERROR;
        }
        if (strategy != null) {
            config.setProperty("fdo.production.strategy", strategy);
        }
        Variant selected;
        FdoCompiler compiler;
        try {
            selected = Variant.parse(variant != null ? variant : config.getProperty("fdo.compiler.variant", "production"));
            compiler = new FdoCompiler(config);
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return AtomizerCommand.EXIT_INVALID_OPTION;
        } catch (UncheckedIOException e) {
            spec.commandLine().getErr().printf("I/O error: %s%n", e.getMessage());
            return AtomizerCommand.EXIT_IO_ERROR;
        }
        try {
            EncodedStream stream = compiler.compileFile(input, output, selected);
            spec.commandLine().getOut().printf("%s -> %s (%s, %d bytes)%n",
                    input, output, selected.label(), stream.length());
            return 0;
        } catch (FdoCompilationException e) {
            spec.commandLine().getErr().printf("%s: %s%n", input, e.getMessage());
            return AtomizerCommand.EXIT_FAILURE;
        } catch (IOException e) {
            spec.commandLine().getErr().printf("I/O error: %s%n", e.getMessage());
            return AtomizerCommand.EXIT_IO_ERROR;
        }
    }
}
