/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.cli.commands;

import com.atomizer.cli.AtomizerCommand;
import com.atomizer.fdo.encode.DecodedAtom;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationService;
import com.atomizer.fdo.spi.FdoServiceFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "dump", description = "Decodes a binary stream and prints one atom per line.")
public class DumpCommand implements Callable<Integer> {

    @ParentCommand
    private AtomizerCommand parent;

    @Parameters(index = "0", description = "The binary stream file.")
    private Path binary;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        byte[] data;
        FdoCompilationService service;
        try {
            data = Files.readAllBytes(binary);
            service = FdoServiceFactory.createCompilationService(parent.getConfig());
        } catch (IOException e) {
            spec.commandLine().getErr().printf("I/O error: %s%n", e.getMessage());
            return AtomizerCommand.EXIT_IO_ERROR;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return AtomizerCommand.EXIT_INVALID_OPTION;
        } catch (UncheckedIOException e) {
            spec.commandLine().getErr().printf("I/O error: %s%n", e.getMessage());
            return AtomizerCommand.EXIT_IO_ERROR;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.printf("%s: %s, %d bytes%n", binary,
                Variant.detect(data).map(Variant::label).orElse("unknown header"), data.length);
        try {
            List<DecodedAtom> atoms = service.decompile(data);
            atoms.forEach(out::println);
            return 0;
        } catch (FdoCompilationException e) {
            spec.commandLine().getErr().printf("%s: %s%n", binary, e.getMessage());
            return AtomizerCommand.EXIT_FAILURE;
        }
    }
}
