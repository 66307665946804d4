/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.cli.commands;

import com.atomizer.cli.AtomizerCommand;
import com.atomizer.fdo.spi.FdoCompilationService;
import com.atomizer.fdo.spi.FdoServiceFactory;
import com.atomizer.validate.DifferentialValidator;
import com.atomizer.validate.FixtureCorpus;
import com.atomizer.validate.ValidationReport;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Compiles a golden fixture corpus and compares it byte for byte.")
public class ValidateCommand implements Callable<Integer> {

    @ParentCommand
    private AtomizerCommand parent;

    @Parameters(index = "0", description = "Directory of <name>.txt sources and reference binaries.")
    private Path corpusDirectory;

    @Option(names = {"-r", "--report"}, description = "Write the JSON report to this file.")
    private Path reportFile;

    @Option(names = {"-t", "--threads"}, description = "Worker threads (default: validator.threads).")
    private Integer threads;

    @Option(names = {"-s", "--strategy"}, description = "Production strategy: styled or full.")
    private String strategy;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            Properties config = parent.getConfig();
            if (strategy != null) {
                config.setProperty("fdo.production.strategy", strategy);
            }
            if (threads != null) {
                config.setProperty("validator.threads", threads.toString());
            }

            DifferentialValidator validator;
            try {
                FdoCompilationService service = FdoServiceFactory.createCompilationService(config);
                validator = DifferentialValidator.fromProperties(service, config);
            } catch (IllegalArgumentException e) {
                spec.commandLine().getErr().println(e.getMessage());
                return AtomizerCommand.EXIT_INVALID_OPTION;
            } catch (UncheckedIOException e) {
                spec.commandLine().getErr().printf("I/O error: %s%n", e.getMessage());
                return AtomizerCommand.EXIT_IO_ERROR;
            }
            FixtureCorpus corpus = FixtureCorpus.load(corpusDirectory);

            ValidationReport report = validator.validate(corpus);
            PrintWriter out = spec.commandLine().getOut();
            out.print(report.render());
            out.flush();
            if (reportFile != null) {
                report.writeJson(reportFile);
                out.println("Report written to " + reportFile);
            }
            return report.allMatched() ? 0 : AtomizerCommand.EXIT_FAILURE;
        } catch (IOException e) {
            spec.commandLine().getErr().printf("I/O error: %s%n", e.getMessage());
            return AtomizerCommand.EXIT_IO_ERROR;
        }
    }
}
