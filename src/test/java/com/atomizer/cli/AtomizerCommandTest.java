/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.cli;

import com.atomizer.test.TestConfig;
import com.atomizer.utils.LoggerUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Atomizer Command Line")
class AtomizerCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new AtomizerCommand());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path copyGolden(String fileName) throws IOException {
        Path target = tempDir.resolve(fileName);
        Files.write(target, TestConfig.goldenBytes(fileName));
        return target;
    }

    @AfterEach
    void restoreLogging() {
        LoggerUtil.setSilent(false);
        LoggerUtil.setDebugEnabled(false);
    }

    @Test
    @DisplayName("should be named atomizer and print usage without a subcommand")
    void shouldPrintUsage() {
        assertEquals("atomizer", new CommandLine(new AtomizerCommand()).getCommandName());
        assertEquals(0, run());
        assertTrue(out.toString().contains("compile"));
        assertTrue(out.toString().contains("validate"));
        assertTrue(out.toString().contains("dump"));
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("should write the requested variant")
        void shouldCompileDebug() throws IOException {
            Path input = copyGolden("minimal-object.txt");
            Path output = tempDir.resolve("minimal.bin");

            assertEquals(0, run("-q", "compile", input.toString(), output.toString(), "--variant", "debug"));
            assertArrayEquals(TestConfig.goldenBytes("minimal-object.debug.bin"), Files.readAllBytes(output));
            assertTrue(out.toString().contains("debug, 33 bytes"));
        }

        @Test
        @DisplayName("should default to the configured production strategy")
        void shouldCompileProduction() throws IOException {
            Path input = copyGolden("minimal-object.txt");
            Path output = tempDir.resolve("minimal.bin");

            assertEquals(0, run("-q", "compile", input.toString(), output.toString()));
            assertArrayEquals(TestConfig.goldenBytes("minimal-object.production.bin"), Files.readAllBytes(output));
        }

        @Test
        @DisplayName("should take the strategy from a config file or an option")
        void shouldSelectStrategy() throws IOException {
            Path input = copyGolden("minimal-object.txt");
            Path config = tempDir.resolve("override.properties");
            Files.writeString(config, "fdo.production.strategy=full\n");

            Path viaConfig = tempDir.resolve("via-config.bin");
            assertEquals(0, run("-q", "--config", config.toString(), "compile", input.toString(), viaConfig.toString()));
            Path viaOption = tempDir.resolve("via-option.bin");
            assertEquals(0, run("-q", "compile", input.toString(), viaOption.toString(), "-s", "full"));

            byte[] expectedStart = {0x40, 0x01, 0x00, 0x01, 0x01, 0x00};
            for (Path output : new Path[]{viaConfig, viaOption}) {
                byte[] bytes = Files.readAllBytes(output);
                for (int i = 0; i < expectedStart.length; i++) {
                    assertEquals(expectedStart[i], bytes[i], output + " byte " + i);
                }
            }
        }

        @Test
        @DisplayName("should exit 1 on a compilation error without writing output")
        void shouldReportCompilationError() throws IOException {
            Path input = tempDir.resolve("broken.txt");
            Files.writeString(input, "uni_start_stream\nfoo_bar\nuni_end_stream\n");
            Path output = tempDir.resolve("broken.bin");

            assertEquals(AtomizerCommand.EXIT_FAILURE, run("-q", "compile", input.toString(), output.toString()));
            assertTrue(err.toString().contains("[line 2] Unknown atom mnemonic: 'foo_bar'"), err.toString());
            assertFalse(Files.exists(output));
        }

        @Test
        @DisplayName("should print a one-line diagnostic for an unknown variant or strategy")
        void shouldRejectUnknownOptionValues() throws IOException {
            Path input = copyGolden("minimal-object.txt");
            Path output = tempDir.resolve("minimal.bin");

            assertEquals(AtomizerCommand.EXIT_INVALID_OPTION,
                    run("-q", "compile", input.toString(), output.toString(), "--variant", "compressed"));
            assertTrue(err.toString().contains("Unknown variant: 'compressed'"), err.toString());
            assertFalse(err.toString().contains("at com.atomizer"), err.toString());

            assertEquals(AtomizerCommand.EXIT_INVALID_OPTION,
                    run("-q", "compile", input.toString(), output.toString(), "-s", "zip"));
            assertTrue(err.toString().contains("Unknown production strategy: 'zip'"), err.toString());
            assertFalse(Files.exists(output));
        }

        @Test
        @DisplayName("should exit 2 when an explicit configuration file is missing")
        void shouldReportMissingConfigFile() throws IOException {
            Path input = copyGolden("minimal-object.txt");
            Path config = tempDir.resolve("absent.properties");

            assertEquals(AtomizerCommand.EXIT_IO_ERROR, run("-q", "--config", config.toString(),
                    "compile", input.toString(), tempDir.resolve("minimal.bin").toString()));
            assertTrue(err.toString().contains("Failed to load configuration"), err.toString());
            assertTrue(err.toString().contains("absent.properties"), err.toString());
        }

        @Test
        @DisplayName("should exit 2 when the input cannot be read")
        void shouldReportMissingInput() {
            assertEquals(AtomizerCommand.EXIT_IO_ERROR, run("-q", "compile",
                    tempDir.resolve("absent.txt").toString(), tempDir.resolve("absent.bin").toString()));
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("should exit 0 and write a report when every fixture matches")
        void shouldPassMatchingCorpus() throws IOException {
            copyGolden("minimal-object.txt");
            copyGolden("minimal-object.debug.bin");
            copyGolden("minimal-object.production.bin");
            Path report = tempDir.resolve("report.json");

            assertEquals(0, run("-q", "validate", tempDir.toString(), "--report", report.toString(), "-t", "2"));
            assertTrue(out.toString().contains("1/1 fixtures match exactly"), out.toString());
            assertTrue(Files.readString(report).contains("\"exactMatches\" : 1"));
        }

        @Test
        @DisplayName("should exit 1 when a fixture diverges")
        void shouldFailOnMismatch() {
            assertEquals(AtomizerCommand.EXIT_FAILURE, run("-q", "validate", TestConfig.goldenDirectory().toString()));
            assertTrue(out.toString().contains("FAIL  32-105"), out.toString());
            assertTrue(out.toString().contains("First difference at byte 47"), out.toString());
        }

        @Test
        @DisplayName("should print a one-line diagnostic for an unknown strategy")
        void shouldRejectUnknownStrategy() {
            assertEquals(AtomizerCommand.EXIT_INVALID_OPTION,
                    run("-q", "validate", TestConfig.goldenDirectory().toString(), "--strategy", "zip"));
            assertTrue(err.toString().contains("Unknown production strategy: 'zip'"), err.toString());
            assertFalse(err.toString().contains("at com.atomizer"), err.toString());
        }

        @Test
        @DisplayName("should exit 2 for a missing corpus directory")
        void shouldReportMissingCorpus() {
            assertEquals(AtomizerCommand.EXIT_IO_ERROR, run("-q", "validate", tempDir.resolve("absent").toString()));
        }
    }

    @Nested
    @DisplayName("dump")
    class Dump {

        @Test
        @DisplayName("should print one decoded atom per line")
        void shouldDumpAtoms() throws IOException {
            Path binary = copyGolden("minimal-object.production.bin");

            assertEquals(0, run("-q", "dump", binary.toString()));
            String text = out.toString();
            assertTrue(text.contains("production, 16 bytes"), text);
            assertTrue(text.contains("  man_start_object [01 54 65 73 74]"), text);
            assertTrue(text.contains("    mat_object_id [20 00 01]"), text);
        }

        @Test
        @DisplayName("should exit 1 when the stream cannot be decoded")
        void shouldReportUndecodableStream() throws IOException {
            Path binary = copyGolden("32-105.bin");

            assertEquals(AtomizerCommand.EXIT_FAILURE, run("-q", "dump", binary.toString()));
            assertTrue(err.toString().contains("offset 47"), err.toString());
        }
    }
}
