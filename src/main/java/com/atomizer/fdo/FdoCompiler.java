/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo;

import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationService;
import com.atomizer.fdo.spi.FdoServiceFactory;
import com.atomizer.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * High-level FDO compiler facade.
 *
 * <p>Loads source text from the classpath or the file system, compiles it through the
 * configured {@link FdoCompilationService} and logs each compilation.</p>
 */
public class FdoCompiler {

    private final FdoCompilationService compilationService;

    public FdoCompiler(Properties properties) {
        this(FdoServiceFactory.createCompilationService(properties));
    }

    public FdoCompiler(FdoCompilationService compilationService) {
        this.compilationService = compilationService;
        LoggerUtil.debug(() -> String.format("[FdoCompiler] Initialized with %s production strategy",
                compilationService.getStrategyName()));
    }

    /**
     * Compile FDO source in the service's default variant.
     *
     * @param fdoSource FDO source text
     * @return compiled binary data, header included
     * @throws FdoCompilationException if compilation fails
     */
    public byte[] compileFdoScript(String fdoSource) throws FdoCompilationException {
        return compile(fdoSource, compilationService.getDefaultVariant()).toByteArray();
    }

    /**
     * Compile FDO source in the given variant, logging duration and size.
     */
    public EncodedStream compile(String fdoSource, Variant variant) throws FdoCompilationException {
        String displayName = extractDisplayName(fdoSource);
        long startTime = System.currentTimeMillis();
        try {
            EncodedStream stream = compilationService.compile(fdoSource, variant);
            long duration = System.currentTimeMillis() - startTime;
            LoggerUtil.debug(() -> String.format("[FdoCompiler] compile complete | source:%s | variant:%s | duration:%dms | bytes:%d",
                    displayName, variant.label(), duration, stream.length()));
            return stream;
        } catch (FdoCompilationException e) {
            long duration = System.currentTimeMillis() - startTime;
            LoggerUtil.error(String.format("[FdoCompiler] compile error | source:%s | variant:%s | duration:%dms | error:%s",
                    displayName, variant.label(), duration, e.getMessage()));
            throw e;
        }
    }

    /**
     * Compile an FDO resource from the classpath.
     *
     * @param resourcePath path to FDO file in resources
     * @throws FdoCompilationException if compilation fails
     * @throws IOException if file cannot be read
     */
    public byte[] compileFdoFile(String resourcePath) throws FdoCompilationException, IOException {
        return compileFdoScript(loadFdoFromResource(resourcePath));
    }

    /**
     * Compile a source file and write the binary to {@code output}. Nothing is written
     * when compilation fails.
     */
    public EncodedStream compileFile(Path input, Path output, Variant variant)
            throws FdoCompilationException, IOException {
        String source = Files.readString(input, StandardCharsets.UTF_8);
        EncodedStream stream = compile(source, variant);
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(output, stream.toByteArray());
        LoggerUtil.info(String.format("[FdoCompiler] Wrote %d bytes (%s) to %s",
                stream.length(), variant.label(), output));
        return stream;
    }

    /**
     * Load FDO source from a resource file.
     *
     * @param resourcePath path to FDO file in resources
     * @return FDO source text
     * @throws IOException if file cannot be read
     */
    public String loadFdoFromResource(String resourcePath) throws IOException {
        if (resourcePath == null) {
            throw new IOException("FDO resource path cannot be null");
        }
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("FDO resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Readable name for logs: the first 40 characters of the source, newlines flattened.
     */
    private static String extractDisplayName(String fdoSource) {
        if (fdoSource == null) return "null";
        String flat = fdoSource.strip().replace("\r", "").replace("\n", " ");
        return flat.length() <= 40 ? flat : flat.substring(0, 40) + "...";
    }
}
