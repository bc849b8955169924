package com.jasmin.webloghunter.reporters;

import com.jasmin.webloghunter.models.AnalysisResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public interface ReportWriter {

    /** Format key used on the command line, e.g. {@code md}. */
    String format();

    String extension();

    String render(AnalysisResult result);

    default void write(AnalysisResult result, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, render(result), StandardCharsets.UTF_8);
    }
}
