package io.evefile.command.common;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import picocli.CommandLine;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/// The eveH5 file a command reads.
public class InputFileOption {

    /// Picocli type converter for input paths, refusing blank values.
    public static class InputFileConverter implements CommandLine.ITypeConverter<Path> {

        @Override
        public Path convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new CommandLine.TypeConversionException("Input file path cannot be empty");
            }
            return Paths.get(value.trim());
        }
    }

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "The eveH5 file to read",
        required = true,
        converter = InputFileConverter.class
    )
    private Path inputPath;

    /// Gets the input file path.
    public Path getInputPath() {
        return inputPath;
    }

    /// Validates the input file exists.
    public void validate() {
        if (inputPath == null) {
            throw new IllegalStateException("Input file is required");
        }
        if (!Files.isRegularFile(inputPath)) {
            throw new UncheckedIOException("Input file does not exist: " + inputPath,
                new NoSuchFileException(inputPath.toString()));
        }
    }

    @Override
    public String toString() {
        return inputPath != null ? inputPath.toString() : "null";
    }
}
