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

public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Describe each joined or mapped sequence on standard error"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors and the table itself"
    )
    private boolean quiet = false;

    /// @return true unless quiet
    public boolean showNormalOutput() {
        return !quiet;
    }

    /// @return true when verbose and not quiet
    public boolean showVerbose() {
        return verbose && !quiet;
    }

    /// @throws IllegalStateException if both verbose and quiet are enabled
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }
}
