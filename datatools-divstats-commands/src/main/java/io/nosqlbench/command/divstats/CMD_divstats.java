package io.nosqlbench.command.divstats;

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

import io.nosqlbench.command.divstats.subcommands.CMD_divstats_update;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The divstats command computes dataset-level attributes of divided datasets.
///
/// This is an umbrella command for the divstats subcommands.
@CommandLine.Command(name = "divstats",
    header = "Compute attributes of divided datasets",
    description = "Contains subcommands that summarize datasets stored as many partitions",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_divstats_update.class
    })
public class CMD_divstats implements Callable<Integer> {

    /// Run CMD_divstats
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_divstats()).execute(args));
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
