package io.xrdflow.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the xrdflow command line.
///
/// Registers the subcommands:
/// - `run` - Process every frame of a scan and optionally export the results
/// - `validate` - Load a tree, propagate shapes and report inconsistent nodes
/// - `show` - Render a tree as indented text or YAML
///
/// @see RunCommand
/// @see ValidateCommand
/// @see ShowCommand
@Command(
        name = "xrdflow",
        description = "Tree-structured processing of diffraction scans",
        mixinStandardHelpOptions = true,
        version = "xrdflow 0.1.0",
        subcommands = {RunCommand.class, ValidateCommand.class, ShowCommand.class})
public class XrdflowCli {

    public static void main(String[] args) {
        configureLogging();
        System.exit(new CommandLine(new XrdflowCli()).execute(args));
    }

    private static void configureLogging() {
        try (InputStream in = XrdflowCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(XrdflowCli.class.getName())
                    .warning("Could not read logging configuration: " + e.getMessage());
        }
    }
}
