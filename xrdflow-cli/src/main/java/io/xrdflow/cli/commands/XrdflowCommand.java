package io.xrdflow.cli.commands;

import java.util.concurrent.Callable;

/// Minimal abstract base for all xrdflow commands.
///
/// Owns the banner display and the {@link #call()} / {@link #execute()} contract.
/// Subclasses provide command-specific options and return the process exit code from
/// {@link #execute()}.
///
/// @see TreeCommand
public abstract class XrdflowCommand implements Callable<Integer> {

    private static final String[] BANNER = {
        "",
        "                 _  __ _",
        " __  ___ __ __| |/ _| | _____      __",
        " \\ \\/ / '__/ _` | |_| |/ _ \\ \\ /\\ / /",
        "  >  <| | | (_| |  _| | (_) \\ V  V /",
        " /_/\\_\\_|  \\__,_|_| |_|\\___/ \\_/\\_/",
        "",
        " Diffraction scan processing",
        ""
    };

    @Override
    public final Integer call() {
        for (String line : BANNER) {
            System.out.println(line);
        }
        return execute();
    }

    /// @return process exit code, 0 on success
    protected abstract int execute();
}
