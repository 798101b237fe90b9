package io.menucast.cli;

import picocli.CommandLine.Command;

@Command(name = "menucast", mixinStandardHelpOptions = true, description = "Scheduled LINE rich menu publisher")
public final class MenucastCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
