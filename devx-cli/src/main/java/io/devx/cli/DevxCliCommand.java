package io.devx.cli;

import picocli.CommandLine.Command;

@Command(name = "devx", mixinStandardHelpOptions = true, description = "DevX terminal coding assistant")
public final class DevxCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
