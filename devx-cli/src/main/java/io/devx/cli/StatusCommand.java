package io.devx.cli;

import io.devx.core.config.ConfigPaths;
import io.devx.core.config.model.DevxConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            DevxConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + ConfigPaths.resolveWorkspace(config.agents().defaults().workspace()));
            System.out.println("Default provider: " + config.agents().defaults().provider());
            System.out.println("Default model: " + config.agents().defaults().model());
            System.out.println("Anthropic configured: " + config.providers().anthropic().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("Gemini configured: " + config.providers().gemini().configured());
            System.out.println("Bedrock configured: " + config.providers().bedrock().configuredForBedrock());
            System.out.println("Retry attempts: " + config.adapter().retry().maxAttempts());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
