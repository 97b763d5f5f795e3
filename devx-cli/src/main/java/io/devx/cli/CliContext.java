package io.devx.cli;

import io.devx.core.agent.AgentOrchestrator;
import io.devx.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    AgentOrchestrator orchestrator,
    ConfigService configService,
    Path configPath
) {
}
