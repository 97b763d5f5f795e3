package io.devx.app;

import io.devx.cli.AskCommand;
import io.devx.cli.CliContext;
import io.devx.cli.DevxCliCommand;
import io.devx.cli.OnboardCommand;
import io.devx.cli.StatusCommand;
import io.devx.core.agent.AgentOrchestrator;
import io.devx.core.client.ClientPool;
import io.devx.core.config.ConfigPaths;
import io.devx.core.config.ConfigService;
import io.devx.core.config.model.DevxConfig;
import io.devx.core.provider.AdapterContext;
import io.devx.core.provider.ProviderFactory;
import io.devx.core.provider.ProviderRegistry;
import io.devx.core.provider.ProviderRouter;
import io.devx.core.tool.ToolRegistry;
import io.devx.core.tool.impl.ListDirectoryTool;
import io.devx.core.tool.impl.ReadFileTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class DevxApplication {
    private static final Logger LOG = LoggerFactory.getLogger(DevxApplication.class);

    private DevxApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        DevxConfig config = loadConfig(configService);

        int exitCode;
        try (ClientPool clientPool = ProviderFactory.clientPool(config.adapter())) {
            AdapterContext adapterContext = ProviderFactory.context(config.adapter(), clientPool);
            ProviderRegistry providerRegistry = ProviderFactory.registry(config, adapterContext);
            LOG.debug("Registered providers: {}", providerRegistry.names());

            ToolRegistry toolRegistry = new ToolRegistry();
            toolRegistry.register(new ListDirectoryTool());
            toolRegistry.register(new ReadFileTool());

            AgentOrchestrator orchestrator = new AgentOrchestrator(
                new ProviderRouter(providerRegistry, config.agents().defaults().provider()),
                toolRegistry
            );
            CliContext context = new CliContext(orchestrator, configService, ConfigPaths.defaultConfigPath());

            CommandLine commandLine = new CommandLine(new DevxCliCommand());
            commandLine.addSubcommand("onboard", new OnboardCommand(context));
            commandLine.addSubcommand("ask", new AskCommand(context));
            commandLine.addSubcommand("status", new StatusCommand(context));
            exitCode = commandLine.execute(args);
        }
        System.exit(exitCode);
    }

    private static DevxConfig loadConfig(ConfigService configService) {
        try {
            return configService.load(ConfigPaths.defaultConfigPath());
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", ConfigPaths.defaultConfigPath(), e.getMessage());
            return configService.applyEnvironment(DevxConfig.defaults());
        }
    }
}
