package io.devx.cli;

import io.devx.core.agent.AgentResult;
import io.devx.core.agent.AgentSettings;
import io.devx.core.config.ConfigPaths;
import io.devx.core.config.model.AgentDefaults;
import io.devx.core.config.model.DevxConfig;
import io.devx.core.model.FinishReason;
import io.devx.core.model.UsageMetadata;
import io.devx.core.retry.CancellationSignal;
import io.devx.core.stream.DataQualityWarning;
import io.devx.core.stream.StreamListener;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ask", description = "Send a prompt to the assistant and run the tools it requests")
public final class AskCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override; otherwise chosen from the model name")
    String provider;

    @Option(names = "--no-stream", description = "Wait for complete responses instead of streaming")
    boolean noStream;

    @Option(names = "--max-turns", description = "Maximum model turns before giving up")
    Integer maxTurns;

    @Option(names = "--workspace", description = "Workspace directory the tools may read")
    Path workspace;

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        CancellationSignal cancel = new CancellationSignal();
        Thread interruptHook = new Thread(cancel::cancel, "devx-cancel");
        Runtime.getRuntime().addShutdownHook(interruptHook);
        try {
            DevxConfig config = context.configService().load(context.configPath());
            AgentDefaults defaults = config.agents().defaults();

            AgentSettings settings = new AgentSettings(
                AgentSettings.DEFAULT_SYSTEM_PROMPT,
                provider,
                model != null ? model : defaults.model(),
                maxTurns != null ? maxTurns : defaults.maxToolIterations(),
                defaults.maxTokens(),
                defaults.temperature(),
                !noStream
            );

            Path root = workspace != null
                ? workspace.toAbsolutePath().normalize()
                : ConfigPaths.resolveWorkspace(defaults.workspace());
            AgentResult result = context.orchestrator().run(prompt, settings, root, new ConsoleListener(System.out, System.err), cancel);
            if (noStream) {
                System.out.println(result.content());
                result.warnings().forEach(warning -> System.err.println("warning: " + warning.describe()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Ask command failed: " + e.getMessage());
            return 1;
        } finally {
            removeHook(interruptHook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook has run.
            return;
        }
    }

    private static final class ConsoleListener implements StreamListener {
        private final PrintStream out;
        private final PrintStream err;

        private ConsoleListener(PrintStream out, PrintStream err) {
            this.out = out;
            this.err = err;
        }

        @Override
        public void onText(String text) {
            out.print(text);
            out.flush();
        }

        @Override
        public void onWarning(DataQualityWarning warning) {
            err.println("warning: " + warning.describe());
        }

        @Override
        public void onComplete(FinishReason finishReason, UsageMetadata usage) {
            out.println();
            if (finishReason == FinishReason.MAX_OUTPUT_REACHED) {
                err.println("note: response stopped at the output token limit");
            }
        }
    }
}
