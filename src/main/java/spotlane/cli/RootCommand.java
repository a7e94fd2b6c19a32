package spotlane.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import spotlane.coordinator.config.CoordinatorConfig;
import spotlane.coordinator.config.Dependencies;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.function.Function;

@Command(
        name = "spotlane",
        mixinStandardHelpOptions = true,
        description = "Hybrid serverless + spot GPU inference launcher and router.",
        subcommands = {
                DeployCommand.class,
                RouterCommand.class,
                DestroyCommand.class,
                StatusCommand.class,
                ListCommand.class
        }
)
public class RootCommand {

    static final ObjectMapper JSON = new ObjectMapper()
            .findAndRegisterModules()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Option(names = {"--db-url"}, description = "JDBC URL of the deployment store (overrides SPOTLANE_DB_URL).")
    String dbUrl;

    private final Function<CoordinatorConfig, Dependencies> factory;
    private Dependencies dependencies;

    public RootCommand() {
        this(Dependencies::create);
    }

    public RootCommand(Function<CoordinatorConfig, Dependencies> factory) {
        this.factory = factory;
    }

    public CoordinatorConfig coordinatorConfig() {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.withDatabaseUrl(dbUrl);
        }
        return config;
    }

    public synchronized Dependencies dependencies() {
        if (dependencies == null) {
            dependencies = factory.apply(coordinatorConfig());
        }
        return dependencies;
    }

    synchronized void closeDependencies() {
        if (dependencies != null) {
            dependencies.close();
            dependencies = null;
        }
    }

    static void printJson(PrintWriter out, Object value) {
        try {
            out.println(JSON.writeValueAsString(value));
            out.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write JSON", e);
        }
    }
}
