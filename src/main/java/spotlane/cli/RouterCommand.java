package spotlane.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import spotlane.router.config.RouterConfig;
import spotlane.router.server.RouterNettyServer;

import java.util.concurrent.Callable;

@Command(name = "router", description = "Run a standalone routing proxy configured from SPOTLANE_* variables.")
public class RouterCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"--port", "-p"}, description = "Listen port (overrides SPOTLANE_PORT).")
    Integer port;

    @Option(names = {"--serverless-url"}, description = "Initial serverless base URL.")
    String serverlessUrl;

    @Option(names = {"--spot-url"}, description = "Initial spot base URL.")
    String spotUrl;

    @Override
    public Integer call() throws InterruptedException {
        RouterConfig config = RouterConfig.fromEnv();
        if (port != null) {
            config.withPort(port);
        }
        if (serverlessUrl != null) {
            config.withServerlessUrl(serverlessUrl);
        }
        if (spotUrl != null) {
            config.withSpotUrl(spotUrl);
        }

        RouterNettyServer server = new RouterNettyServer(config);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "spotlane-router-stop"));

        spec.commandLine().getOut().println("Router listening on port " + server.port());
        spec.commandLine().getOut().flush();
        server.awaitClose();
        return 0;
    }
}
