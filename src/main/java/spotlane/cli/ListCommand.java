package spotlane.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import spotlane.coordinator.model.DeploymentRecord;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "list", description = "List deployments.")
public class ListCommand implements Callable<Integer> {

    private static final String ROW = "%-28s %-10s %-10s %-10s %-14s %s%n";

    @ParentCommand
    RootCommand root;

    @Spec
    CommandSpec spec;

    @Option(names = {"--all", "-a"}, description = "Include destroyed deployments.")
    boolean all;

    @Override
    public Integer call() {
        try {
            List<DeploymentRecord> records = root.dependencies().coordinator().list(all);
            PrintWriter out = spec.commandLine().getOut();
            if (records.isEmpty()) {
                out.println("No deployments.");
                out.flush();
                return 0;
            }
            out.printf(ROW, "SERVICE", "STATUS", "SERVERLESS", "SPOT", "GPU", "ENDPOINT");
            for (DeploymentRecord r : records) {
                out.printf(ROW, r.serviceName(), r.status(), r.serverlessStatus(),
                        r.spotProvider() == null ? "-" : r.spotStatus(),
                        r.gpu() + " x" + r.gpuCount(),
                        r.routerUrl() == null ? "-" : r.routerUrl());
            }
            out.flush();
            return 0;
        } finally {
            root.closeDependencies();
        }
    }
}
