package spotlane.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "status", description = "Show stored state, router health and provider status of a deployment.")
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    RootCommand root;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Service name")
    String serviceName;

    @Override
    public Integer call() {
        try {
            RootCommand.printJson(spec.commandLine().getOut(),
                    root.dependencies().coordinator().status(serviceName));
            return 0;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 2;
        } finally {
            root.closeDependencies();
        }
    }
}
