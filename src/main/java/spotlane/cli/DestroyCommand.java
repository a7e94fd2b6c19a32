package spotlane.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import spotlane.coordinator.error.TeardownException;

import java.util.concurrent.Callable;

@Command(name = "destroy", description = "Tear down every backend of a deployment.")
public class DestroyCommand implements Callable<Integer> {

    @ParentCommand
    RootCommand root;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Service name")
    String serviceName;

    @Override
    public Integer call() {
        try {
            root.dependencies().coordinator().destroy(serviceName);
            spec.commandLine().getOut().println("Destroyed " + serviceName);
            return 0;
        } catch (TeardownException e) {
            spec.commandLine().getErr().println(e.getMessage());
            for (Throwable failure : e.getSuppressed()) {
                spec.commandLine().getErr().println("  " + failure.getMessage());
            }
            return 1;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 2;
        } finally {
            root.closeDependencies();
        }
    }
}
