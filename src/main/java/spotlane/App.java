package spotlane;

import picocli.CommandLine;
import spotlane.cli.RootCommand;

public final class App {
    private App() {
    }

    public static void main(String[] args) {
        CommandLine cli = new CommandLine(new RootCommand());
        cli.setExpandAtFiles(false);
        int exitCode = cli.execute(args);
        System.exit(exitCode);
    }
}
