package spotlane.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import spotlane.coordinator.config.Dependencies;
import spotlane.coordinator.config.ScalingPolicyLoader;
import spotlane.coordinator.error.TeardownException;
import spotlane.coordinator.model.ColdStartMode;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.HybridDeployment;
import spotlane.coordinator.service.HybridCoordinator;

import java.io.File;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

@Command(name = "deploy", description = "Launch serverless + spot backends behind one routing endpoint.")
public class DeployCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DeployCommand.class);

    @ParentCommand
    RootCommand root;

    @Spec
    CommandSpec spec;

    @Option(names = {"--model", "-m"}, required = true, description = "Hugging Face model id.")
    String model;

    @Option(names = {"--gpu", "-g"}, required = true, description = "GPU type, e.g. A100, L4, H100.")
    String gpu;

    @Option(names = {"--gpu-count"}, description = "GPUs per replica. Default: 1")
    int gpuCount = 1;

    @Option(names = {"--tp-size"}, description = "Tensor parallel size. Default: 1")
    int tpSize = 1;

    @Option(names = {"--max-model-len"}, description = "Maximum context length. Default: 4096")
    int maxModelLen = 4096;

    @Option(names = {"--concurrency"}, description = "Target concurrent requests per worker. Default: 32")
    int concurrency = 32;

    @Option(names = {"--cold-start"}, description = "fast_boot or no_fast_boot. Default: fast_boot")
    String coldStart = "fast_boot";

    @Option(names = {"--no-scale-to-zero"}, description = "Keep at least one warm worker on each backend.")
    boolean noScaleToZero;

    @Option(names = {"--serverless-provider"}, description = "Default: runpod")
    String serverlessProvider = "runpod";

    @Option(names = {"--spot-provider"}, description = "Default: skyserve")
    String spotProvider = "skyserve";

    @Option(names = {"--spot-cloud"}, description = "Cloud for the spot pool. Default: aws")
    String spotCloud = "aws";

    @Option(names = {"--region"}, description = "Region for the spot pool.")
    String region;

    @Option(names = {"--name"}, description = "Service name (generated when omitted).")
    String name;

    @Option(names = {"--serverless-only"}, description = "Skip the spot backend and the router.")
    boolean serverlessOnly;

    @Option(names = {"--vllm-version"}, description = "Default: 0.15.1")
    String vllmVersion = "0.15.1";

    @Option(names = {"--scaling-file"}, description = "INI file with [spot] and [serverless] scaling overrides.")
    File scalingFile;

    @Option(names = {"--detach"}, description = "Exit once every leg has settled, leaving the backends running.")
    boolean detach;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Dependencies deps = root.dependencies();
        HybridCoordinator coordinator = deps.coordinator();

        HybridDeployment deployment;
        try {
            deployment = coordinator.launch(buildRequest(deps));
        } catch (IllegalArgumentException e) {
            err.println("Invalid deploy request: " + e.getMessage());
            root.closeDependencies();
            return 2;
        }
        RootCommand.printJson(out, summary(deployment));

        if (detach) {
            return awaitSettled(deployment, out);
        }

        return serveUntilStopped(coordinator, deployment, out, err);
    }

    /**
     * Blocks until Ctrl-C or until every backend has failed. A total failure
     * is torn down here and exits 1.
     */
    private int serveUntilStopped(HybridCoordinator coordinator, HybridDeployment deployment,
            PrintWriter out, PrintWriter err) {
        CountDownLatch stopped = new CountDownLatch(1);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread teardown = new Thread(() -> {
            try {
                coordinator.destroy(deployment);
            } catch (TeardownException e) {
                log.error("{}", e.getMessage());
            } finally {
                root.closeDependencies();
                stopped.countDown();
            }
        }, "spotlane-teardown");
        Runtime.getRuntime().addShutdownHook(teardown);

        deployment.completion().whenComplete((settled, e) -> {
            if (e != null) {
                failure.set(e);
                stopped.countDown();
            }
        });

        if (failure.get() == null) {
            out.println("Serving at " + deployment.routerUrl() + " (Ctrl-C to tear down)");
            out.flush();
        }
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (failure.get() == null) {
            return 0;
        }

        try {
            Runtime.getRuntime().removeShutdownHook(teardown);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook tears down
            return 1;
        }
        Throwable cause = failure.get() instanceof CompletionException && failure.get().getCause() != null
                ? failure.get().getCause()
                : failure.get();
        err.println("Deployment failed: " + cause.getMessage());
        RootCommand.printJson(out, summary(deployment));
        try {
            coordinator.destroy(deployment);
        } catch (TeardownException e) {
            err.println(e.getMessage());
        }
        err.flush();
        root.closeDependencies();
        return 1;
    }

    DeployRequest buildRequest(Dependencies deps) {
        return DeployRequest.builder()
                .modelName(model)
                .gpu(gpu)
                .gpuCount(gpuCount)
                .tpSize(tpSize)
                .maxModelLen(maxModelLen)
                .concurrency(concurrency)
                .coldStartMode(ColdStartMode.parse(coldStart))
                .scaleToZero(!noScaleToZero)
                .serverlessProvider(serverlessProvider)
                .spotProvider(spotProvider)
                .spotCloud(spotCloud)
                .region(region)
                .serviceName(name)
                .serverlessOnly(serverlessOnly)
                .vllmVersion(vllmVersion)
                .scaling(scalingFile != null ? ScalingPolicyLoader.load(scalingFile) : deps.scalingPolicy())
                .build();
    }

    private int awaitSettled(HybridDeployment deployment, PrintWriter out) {
        int exit = 0;
        try {
            deployment.completion().join();
        } catch (CompletionException e) {
            exit = 1;
        }
        RootCommand.printJson(out, summary(deployment));
        if (deployment.spot() != null && deployment.spot().isSuccess()) {
            out.println("Router stops with this process. To keep routing, run:");
            out.println("  SPOTLANE_SERVERLESS_URL=" + nullToEmpty(deployment.serverless().endpointUrl())
                    + " SPOTLANE_SPOT_URL=" + deployment.spot().endpointUrl() + " spotlane router");
        }
        out.flush();
        root.closeDependencies();
        return exit;
    }

    static Map<String, Object> summary(HybridDeployment deployment) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("service_name", deployment.serviceName());
        map.put("status", deployment.status().name());
        map.put("endpoint", deployment.routerUrl());
        map.put("serverless", deployment.serverlessStatus().name());
        map.put("spot", deployment.spotStatus().name());
        if (deployment.serverless() != null) {
            map.put("serverless_endpoint", deployment.serverless().endpointUrl());
            if (deployment.serverless().error() != null) {
                map.put("serverless_error", deployment.serverless().error());
            }
        }
        if (deployment.spot() != null) {
            map.put("spot_endpoint", deployment.spot().endpointUrl());
            if (deployment.spot().error() != null) {
                map.put("spot_error", deployment.spot().error());
            }
        }
        return map;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
