package spotlane.coordinator.planner;

import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.ProviderPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One plan per target backend. {@code spot} is {@code null} in
 * serverless-only mode.
 */
public record DeploymentPlan(DeployRequest request, String vllmCommand, ProviderPlan serverless, ProviderPlan spot) {

    public DeploymentPlan {
        Objects.requireNonNull(request, "request is required");
        Objects.requireNonNull(serverless, "serverless plan is required");
    }

    public boolean hasSpot() {
        return spot != null;
    }

    public List<ProviderPlan> plans() {
        List<ProviderPlan> plans = new ArrayList<>(2);
        plans.add(serverless);
        if (spot != null) {
            plans.add(spot);
        }
        return plans;
    }
}
