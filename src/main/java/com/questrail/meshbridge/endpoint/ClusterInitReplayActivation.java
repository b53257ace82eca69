package com.questrail.meshbridge.endpoint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ClusterInitReplayActivation
 * -----------------------------------------------------------------------------
 * Default {@link EndpointActivation}: walks the endpoint's cluster list and
 * runs each cluster's initialization hook.
 *
 * <p>Frameworks typically run cluster initialization once, at startup, for
 * statically declared endpoints only. This replays that step for an endpoint
 * added later.</p>
 *
 * <p>Each cluster of each endpoint is initialized at most once per instance.
 * If a hook fails, the clusters already initialized stay marked and a later
 * activation of the same endpoint resumes with the failed one.</p>
 */
public final class ClusterInitReplayActivation implements EndpointActivation
{
    private final EndpointFramework framework;
    private final Map<Integer, Set<Long>> initialized = new HashMap<>();

    public ClusterInitReplayActivation(EndpointFramework framework) {
        this.framework = Objects.requireNonNull(framework, "framework");
    }

    @Override
    public synchronized void activate(EndpointHandle handle) {
        Objects.requireNonNull(handle, "handle");
        Set<Long> done = initialized.computeIfAbsent(handle.endpointId(), id -> new HashSet<>());
        for (ClusterHandle cluster : framework.clusters(handle)) {
            if (done.contains(cluster.clusterId())) {
                continue;
            }
            cluster.initialize();
            done.add(cluster.clusterId());
        }
    }
}
