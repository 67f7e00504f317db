package org.neuralchilli.decision.config;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the embedded Hazelcast instance backing the local queue/index store.
 * Values are stored as JSON strings, so no custom serializers are registered.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "decision.store.cluster-name", defaultValue = "decision-local")
    String clusterName;

    @Produces
    @Singleton
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast task store with cluster name: {}", clusterName);

        Config config = new Config();
        config.setClusterName(clusterName);

        // Embedded, single member: no network join
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getAutoDetectionConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");
        config.getMetricsConfig().setEnabled(false);

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(config);

        log.info("Hazelcast task store created successfully");

        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        if (instance.getLifecycleService().isRunning()) {
            log.info("Shutting down Hazelcast task store");
            instance.getLifecycleService().shutdown();
        }
    }
}
