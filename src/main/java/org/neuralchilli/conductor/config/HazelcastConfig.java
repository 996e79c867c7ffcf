package org.neuralchilli.conductor.config;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the embedded Hazelcast member backing the state store and the broker.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "hazelcast.client.cluster-name", defaultValue = "conductor-dev")
    String clusterName;

    @ConfigProperty(name = "hazelcast.multicast.enabled", defaultValue = "false")
    boolean multicastEnabled;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);

        Config config = new Config();
        config.setClusterName(clusterName);

        // Single member unless multicast discovery is switched on
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(multicastEnabled);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        // Registry, result values and context snapshots are small string hashes
        config.getMapConfig("hash:session:*").setBackupCount(1);

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(config);

        log.info("Hazelcast instance created successfully");

        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        if (instance.getLifecycleService().isRunning()) {
            log.info("Shutting down Hazelcast instance");
            instance.shutdown();
        }
    }
}
