package org.neuralchilli.conductor.config;

import com.hazelcast.core.HazelcastInstance;
import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * Member for {@code @QuarkusTest}s, isolated from any other member on the host.
 */
@Mock
@Alternative
@ApplicationScoped
public class HazelcastTestConfig {

    @Produces
    @Singleton
    @Alternative
    public HazelcastInstance hazelcastInstance() {
        return TestHazelcast.newInstance("quarkus");
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        if (instance.getLifecycleService().isRunning()) {
            instance.shutdown();
        }
    }
}
