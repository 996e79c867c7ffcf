package org.neuralchilli.conductor.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.conductor.domain.ConfigurationException;
import org.neuralchilli.conductor.domain.TaskGroupDefinition;
import org.neuralchilli.conductor.domain.TaskInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a group definition before it runs: unique task names and no dependency
 * cycles between tasks of the same group.
 * Dependencies on keys produced by other groups are not edges here.
 */
@ApplicationScoped
public class GroupDefinitionValidator {

    private static final Logger log = LoggerFactory.getLogger(GroupDefinitionValidator.class);

    /**
     * Validate the group.
     *
     * @return task names in an order where producers come before consumers
     * @throws ConfigurationException on duplicate names or a dependency cycle
     */
    public List<String> validate(TaskGroupDefinition group) {
        List<String> duplicates = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (TaskInfo task : group.tasks()) {
            if (!names.add(task.name())) {
                duplicates.add(task.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ConfigurationException("Duplicate task names in group '" + group.name() + "': " + duplicates,
                    duplicates.get(0), "name", List.of("Task names must be unique within a group"));
        }

        Map<String, String> producers = new HashMap<>();
        for (TaskInfo task : group.tasks()) {
            for (String key : task.allResultKeys()) {
                producers.putIfAbsent(key, task.name());
            }
        }

        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
        group.tasks().forEach(task -> dag.addVertex(task.name()));

        for (TaskInfo task : group.tasks()) {
            for (String dependency : task.allDependencies()) {
                String producer = producers.get(dependency);
                if (producer == null) {
                    continue;
                }
                try {
                    dag.addEdge(producer, task.name());
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(
                            "Circular dependency in group '" + group.name() + "': task '" + task.name()
                                    + "' depends on '" + dependency + "' produced by '" + producer + "'",
                            task.name(), "dependencies",
                            List.of("Remove '" + dependency + "' from the dependencies of '" + task.name() + "'",
                                    "Split the cycle across two groups"));
                }
            }
        }

        List<String> order = new ArrayList<>(group.tasks().size());
        dag.iterator().forEachRemaining(order::add);
        log.debug("Group '{}' validated, execution order {}", group.name(), order);
        return order;
    }
}
