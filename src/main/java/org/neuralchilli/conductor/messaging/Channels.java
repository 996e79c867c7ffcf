package org.neuralchilli.conductor.messaging;

/**
 * Channel and store key naming shared by every component.
 */
public final class Channels {

    public static final String DEFAULT_SCOPE = "task_group_execute";
    public static final String NODE_STATUS_UPDATES = "node_status_updates";
    public static final String AGENCY_TASK_GROUP_COMPLETED = "agency_task_group:completed";
    public static final String ERRORS = "errors";

    private static final String[] INTERNAL_RESULT_PREFIXES = {"task:", "task_result:"};

    private Channels() {
    }

    public static String resultChannel(String scope, String groupId, String resultKey) {
        return scope + ":" + groupId + ":" + resultKey;
    }

    public static String completion(String groupKey) {
        return groupKey + ":completion";
    }

    public static String partialResults(String groupKey) {
        return groupKey + ":partial_results";
    }

    public static String sessionResultKeys(String sessionId) {
        return "session:" + sessionId + ":result_keys";
    }

    public static String sessionResultValues(String sessionId) {
        return "session:" + sessionId + ":result_values";
    }

    public static String sessionResults(String sessionId) {
        return "session:" + sessionId + ":results";
    }

    public static String sessionGroupContexts(String sessionId) {
        return "session:" + sessionId + ":group_contexts";
    }

    public static String sessionPartialResults(String sessionId) {
        return "session:" + sessionId + ":partial_results";
    }

    public static String sessionPattern(String sessionId) {
        return "session:" + sessionId + ":*";
    }

    public static String groupState(String groupId) {
        return "task_group:" + groupId + ":state";
    }

    public static String node(String nodeId) {
        return "node:" + nodeId;
    }

    public static String nodeStatus(String nodeId) {
        return node(nodeId) + ":status";
    }

    public static String nodeOutput(String nodeId) {
        return node(nodeId) + ":output";
    }

    public static String nodeContext(String nodeId) {
        return node(nodeId) + ":context";
    }

    /**
     * Result key carried by a notification channel: its last segment.
     */
    public static String resultKeyOf(String channel) {
        int idx = channel.lastIndexOf(':');
        return idx >= 0 ? channel.substring(idx + 1) : channel;
    }

    /**
     * Internal bookkeeping keys are never published as dependency updates.
     */
    public static boolean isInternalResultKey(String resultKey) {
        for (String prefix : INTERNAL_RESULT_PREFIXES) {
            if (resultKey.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
