package org.neuralchilli.conductor.domain;

/**
 * One input a node waits for.
 * {@code met} flips from false to true once; later notifications are ignored.
 */
public final class Dependency {

    private final String contextKey;
    private final String propertyName;
    private final String propertyPath;
    private final boolean required;

    private Object output;
    private boolean met;

    public Dependency(String contextKey, String propertyName, String propertyPath, boolean required) {
        if (contextKey == null || contextKey.isBlank()) {
            throw new IllegalArgumentException("Dependency context key cannot be null or empty");
        }
        this.contextKey = contextKey;
        this.propertyName = propertyName == null || propertyName.isBlank() ? contextKey : propertyName;
        this.propertyPath = propertyPath == null || propertyPath.isBlank() ? null : propertyPath;
        this.required = required;
    }

    public static Dependency on(String contextKey) {
        return new Dependency(contextKey, null, null, true);
    }

    public static Dependency on(String contextKey, String propertyPath) {
        return new Dependency(contextKey, null, propertyPath, true);
    }

    public static Dependency optional(String contextKey) {
        return new Dependency(contextKey, null, null, false);
    }

    public String contextKey() {
        return contextKey;
    }

    public String propertyName() {
        return propertyName;
    }

    public String propertyPath() {
        return propertyPath;
    }

    public boolean required() {
        return required;
    }

    public synchronized Object output() {
        return output;
    }

    public synchronized boolean isMet() {
        return met;
    }

    /**
     * Record the delivered value.
     *
     * @return true if this call satisfied the dependency, false if it was already met
     */
    public synchronized boolean markMet(Object value) {
        if (met) {
            return false;
        }
        this.output = value;
        this.met = true;
        return true;
    }

    @Override
    public synchronized String toString() {
        return "Dependency[contextKey=" + contextKey + ", propertyName=" + propertyName
                + ", propertyPath=" + propertyPath + ", required=" + required + ", met=" + met + "]";
    }
}
