package io.github.treetags.profile;

/** How a kind takes part in scope resolution. */
public enum TagRole {
    /** Container that names a scope without changing the kinds inside it (namespace, module). */
    NAMESPACE,
    /** Class-like container. */
    TYPE,
    /** Function-like container. */
    CALLABLE,
    /** Leaf definition, never a scope. */
    MEMBER;

    public boolean opensScope() {
        return this != MEMBER;
    }
}
