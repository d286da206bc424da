package com.vexen.core;

/**
 * Scoped acquisition of a {@link VexenContainer}: initialized on entry, closed on every exit path.
 * <pre>{@code
 * UUID id = ContainerScope.use(config, vexen ->
 *         vexen.identity().users().create(new CreateUserRequest("Ada", "ada@example.com")).id());
 * }</pre>
 */
public final class ContainerScope {

    private ContainerScope() {
        // utility class
    }

    /**
     * Creates and initializes a container for use in try-with-resources.
     */
    public static VexenContainer open(VexenConfig config) {
        return open(new VexenContainer(config));
    }

    /**
     * Initializes {@code container} for use in try-with-resources. A failed {@code init()} has
     * already released whatever it started, so the failure is rethrown as is.
     *
     * @throws IllegalStateException if {@code container} is not {@link ContainerState#UNINITIALIZED};
     *                               the container is left untouched
     */
    public static VexenContainer open(VexenContainer container) {
        ContainerState current = container.state();
        if (current != ContainerState.UNINITIALIZED) {
            throw new IllegalStateException("Cannot open a scope on a " + current + " VexenContainer");
        }
        container.init();
        return container;
    }

    /**
     * Runs {@code work} against a new, initialized container and closes it exactly once afterwards.
     * Exceptions from {@code work} propagate unchanged.
     */
    public static <T, E extends Exception> T use(VexenConfig config, ContainerFunction<T, E> work) throws E {
        return use(new VexenContainer(config), work);
    }

    /**
     * Initializes {@code container}, runs {@code work} against it and closes it exactly once afterwards.
     */
    public static <T, E extends Exception> T use(VexenContainer container, ContainerFunction<T, E> work) throws E {
        try (VexenContainer ready = open(container)) {
            return work.apply(ready);
        }
    }
}
