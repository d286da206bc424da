package com.vexen.core;

/**
 * Caller code run against a ready container by {@link ContainerScope#use}.
 *
 * @param <T> result type
 * @param <E> checked exception the code may throw
 */
@FunctionalInterface
public interface ContainerFunction<T, E extends Exception> {

    T apply(VexenContainer container) throws E;
}
