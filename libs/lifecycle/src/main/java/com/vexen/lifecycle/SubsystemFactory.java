package com.vexen.lifecycle;

/**
 * Constructs a {@link Subsystem} from its configuration slice.
 * <p>
 * Construction must not open resources; that happens in {@link Subsystem#init()}.
 *
 * @param <C> configuration slice type
 * @param <S> subsystem type
 */
@FunctionalInterface
public interface SubsystemFactory<C, S extends Subsystem> {

    S create(C slice);
}
