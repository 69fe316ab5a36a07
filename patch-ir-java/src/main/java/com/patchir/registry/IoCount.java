package com.patchir.registry;

/**
 * Resolved inlet and outlet count of one object instance.
 */
public record IoCount(int inlets, int outlets) {

    public static final IoCount DEFAULT = new IoCount(1, 1);
}
