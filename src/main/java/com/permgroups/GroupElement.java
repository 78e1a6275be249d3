package com.permgroups;

/** Minimal group-element abstraction for algorithm code. */
public interface GroupElement<T extends GroupElement<T>> extends Comparable<T> {
    T multiply(T o);
    T inverse();
    boolean isIdentity();
}
