package org.httpstub.interfaces;

/** Chooses the next candidate port for a bind attempt. */
@FunctionalInterface
public interface PortSelector {
    /** @return a port in {@code [minPort, maxPort]} */
    int nextPort(int minPort, int maxPort);
}
