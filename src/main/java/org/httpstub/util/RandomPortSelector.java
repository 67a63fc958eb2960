package org.httpstub.util;

import org.httpstub.interfaces.PortSelector;

import java.util.Random;

/** Uniform pick over the range from one process-wide generator, seeded once. */
public final class RandomPortSelector implements PortSelector {

    private static final Random RANDOM = new Random();

    @Override
    public int nextPort(int minPort, int maxPort) {
        if (minPort > maxPort) {
            throw new IllegalArgumentException("minPort " + minPort + " > maxPort " + maxPort);
        }
        return minPort + RANDOM.nextInt(maxPort - minPort + 1);
    }
}
