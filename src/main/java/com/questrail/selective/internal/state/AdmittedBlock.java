package com.questrail.selective.internal.state;

import java.util.Objects;

/**
 * A block that the selection admitted, identified for failure attribution.
 *
 * @param testName the block's name, empty for blocks that never called the engine
 * @param line     the block's source line, 0 if unknown
 */
public record AdmittedBlock(String testName, int line) {
    public AdmittedBlock {
        Objects.requireNonNull(testName, "testName");
    }
}
