package com.vision.flow.model;

import java.util.List;

/**
 * Result of a full acyclicity check.
 *
 * @param cycle node ids along the first cycle found, closing id repeated at
 *              the end (e.g. {@code [A, B, A]}); empty when the graph is acyclic.
 */
public record CycleCheck(List<String> cycle) {

    public static final CycleCheck ACYCLIC = new CycleCheck(List.of());

    public CycleCheck {
        cycle = List.copyOf(cycle);
    }

    public boolean isAcyclic() {
        return cycle.isEmpty();
    }
}
