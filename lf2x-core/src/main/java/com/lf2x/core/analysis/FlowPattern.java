package com.lf2x.core.analysis;

/** Structural shape of a flow graph. */
public enum FlowPattern {
    LINEAR,
    BRANCHING,
    CYCLIC
}
