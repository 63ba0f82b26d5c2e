package com.dflow.diagram.compile.transform;

import java.util.Map;

/**
 * Custom per-type step run after renames, removals and defaults. Receives a mutable copy of the config.
 *
 * @throws IllegalArgumentException when a field cannot be normalized; reported as a Transformation error
 */
@FunctionalInterface
public interface NodeTransformHook {

    NodeTransformHook NONE = config -> { };

    void apply(Map<String, Object> config);
}
