package com.lf2x.codegen.secrets;

import java.util.Objects;

/**
 * A credential-looking value found in node configuration.
 *
 * @param envVar     environment variable the generated project reads it from
 * @param attribute  settings attribute name in the generated project
 * @param sourceNode id of the node carrying the value
 * @param field      configuration key on that node
 * @param rawValue   the literal value from the export; never written to generated files
 */
public record DetectedSecret(String envVar, String attribute, String sourceNode, String field, String rawValue) {
    public DetectedSecret {
        envVar = Objects.requireNonNull(envVar, "envVar");
        attribute = Objects.requireNonNull(attribute, "attribute");
        sourceNode = Objects.requireNonNull(sourceNode, "sourceNode");
        field = Objects.requireNonNull(field, "field");
    }

    @Override
    public String toString() {
        return "DetectedSecret[" + envVar + " <- " + sourceNode + "." + field + "]";
    }
}
