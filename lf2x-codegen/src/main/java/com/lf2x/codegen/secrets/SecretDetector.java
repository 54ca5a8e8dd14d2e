package com.lf2x.codegen.secrets;

import com.lf2x.core.IntermediateRepresentation;
import com.lf2x.core.IrNode;
import com.lf2x.core.Naming;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Finds node configuration fields that look like credentials. */
public final class SecretDetector {
    static final List<String> SECRET_HINTS = List.of("api_key", "apikey", "token", "secret", "password", "auth", "key");

    private SecretDetector() {}

    /** Secrets in node order, then field order; one entry per environment variable name. */
    public static List<DetectedSecret> detect(IntermediateRepresentation ir) {
        Objects.requireNonNull(ir, "ir");
        List<DetectedSecret> secrets = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (IrNode node : ir.nodes()) {
            for (Map.Entry<String, Object> entry : node.data().entrySet()) {
                if (!looksLikeSecret(entry.getKey(), entry.getValue())) continue;
                String envVar = envVarName(ir.flowId(), node.nodeId(), entry.getKey());
                if (!seen.add(envVar)) continue;
                secrets.add(new DetectedSecret(
                    envVar, attributeName(envVar), node.nodeId(), entry.getKey(), (String) entry.getValue()));
            }
        }
        return List.copyOf(secrets);
    }

    static boolean looksLikeSecret(String field, Object value) {
        if (!(value instanceof String text) || text.isBlank()) return false;
        String lower = field.toLowerCase(Locale.ROOT);
        for (String hint : SECRET_HINTS) {
            if (lower.contains(hint)) return true;
        }
        return false;
    }

    static String envVarName(String flowId, String nodeId, String field) {
        return Naming.slugify(flowId + "_" + nodeId + "_" + field, "lf2x_secret").toUpperCase(Locale.ROOT);
    }

    static String attributeName(String envVar) {
        return Naming.slugify(envVar.toLowerCase(Locale.ROOT), "secret");
    }
}
