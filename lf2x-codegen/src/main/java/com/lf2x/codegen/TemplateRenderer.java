package com.lf2x.codegen;

import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.error.PebbleException;
import io.pebbletemplates.pebble.extension.AbstractExtension;
import io.pebbletemplates.pebble.extension.Filter;
import io.pebbletemplates.pebble.loader.ClasspathLoader;
import io.pebbletemplates.pebble.template.EvaluationContext;
import io.pebbletemplates.pebble.template.PebbleTemplate;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the classpath templates under {@code /templates}. Names are given without the
 * {@code .peb} suffix, e.g. {@code langchain/main_chain.py}.
 *
 * <p>Output is not HTML-escaped. The {@code pyrepr} filter quotes a value as a Python string literal.
 */
public final class TemplateRenderer {
    private static final PebbleEngine ENGINE = new PebbleEngine.Builder()
            .loader(classpathLoader())
            .autoEscaping(false)
            .strictVariables(true)
            .newLineTrimming(true)
            .extension(new AbstractExtension() {
                @Override
                public Map<String, Filter> getFilters() {
                    return Map.of("pyrepr", new PythonReprFilter());
                }
            })
            .build();

    private TemplateRenderer() {}

    public static String render(String templateName, Map<String, Object> context) throws IOException {
        Objects.requireNonNull(templateName, "templateName");
        Objects.requireNonNull(context, "context");
        try {
            PebbleTemplate template = ENGINE.getTemplate(templateName);
            Writer writer = new StringWriter();
            template.evaluate(writer, context);
            return writer.toString();
        } catch (PebbleException e) {
            throw new IllegalStateException("Failed to render template '" + templateName + "'", e);
        }
    }

    /** Single-quoted unless the value holds a single quote and no double quote. */
    static String pythonRepr(String value) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder out = new StringBuilder(value.length() + 2).append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c == quote) out.append('\\');
                    out.append(c);
                }
            }
        }
        return out.append(quote).toString();
    }

    private static ClasspathLoader classpathLoader() {
        ClasspathLoader loader = new ClasspathLoader(TemplateRenderer.class.getClassLoader());
        loader.setPrefix("templates");
        loader.setSuffix(".peb");
        return loader;
    }

    private static final class PythonReprFilter implements Filter {
        @Override
        public List<String> getArgumentNames() {
            return null;
        }

        @Override
        public Object apply(Object input, Map<String, Object> args, PebbleTemplate self,
                            EvaluationContext context, int lineNumber) {
            return pythonRepr(input == null ? "" : input.toString());
        }
    }
}
