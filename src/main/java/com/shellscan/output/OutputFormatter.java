package com.shellscan.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import org.eclipse.collections.api.list.ListIterable;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

public class OutputFormatter {

    public enum Format {
        LINES,
        NUL_SEPARATED,
        JSON
    }

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    // StringBuilder pool for line output
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    private final Format format;
    private final boolean prettyPrint;

    public OutputFormatter(Format format) {
        this(format, true);
    }

    public OutputFormatter(Format format, boolean prettyPrint) {
        this.format = format;
        this.prettyPrint = prettyPrint;
    }

    public String format(ListIterable<String> commands) {
        return switch (format) {
            case LINES -> joinTerminated(commands, '\n');
            case NUL_SEPARATED -> joinTerminated(commands, '\0');
            case JSON -> formatJson(commands);
        };
    }

    private String joinTerminated(ListIterable<String> commands, char terminator) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);
        commands.each(command -> sb.append(command).append(terminator));
        return sb.toString();
    }

    private String formatJson(ListIterable<String> commands) {
        StringWriter writer = new StringWriter();
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(writer)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            generator.writeStartArray();
            for (String command : commands) {
                generator.writeString(command);
            }
            generator.writeEndArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.append('\n').toString();
    }
}
