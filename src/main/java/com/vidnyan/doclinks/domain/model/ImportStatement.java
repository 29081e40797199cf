package com.vidnyan.doclinks.domain.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A Java import line as written in a documentation code block.
 *
 * @param name         the dotted name after {@code import} / {@code import static}
 * @param staticImport whether it is a static import
 * @param wildcard     whether it ends in {@code .*}
 */
public record ImportStatement(String name, boolean staticImport, boolean wildcard) {

    private static final Pattern IMPORT = Pattern.compile(
            "^import\\s+(static\\s+)?([A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*)(\\.\\*)?\\s*;?\\s*$");

    public static Optional<ImportStatement> parse(String line) {
        Matcher m = IMPORT.matcher(line.strip());
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ImportStatement(m.group(2), m.group(1) != null, m.group(3) != null));
    }

    /**
     * The module the import lives in: a type for single-type and static imports,
     * a package for on-demand imports.
     */
    public String module() {
        if (staticImport && !wildcard) {
            int dot = name.lastIndexOf('.');
            return dot > 0 ? name.substring(0, dot) : name;
        }
        return name;
    }

    public String finalComponent() {
        String module = module();
        return module.substring(module.lastIndexOf('.') + 1);
    }
}
