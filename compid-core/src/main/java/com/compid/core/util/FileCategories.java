package com.compid.core.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classification of project source files by extension.
 */
public final class FileCategories {

    public static final String SOURCE_C = "sourceC";
    public static final String SOURCE_CPP = "sourceCpp";
    public static final String SOURCE_ASM = "sourceAsm";
    public static final String HEADER = "header";
    public static final String LIBRARY = "library";
    public static final String OBJECT = "object";
    public static final String LINKER_SCRIPT = "linkerScript";
    public static final String DOC = "doc";
    public static final String OTHER = "other";

    private static final Map<String, List<String>> CATEGORIES = createCategories();

    private FileCategories() {
        // Utility class
    }

    private static Map<String, List<String>> createCategories() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put(SOURCE_C, List.of(".c", ".C"));
        categories.put(SOURCE_CPP, List.of(".cpp", ".c++", ".C++", ".cxx", ".cc", ".CC"));
        categories.put(SOURCE_ASM, List.of(".asm", ".s", ".S"));
        categories.put(HEADER, List.of(".h", ".hpp"));
        categories.put(LIBRARY, List.of(".a", ".lib"));
        categories.put(OBJECT, List.of(".o"));
        categories.put(LINKER_SCRIPT, List.of(".sct", ".scf", ".ld", ".icf"));
        categories.put(DOC, List.of(".txt", ".md", ".pdf", ".htm", ".html"));
        return Collections.unmodifiableMap(categories);
    }

    /**
     * Gets the category of a file from its extension.
     *
     * <p>The match is case-sensitive, so {@code main.c} is {@code sourceC} while
     * {@code main.CPP} is {@code other}.
     *
     * @param file file name or path
     * @return category name, {@link #OTHER} when the extension is not listed
     */
    public static String categoryOf(String file) {
        String extension = getExtension(file);
        for (Map.Entry<String, List<String>> category : CATEGORIES.entrySet()) {
            if (category.getValue().contains(extension)) {
                return category.getKey();
            }
        }
        return OTHER;
    }

    /**
     * Gets the file extension including its dot.
     *
     * <p>A file name starting with its only dot, such as {@code .gitignore}, has no
     * extension.
     *
     * @param file file name or path
     * @return extension such as {@code .c}, or empty string
     */
    public static String getExtension(String file) {
        if (file == null || file.isEmpty()) {
            return "";
        }
        int separator = Math.max(file.lastIndexOf('/'), file.lastIndexOf('\\'));
        String name = file.substring(separator + 1);
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot) : "";
    }

    /**
     * @return category names mapped to their extensions, in lookup order
     */
    public static Map<String, List<String>> categories() {
        return CATEGORIES;
    }
}
