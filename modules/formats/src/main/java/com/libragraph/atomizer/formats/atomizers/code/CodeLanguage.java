package com.libragraph.atomizer.formats.atomizers.code;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Line-oriented recognizers per language. Patterns are matched against single source lines;
 * the last capturing group that matched names the declared element.
 */
enum CodeLanguage {

    JAVA("java", Set.of("java"),
            "^\\s*(?:import|package)\\s+[\\w.*]+(?:\\s*\\.\\s*\\*)?\\s*;",
            "^\\s*(?:(?:public|protected|private|abstract|final|static|sealed|non-sealed|strictfp)\\s+)*(?:class|interface|enum|record|@interface)\\s+(\\w+)",
            "^\\s*(?:(?:public|protected|private|static|final|abstract|synchronized|native|default)\\s+)+(?:<[^>]+>\\s+)?[\\w<>\\[\\],.?]+\\s+(\\w+)\\s*\\(",
            "//", "/*", "*/"),
    KOTLIN("kotlin", Set.of("kt", "kts"),
            "^\\s*(?:import|package)\\s+[\\w.*]+",
            "^\\s*(?:(?:public|private|internal|open|abstract|sealed|data|enum|inner)\\s+)*(?:class|interface|object)\\s+(\\w+)",
            "^\\s*(?:(?:public|private|internal|override|open|suspend|inline)\\s+)*fun\\s+(?:<[^>]+>\\s*)?(?:[\\w.]+\\.)?(\\w+)\\s*\\(",
            "//", "/*", "*/"),
    SCALA("scala", Set.of("scala", "sc"),
            "^\\s*import\\s+\\S+",
            "^\\s*(?:(?:case|abstract|final|sealed|private|protected)\\s+)*(?:class|object|trait)\\s+(\\w+)",
            "^\\s*(?:(?:override|private|protected|final)\\s+)*def\\s+(\\w+)",
            "//", "/*", "*/"),
    CSHARP("csharp", Set.of("cs", "csx"),
            "^\\s*using\\s+[\\w.=\\s]+;",
            "^\\s*(?:(?:public|protected|private|internal|abstract|sealed|static|partial)\\s+)*(?:class|interface|struct|record|enum)\\s+(\\w+)",
            "^\\s*(?:(?:public|protected|private|internal|static|virtual|override|async|abstract|sealed)\\s+)+[\\w<>\\[\\],.?]+\\s+(\\w+)\\s*\\(",
            "//", "/*", "*/"),
    PYTHON("python", Set.of("py", "pyw", "pyx", "pyi"),
            "^\\s*(?:import\\s+\\S+|from\\s+\\S+\\s+import\\s+.+)",
            "^\\s*class\\s+(\\w+)",
            "^\\s*(?:async\\s+)?def\\s+(\\w+)",
            "#", null, null),
    JAVASCRIPT("javascript", Set.of("js", "mjs", "cjs", "jsx"),
            "^\\s*(?:import\\s+.+|(?:const|let|var)\\s+\\w+\\s*=\\s*require\\(.+\\))",
            "^\\s*(?:export\\s+)?(?:default\\s+)?class\\s+(\\w+)",
            "^\\s*(?:export\\s+)?(?:(?:async\\s+)?function\\s*\\*?\\s*(\\w+)|(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s*)?\\([^)]*\\)\\s*=>)",
            "//", "/*", "*/"),
    TYPESCRIPT("typescript", Set.of("ts", "tsx", "mts", "cts"),
            "^\\s*import\\s+.+",
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?(?:class|interface|enum|type)\\s+(\\w+)",
            "^\\s*(?:export\\s+)?(?:(?:async\\s+)?function\\s*\\*?\\s*(\\w+)|(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s*)?\\([^)]*\\)\\s*(?::\\s*[^=]+)?=>)",
            "//", "/*", "*/"),
    GO("go", Set.of("go"),
            "^\\s*(?:import\\s+.+|package\\s+\\w+)",
            "^\\s*type\\s+(\\w+)\\s+(?:struct|interface)",
            "^\\s*func\\s+(?:\\([^)]*\\)\\s*)?(\\w+)\\s*\\(",
            "//", "/*", "*/"),
    RUST("rust", Set.of("rs"),
            "^\\s*(?:pub\\s+)?(?:use|mod|extern\\s+crate)\\s+[^{]+;",
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:struct|enum|trait|union|impl(?:<[^>]*>)?)\\s+(\\w+)",
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:const\\s+)?(?:async\\s+)?(?:unsafe\\s+)?fn\\s+(\\w+)",
            "//", "/*", "*/"),
    CPP("cpp", Set.of("cpp", "cc", "cxx", "c", "h", "hpp", "hxx"),
            "^\\s*#\\s*(?:include|import)\\s*[<\"].+[>\"]",
            "^\\s*(?:template\\s*<[^>]*>\\s*)?(?:class|struct|union|enum(?:\\s+class)?)\\s+(\\w+)\\s*(?::[^;{]*)?\\{?\\s*$",
            "^\\s*(?:[\\w:<>,*&~]+\\s+)+\\**&?([\\w:~]+)\\s*\\([^;]*\\)\\s*(?:const)?\\s*(?:noexcept)?\\s*\\{?\\s*$",
            "//", "/*", "*/"),
    RUBY("ruby", Set.of("rb", "rake", "gemspec"),
            "^\\s*(?:require|require_relative|load)\\s+\\S+",
            "^\\s*(?:class|module)\\s+([\\w:]+)",
            "^\\s*def\\s+(?:self\\.)?([\\w?!=]+)",
            "#", "=begin", "=end"),
    PHP("php", Set.of("php", "phtml"),
            "^\\s*(?:use\\s+[\\w\\\\]+.*;|(?:require|include)(?:_once)?\\b.+;)",
            "^\\s*(?:(?:abstract|final)\\s+)?(?:class|interface|trait|enum)\\s+(\\w+)",
            "^\\s*(?:(?:public|protected|private|static|abstract|final)\\s+)*function\\s+&?(\\w+)\\s*\\(",
            "//", "/*", "*/"),
    SQL("sql", Set.of("sql", "ddl", "psql"),
            "^\\s*(?:\\\\i|\\\\include|source)\\s+\\S+",
            "(?i)^\\s*create\\s+(?:or\\s+replace\\s+)?(?:temporary\\s+)?(?:table|view|materialized\\s+view|type|index)\\s+(?:if\\s+not\\s+exists\\s+)?([\\w.\"]+)",
            "(?i)^\\s*create\\s+(?:or\\s+replace\\s+)?(?:function|procedure|trigger)\\s+([\\w.\"]+)",
            "--", "/*", "*/"),
    SHELL("shell", Set.of("sh", "bash", "zsh", "ksh"),
            "^\\s*(?:source|\\.)\\s+\\S+",
            null,
            "^\\s*(?:function\\s+([\\w-]+)|([\\w-]+)\\s*\\(\\s*\\))",
            "#", null, null),
    POWERSHELL("powershell", Set.of("ps1", "psm1", "psd1"),
            "(?i)^\\s*(?:import-module\\s+\\S+|using\\s+(?:module|namespace)\\s+\\S+)",
            "(?i)^\\s*(?:class|enum)\\s+(\\w+)",
            "(?i)^\\s*(?:function|filter)\\s+([\\w-]+)",
            "#", "<#", "#>"),
    SWIFT("swift", Set.of("swift"),
            "^\\s*import\\s+\\w+",
            "^\\s*(?:(?:public|private|internal|open|final|fileprivate)\\s+)*(?:class|struct|protocol|enum|extension|actor)\\s+(\\w+)",
            "^\\s*(?:(?:public|private|internal|open|static|override|mutating|fileprivate|@\\w+)\\s+)*func\\s+(\\w+)",
            "//", "/*", "*/");

    private final String id;
    private final Set<String> extensions;
    private final Pattern imports;
    private final Pattern types;
    private final Pattern functions;
    private final String lineComment;
    private final String blockStart;
    private final String blockEnd;

    CodeLanguage(String id, Set<String> extensions, String imports, String types, String functions,
                 String lineComment, String blockStart, String blockEnd) {
        this.id = id;
        this.extensions = extensions;
        this.imports = imports == null ? null : Pattern.compile(imports);
        this.types = types == null ? null : Pattern.compile(types);
        this.functions = functions == null ? null : Pattern.compile(functions);
        this.lineComment = lineComment;
        this.blockStart = blockStart;
        this.blockEnd = blockEnd;
    }

    String id() {
        return id;
    }

    Set<String> extensions() {
        return extensions;
    }

    Pattern imports() {
        return imports;
    }

    Pattern types() {
        return types;
    }

    Pattern functions() {
        return functions;
    }

    String lineComment() {
        return lineComment;
    }

    String blockStart() {
        return blockStart;
    }

    String blockEnd() {
        return blockEnd;
    }

    static Optional<CodeLanguage> forExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        for (CodeLanguage language : values()) {
            if (language.extensions.contains(extension)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves {@code text/x-java}, {@code application/x-python} and the like.
     */
    static Optional<CodeLanguage> forContentType(String contentType) {
        if (contentType == null) {
            return Optional.empty();
        }
        String subtype = contentType.substring(contentType.indexOf('/') + 1);
        if (subtype.startsWith("x-")) {
            subtype = subtype.substring(2);
        }
        if (subtype.endsWith("src")) {
            subtype = subtype.substring(0, subtype.length() - 3);
        }
        for (CodeLanguage language : values()) {
            if (language.id.equals(subtype) || language.name().equalsIgnoreCase(subtype)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
