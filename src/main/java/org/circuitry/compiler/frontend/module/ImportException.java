package org.circuitry.compiler.frontend.module;

import org.circuitry.compiler.frontend.parser.ParserException;
import org.circuitry.compiler.frontend.parser.ast.ImportSymbol;
import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when an import cannot be resolved. Import resolution stops at the first failure;
 * imports already applied to the {@link ProgramContext} are kept.
 */
public class ImportException extends Exception {

    /**
     * The reason an import failed.
     */
    public enum Kind {
        /** A directory could not be listed or an entry's file type could not be read. */
        DIRECTORY_ERROR,
        /** An entry's file name has no text representation. */
        CONVERT_OS_STRING,
        /** A package entry that had to be a file is a directory. */
        EXPECTED_FILE,
        /** The imported file defines no circuit or function of the requested name. */
        UNKNOWN_SYMBOL,
        /** No source file matches the requested package name. */
        UNKNOWN_PACKAGE,
        /** An imported file could not be read or parsed. */
        PARSER_ERROR,
        /** A file imports itself, directly or through other files. */
        CYCLIC_IMPORT,
        /** A package exists both as a source file and in the imports directory. */
        CONFLICTING_PACKAGE
    }

    private final Kind kind;
    private final Span span;
    private final Path path;

    public ImportException(Kind kind, String message, Span span, Path path) {
        super(message);
        this.kind = kind;
        this.span = span;
        this.path = path;
    }

    public ImportException(Kind kind, String message, Span span, Path path, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.span = span;
        this.path = path;
    }

    public Kind getKind() {
        return kind;
    }

    public Span getSpan() {
        return span;
    }

    /**
     * Gets the file or directory involved in the failure.
     * @return The path, or {@code null} if the failure is not tied to one.
     */
    public Path getPath() {
        return path;
    }

    public static ImportException directoryError(IOException error, Path path, Span span) {
        return new ImportException(Kind.DIRECTORY_ERROR,
                "Compilation failed due to directory error @ '" + path + "': " + error.getMessage(),
                span, path, error);
    }

    public static ImportException convertOsString(Path path, Span span) {
        return new ImportException(Kind.CONVERT_OS_STRING,
                "Failed to convert file name of '" + path + "' to a string.", span, path);
    }

    public static ImportException expectedFile(String entryName, Path path, Span span) {
        return new ImportException(Kind.EXPECTED_FILE,
                "Cannot import symbol `" + entryName + "` from directory `" + entryName + "`.", span, path);
    }

    public static ImportException unknownSymbol(ImportSymbol symbol, String programName, Path path) {
        return new ImportException(Kind.UNKNOWN_SYMBOL,
                "Cannot find imported symbol `" + symbol.symbol().name() + "` in imported file `"
                        + programName + "` (" + path + ").",
                symbol.span(), path);
    }

    public static ImportException unknownPackage(Identifier packageName) {
        return new ImportException(Kind.UNKNOWN_PACKAGE,
                "Cannot find imported package `" + packageName.name() + "` in source files or import directory.",
                packageName.span(), null);
    }

    public static ImportException parserError(ParserException error, Path path) {
        return new ImportException(Kind.PARSER_ERROR,
                "Failed to parse imported file '" + path + "': " + error.getMessage(),
                error.getSpan(), path, error);
    }

    public static ImportException unreadableFile(IOException error, Path path, Span span) {
        return new ImportException(Kind.PARSER_ERROR,
                "Failed to read imported file '" + path + "': " + error.getMessage(), span, path, error);
    }

    public static ImportException cyclicImport(List<Path> chain, Path repeated, Span span) {
        String cycle = chain.stream().map(Path::toString).collect(Collectors.joining(" -> "));
        return new ImportException(Kind.CYCLIC_IMPORT,
                "Cyclic import detected: " + cycle + " -> " + repeated, span, repeated);
    }

    public static ImportException conflictingPackage(Identifier packageName, Path sourceEntry, Path importsEntry) {
        return new ImportException(Kind.CONFLICTING_PACKAGE,
                "Package `" + packageName.name() + "` is defined both as '" + sourceEntry
                        + "' and '" + importsEntry + "'.",
                packageName.span(), sourceEntry);
    }
}
