package org.circuitry.compiler.frontend.io;

import org.circuitry.compiler.frontend.module.ImportException;
import org.circuitry.compiler.frontend.parser.ParserException;
import org.circuitry.compiler.frontend.parser.ProgramParser;
import org.circuitry.compiler.frontend.parser.ast.Program;
import org.circuitry.compiler.model.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Loads source files from the filesystem and turns package entries into parsed
 * {@link Program}s named after their file.
 */
public final class SourceLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SourceLoader.class);

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The canonical name used for diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private final ProgramParser parser;
    private final String sourceExtension;

    /**
     * @param parser          The parser for file contents.
     * @param sourceExtension The source file suffix stripped from file names to form program names.
     */
    public SourceLoader(ProgramParser parser, String sourceExtension) {
        this.parser = parser;
        this.sourceExtension = sourceExtension;
    }

    /**
     * Loads content from a local filesystem path.
     *
     * @param resolvedPath The path of the file.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path resolvedPath) throws IOException {
        String logicalName = resolvedPath.toString().replace('\\', '/');
        String content = normalizeLineEndings(Files.readString(resolvedPath));
        return new LoadResult(content, logicalName);
    }

    /**
     * Parses the file behind a package entry into a program named after the file.
     *
     * @param entry The directory entry of the package.
     * @param span  The location of the import, for errors.
     * @return The parsed program.
     * @throws ImportException If the entry's type cannot be read ({@code DIRECTORY_ERROR}), its name
     *                         has no text form ({@code CONVERT_OS_STRING}), it is a directory
     *                         ({@code EXPECTED_FILE}), or it cannot be read or parsed ({@code PARSER_ERROR}).
     */
    public Program parseImportFile(Path entry, Span span) throws ImportException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(entry, BasicFileAttributes.class);
        } catch (IOException e) {
            throw ImportException.directoryError(e, entry, span);
        }

        Path fileNamePath = entry.getFileName();
        if (fileNamePath == null) {
            throw ImportException.convertOsString(entry, span);
        }
        String fileName = fileNamePath.toString();

        if (attributes.isDirectory()) {
            throw ImportException.expectedFile(fileName, entry, span);
        }

        LoadResult loaded;
        try {
            loaded = loadFile(entry);
        } catch (IOException e) {
            throw ImportException.unreadableFile(e, entry, span);
        }

        LOG.debug("Parsing imported file '{}'", loaded.logicalName());
        try {
            return parser.parse(entry, loaded.content(), programName(fileName));
        } catch (ParserException e) {
            throw ImportException.parserError(e, entry);
        }
    }

    /**
     * Derives a program name from a file name by removing the source extension.
     * @param fileName The file name.
     * @return The program name.
     */
    public String programName(String fileName) {
        if (fileName.endsWith(sourceExtension) && fileName.length() > sourceExtension.length()) {
            return fileName.substring(0, fileName.length() - sourceExtension.length());
        }
        return fileName;
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
