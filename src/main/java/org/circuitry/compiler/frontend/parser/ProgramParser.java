package org.circuitry.compiler.frontend.parser;

import org.circuitry.compiler.frontend.parser.ast.Program;

import java.nio.file.Path;

/**
 * Turns the text of a source file into a {@link Program}.
 */
@FunctionalInterface
public interface ProgramParser {

    /**
     * Parses a source file.
     *
     * @param path        The path of the file, used for spans in the resulting tree.
     * @param contents    The file contents.
     * @param programName The name to give the resulting program.
     * @return The parsed program.
     * @throws ParserException If the contents are not a valid program.
     */
    Program parse(Path path, String contents, String programName) throws ParserException;
}
