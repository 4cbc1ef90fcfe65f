package org.ontodsl.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the OntoDSL compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given DSL source.
     *
     * @param source The complete DSL text.
     * @param programName A name for the program, used in diagnostics.
     * @return A {@link CompiledScript} holding the generated query blocks.
     * @throws CompilationException if the program is rejected by any phase.
     */
    CompiledScript compile(String source, String programName) throws CompilationException;

    /**
     * Compiles the DSL source from a UTF-8 file.
     * @param programPath The path to the DSL file.
     * @return A {@link CompiledScript} holding the generated query blocks.
     * @throws CompilationException if the program is rejected by any phase.
     * @throws IOException if the file cannot be read.
     */
    default CompiledScript compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readString(programPath, StandardCharsets.UTF_8), programPath.toString());
    }
}
