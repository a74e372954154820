package org.circuitry.compiler.frontend.module;

import org.circuitry.compiler.frontend.io.SourceLoader;
import org.circuitry.compiler.frontend.parser.ProgramParser;
import org.circuitry.compiler.frontend.parser.ast.Circuit;
import org.circuitry.compiler.frontend.parser.ast.Function;
import org.circuitry.compiler.frontend.parser.ast.ImportStatement;
import org.circuitry.compiler.frontend.parser.ast.ImportSymbol;
import org.circuitry.compiler.frontend.parser.ast.PackageAccess;
import org.circuitry.compiler.frontend.parser.ast.PackageRef;
import org.circuitry.compiler.frontend.parser.ast.Program;
import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Resolves import declarations against the filesystem and installs the imported
 * declarations into a {@link ProgramContext}.
 *
 * <p>A package {@code foo} is the file {@code src/foo.leo} under the search root. Its access
 * decides what is taken from it:</p>
 * <ul>
 *   <li>{@code foo.*} merges every declaration of the file into the importing scope.</li>
 *   <li>{@code foo.bar [as baz]} stores the circuit or function {@code bar} under
 *       {@code foo_baz} (or {@code foo_bar}) and binds the local name {@code baz} to it in the
 *       importing scope, then resolves the imports of {@code foo.leo} with {@code foo} as
 *       their importing scope.</li>
 *   <li>{@code foo.inner...} treats the entry {@code foo} as a new package root.</li>
 *   <li>{@code foo.(a, b)} applies each access in order and stops at the first failure.</li>
 * </ul>
 *
 * <p>Resolution is fail-fast and never rolls back entries already stored. The files whose
 * imports are being resolved are tracked along the active path, so an import cycle fails
 * with {@link ImportException.Kind#CYCLIC_IMPORT} instead of recursing forever.</p>
 */
public class ImportResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ImportResolver.class);

    private final SourceLoader sourceLoader;
    private final DefinitionMerger merger;
    private final ImportSettings settings;
    private final Supplier<Path> searchRoot;
    private final Set<Path> resolving = new LinkedHashSet<>();

    /**
     * Creates a resolver that searches the current working directory and merges wildcard
     * imports with a {@link ScopedDefinitionMerger}.
     *
     * @param parser   The parser for imported files.
     * @param settings The filesystem conventions.
     */
    public ImportResolver(ProgramParser parser, ImportSettings settings) {
        this(new SourceLoader(parser, settings.sourceExtension()),
                new ScopedDefinitionMerger(settings.scopeSeparator()),
                settings,
                ImportResolver::currentDirectory);
    }

    /**
     * @param sourceLoader The loader that parses package entries.
     * @param merger       The merger used for wildcard imports.
     * @param settings     The filesystem conventions.
     * @param searchRoot   Supplies the root directory that top-level imports are resolved against.
     */
    public ImportResolver(SourceLoader sourceLoader, DefinitionMerger merger, ImportSettings settings,
                          Supplier<Path> searchRoot) {
        this.sourceLoader = sourceLoader;
        this.merger = merger;
        this.settings = settings;
        this.searchRoot = searchRoot;
    }

    /**
     * Resolves a top-level import declaration against the search root.
     *
     * @param scope   The name of the importing program.
     * @param imports The import declaration.
     * @param context The context to install imported declarations into.
     * @throws ImportException If any part of the import fails.
     */
    public void enforceImport(String scope, ImportStatement imports, ProgramContext context) throws ImportException {
        enforcePackage(scope, searchRoot.get(), imports.packageRef(), context);
    }

    /**
     * Finds a package below {@code path} and applies its access.
     *
     * @param scope      The name of the importing program.
     * @param path       The package root to search.
     * @param packageRef The package and its access.
     * @param context    The context to install imported declarations into.
     * @throws ImportException If the package cannot be found or its access fails.
     */
    public void enforcePackage(String scope, Path path, PackageRef packageRef, ProgramContext context)
            throws ImportException {
        Identifier packageName = packageRef.name();
        LOG.debug("Resolving package '{}' under '{}' for scope '{}'", packageName.name(), path, scope);

        Path sourceDirectory = path.resolve(settings.sourceDirectory());
        Optional<Path> matchedSource = findEntry(sourceDirectory, packageName.span(),
                entry -> sourceLoader.programName(entry.getFileName().toString()).equals(packageName.name()));

        Optional<Path> matchedImport = Optional.empty();
        if (settings.searchImportsDirectory()) {
            Path importsDirectory = path.resolve(settings.importsDirectory());
            if (Files.isDirectory(importsDirectory)) {
                matchedImport = findEntry(importsDirectory, packageName.span(),
                        entry -> entry.getFileName().toString().equals(packageName.name()));
            }
        }

        if (matchedSource.isPresent() && matchedImport.isPresent()) {
            throw ImportException.conflictingPackage(packageName, matchedSource.get(), matchedImport.get());
        }

        Optional<Path> matched = matchedSource.isPresent() ? matchedSource : matchedImport;
        if (matched.isEmpty()) {
            throw ImportException.unknownPackage(packageName);
        }
        enforcePackageAccess(scope, matched.get(), packageRef.access(), context);
    }

    /**
     * Applies a package access to a matched package entry.
     *
     * @param scope   The name of the importing program.
     * @param entry   The matched package entry.
     * @param access  The access to apply.
     * @param context The context to install imported declarations into.
     * @throws ImportException If the access fails.
     */
    public void enforcePackageAccess(String scope, Path entry, PackageAccess access, ProgramContext context)
            throws ImportException {
        if (access instanceof PackageAccess.Star star) {
            enforceImportStar(scope, entry, star.span(), context);
        } else if (access instanceof PackageAccess.SymbolAccess symbolAccess) {
            enforceImportSymbol(scope, entry, symbolAccess.symbol(), context);
        } else if (access instanceof PackageAccess.SubPackage subPackage) {
            enforcePackage(scope, entry, subPackage.packageRef(), context);
        } else if (access instanceof PackageAccess.Multiple multiple) {
            for (PackageAccess nested : multiple.accesses()) {
                enforcePackageAccess(scope, entry, nested, context);
            }
        }
    }

    private void enforceImportStar(String scope, Path entry, Span span, ProgramContext context)
            throws ImportException {
        Path file = enter(entry, span);
        try {
            // Same namespace as the importing program.
            Program program = sourceLoader.parseImportFile(entry, span).withName(scope);
            merger.mergeAll(program, this, context);
        } finally {
            resolving.remove(file);
        }
    }

    private void enforceImportSymbol(String scope, Path entry, ImportSymbol symbol, ProgramContext context)
            throws ImportException {
        Path file = enter(entry, symbol.span());
        try {
            Program program = sourceLoader.parseImportFile(entry, symbol.span());
            String programName = program.name();

            DefinedValue value = findSymbol(program, symbol.symbol().name())
                    .orElseThrow(() -> ImportException.unknownSymbol(symbol, programName, entry));

            String resolvedName = QualifiedNames.newScope(programName, symbol.localName(), settings.scopeSeparator());
            context.store(resolvedName, value, programName);
            context.bindLocalName(scope, symbol.localName(), resolvedName);
            LOG.debug("Imported '{}' from '{}' as '{}' into scope '{}'",
                    symbol.symbol().name(), programName, resolvedName, scope);

            for (ImportStatement nested : program.imports()) {
                enforceImport(programName, nested, context);
            }
        } finally {
            resolving.remove(file);
        }
    }

    private static Optional<DefinedValue> findSymbol(Program program, String name) {
        Circuit circuit = program.circuits().get(name);
        if (circuit != null) {
            return Optional.of(new DefinedValue.CircuitDefinition(circuit));
        }
        Function function = program.functions().get(name);
        if (function != null) {
            return Optional.of(DefinedValue.FunctionDefinition.unbound(function));
        }
        return Optional.empty();
    }

    /**
     * Marks a file as being resolved on the active path.
     * @return The key the file was registered under.
     */
    private Path enter(Path entry, Span span) throws ImportException {
        Path file;
        try {
            file = entry.toRealPath();
        } catch (IOException e) {
            throw ImportException.directoryError(e, entry, span);
        }
        if (resolving.contains(file)) {
            LOG.debug("Import cycle through '{}'", file);
            throw ImportException.cyclicImport(new ArrayList<>(resolving), file, span);
        }
        resolving.add(file);
        return file;
    }

    private static Optional<Path> findEntry(Path directory, Span span, Predicate<Path> matcher)
            throws ImportException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                if (matcher.test(entry)) {
                    return Optional.of(entry);
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw ImportException.directoryError(e, directory, span);
        } catch (DirectoryIteratorException e) {
            throw ImportException.directoryError(e.getCause(), directory, span);
        }
    }

    private static Path currentDirectory() {
        return Path.of("").toAbsolutePath();
    }
}
