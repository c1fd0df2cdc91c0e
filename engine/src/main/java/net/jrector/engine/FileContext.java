package net.jrector.engine;

import net.jrector.api.Logger;
import net.jrector.api.Node;
import net.jrector.api.NodeKey;
import net.jrector.api.RuleContext;
import net.jrector.api.ScopeResolver;
import net.jrector.api.doc.DocTypeRenamer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The per-file state of a run. Created fresh for every processed file and never shared between threads.
 */
public final class FileContext implements RuleContext {
    private final Path file;
    private final SourceScopeResolver resolver;
    private final DocTypeRenamer docTypeRenamer = new DocTypeRenamer();
    private final Logger logger;
    private final Map<String, Object> state = new HashMap<>();
    private final List<String> warnings = new ArrayList<>();

    public FileContext(Path file, ClassTable classTable, Logger logger) {
        this.file = file;
        this.resolver = new SourceScopeResolver(classTable);
        this.logger = logger;
    }

    @Override
    public Path file() {
        return file;
    }

    @Override
    public ScopeResolver resolver() {
        return resolver;
    }

    @Override
    public DocTypeRenamer docTypeRenamer() {
        return docTypeRenamer;
    }

    @Override
    public Logger logger() {
        return logger;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T state(NodeKey<T> key, Supplier<T> factory) {
        return (T) state.computeIfAbsent(key.name(), k -> factory.get());
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    void setRoot(Node root) {
        resolver.setRoot(root);
    }
}
