package net.jrector.api;

import net.jrector.api.doc.DocTypeRenamer;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Everything a rule may consult while a single file is processed.
 */
public interface RuleContext {
    /**
     * Path of the processed file, relative to the source root.
     */
    Path file();

    ScopeResolver resolver();

    DocTypeRenamer docTypeRenamer();

    Logger logger();

    /**
     * Scratch state that lives as long as the current file is processed, created on first access.
     */
    <T> T state(NodeKey<T> key, Supplier<T> factory);
}
