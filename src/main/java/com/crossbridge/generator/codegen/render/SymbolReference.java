package com.crossbridge.generator.codegen.render;

import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Something a generated header refers to: either a file to import, or a declaration to
 * forward-declare in some namespace. Closed to {@link ImportRef} and {@link DeclRef}.
 */
public abstract class SymbolReference {

    private SymbolReference() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {

        R visitImport(ImportRef ref);

        R visitDecl(DeclRef ref);
    }

    /**
     * @param arg include argument with its delimiters, e.g. {@code <string>} or {@code "foo.hpp"}
     */
    public static ImportRef include(String arg) {
        return new ImportRef(arg);
    }

    /**
     * Forward declaration placed in the namespace of the file that uses it.
     */
    public static DeclRef decl(String decl) {
        return new DeclRef(decl, null);
    }

    public static DeclRef decl(String decl, String namespace) {
        return new DeclRef(decl, namespace);
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class ImportRef extends SymbolReference {

        @NonNull
        String arg;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class DeclRef extends SymbolReference {

        @NonNull
        String decl;

        /**
         * {@code null} for the namespace of the referencing file; {@code ""} is the global one.
         */
        String namespace;

        public Optional<String> getNamespace() {
            return Optional.ofNullable(namespace);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDecl(this);
        }
    }
}
