package com.crossbridge.generator.model;

/**
 * Kind-specific body of a {@link TypeDecl}.
 *
 * The set of kinds is closed: {@link EnumDef}, {@link RecordDef} and {@link InterfaceDef}.
 * Adding a kind means adding a method to {@link TypeDeclVisitor} and to every backend.
 */
public interface TypeDeclBody {

    void accept(TypeDeclVisitor visitor);
}
