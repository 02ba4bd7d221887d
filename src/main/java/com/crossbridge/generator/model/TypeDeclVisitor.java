package com.crossbridge.generator.model;

/**
 * Visitor over the closed set of declaration bodies.
 */
public interface TypeDeclVisitor {
    void visit(EnumDef enumDef);
    void visit(RecordDef recordDef);
    void visit(InterfaceDef interfaceDef);
}
