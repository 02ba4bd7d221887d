package com.crossbridge.generator.codegen.render;

import java.util.List;

import com.crossbridge.generator.model.EnumDef;
import com.crossbridge.generator.model.InterfaceDef;
import com.crossbridge.generator.model.RecordDef;
import com.crossbridge.generator.model.TypeDecl;
import com.crossbridge.generator.model.TypeDeclVisitor;

import lombok.experimental.UtilityClass;

/**
 * Feeds a declaration sequence to a backend.
 */
@UtilityClass
public class DeclarationDispatcher {

    /**
     * Calls exactly one hook of {@code generator} per declaration, in order, skipping
     * declarations that come from imported modules.
     *
     * @return number of declarations dispatched
     */
    public static int generate(List<TypeDecl> idl, DeclarationGenerator generator) {
        int dispatched = 0;
        for (TypeDecl decl : idl) {
            if (decl.isImported()) {
                continue;
            }
            decl.getBody().accept(new TypeDeclVisitor() {
                @Override
                public void visit(EnumDef enumDef) {
                    if (!decl.getParams().isEmpty()) {
                        throw new IllegalStateException(
                                "Enum " + decl.getIdent().getName() + " from " + decl.getOrigin() + " has type parameters");
                    }
                    generator.generateEnum(decl.getOrigin(), decl.getIdent(), decl.getDoc(), enumDef);
                }

                @Override
                public void visit(RecordDef recordDef) {
                    generator.generateRecord(decl.getOrigin(), decl.getIdent(), decl.getDoc(), decl.getParams(), recordDef);
                }

                @Override
                public void visit(InterfaceDef interfaceDef) {
                    generator.generateInterface(decl.getOrigin(), decl.getIdent(), decl.getDoc(), decl.getParams(), interfaceDef);
                }
            });
            dispatched++;
        }
        return dispatched;
    }
}
