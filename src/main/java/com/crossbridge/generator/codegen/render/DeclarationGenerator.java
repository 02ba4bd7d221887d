package com.crossbridge.generator.codegen.render;

import java.util.List;

import com.crossbridge.generator.model.Doc;
import com.crossbridge.generator.model.EnumDef;
import com.crossbridge.generator.model.Ident;
import com.crossbridge.generator.model.InterfaceDef;
import com.crossbridge.generator.model.RecordDef;
import com.crossbridge.generator.model.TypeParam;

/**
 * The capability set every backend provides: one hook per declaration kind. A backend with
 * nothing to emit for a kind implements the hook as a no-op.
 *
 * Hooks are invoked by {@link DeclarationDispatcher}, once per locally defined declaration.
 */
public interface DeclarationGenerator {

    void generateEnum(String origin, Ident ident, Doc doc, EnumDef enumDef);

    void generateRecord(String origin, Ident ident, Doc doc, List<TypeParam> params, RecordDef recordDef);

    void generateInterface(String origin, Ident ident, Doc doc, List<TypeParam> params, InterfaceDef interfaceDef);
}
