package com.crossbridge.generator.codegen.render;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.crossbridge.generator.model.Doc;
import com.crossbridge.generator.model.EnumDef;
import com.crossbridge.generator.model.Ident;
import com.crossbridge.generator.model.InterfaceDef;
import com.crossbridge.generator.model.RecordDef;
import com.crossbridge.generator.model.TypeParam;

/**
 * Backend double that records each hook call as {@code kind:name[<params>]}.
 */
public class RecordingGenerator implements DeclarationGenerator {

    private final String prefix;
    private final List<String> calls;

    public RecordingGenerator() {
        this("", new ArrayList<>());
    }

    /**
     * @param prefix prepended to every recorded call, to tell backends apart in a shared log
     */
    public RecordingGenerator(String prefix, List<String> calls) {
        this.prefix = prefix;
        this.calls = calls;
    }

    public List<String> getCalls() {
        return calls;
    }

    @Override
    public void generateEnum(String origin, Ident ident, Doc doc, EnumDef enumDef) {
        calls.add(prefix + "enum:" + ident.getName());
    }

    @Override
    public void generateRecord(String origin, Ident ident, Doc doc, List<TypeParam> params, RecordDef recordDef) {
        calls.add(prefix + "record:" + ident.getName() + typeParams(params));
    }

    @Override
    public void generateInterface(String origin, Ident ident, Doc doc, List<TypeParam> params, InterfaceDef interfaceDef) {
        calls.add(prefix + "interface:" + ident.getName() + typeParams(params));
    }

    private static String typeParams(List<TypeParam> params) {
        if (params.isEmpty()) {
            return "";
        }
        return params.stream().map(p -> p.getIdent().getName()).collect(Collectors.joining(",", "<", ">"));
    }
}
