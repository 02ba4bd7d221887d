package com.crossbridge.generator.codegen.render;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.crossbridge.generator.codegen.config.GeneratorSpec;
import com.crossbridge.generator.codegen.ident.IdentConverter;
import com.crossbridge.generator.codegen.output.IndentWriter;
import com.crossbridge.generator.model.Doc;
import com.crossbridge.generator.model.EnumDef;
import com.crossbridge.generator.model.EnumOption;
import com.crossbridge.generator.model.Field;
import com.crossbridge.generator.model.Method;

/**
 * Rendering algorithms shared by all backends, so that every target wraps namespaces, lays out
 * enum values and formats doc comments the same way.
 */
public class CodeRenderer {

    public static final String NAMESPACE_SEPARATOR = "::";

    private final GeneratorSpec spec;

    public CodeRenderer(GeneratorSpec spec) {
        this.spec = spec;
    }

    // --------------------------------------------------------------------------
    // Namespaces

    /**
     * Runs {@code body} inside one C++ namespace block per {@code ::}-separated component. All
     * opening markers go on one line, all closing markers on one line tagged with the namespace.
     * An empty namespace runs {@code body} unwrapped.
     */
    public void wrapNamespace(IndentWriter w, String namespace, Consumer<IndentWriter> body) {
        if (namespace.isEmpty()) {
            body.accept(w);
            return;
        }
        String[] parts = namespace.split(Pattern.quote(NAMESPACE_SEPARATOR));
        w.wl(joinEach(parts, p -> "namespace " + p + " {")).wl();
        body.accept(w);
        w.wl();
        w.wl(joinEach(parts, p -> "}") + "  // namespace " + namespace);
    }

    public void wrapAnonymousNamespace(IndentWriter w, Consumer<IndentWriter> body) {
        w.wl("namespace { // anonymous namespace");
        w.wl();
        body.accept(w);
        w.wl();
        w.wl("} // end anonymous namespace");
    }

    /**
     * Qualifies {@code name} with a namespace: none leaves it alone, an empty one roots it
     * ({@code ::name}), otherwise {@code ::ns::name}.
     */
    public String withNs(Optional<String> namespace, String name) {
        if (namespace.isEmpty()) {
            return name;
        }
        if (namespace.get().isEmpty()) {
            return NAMESPACE_SEPARATOR + name;
        }
        return NAMESPACE_SEPARATOR + namespace.get() + NAMESPACE_SEPARATOR + name;
    }

    public String withCppNs(String name) {
        return withNs(Optional.of(spec.getCpp().getNamespace()), name);
    }

    // --------------------------------------------------------------------------
    // Calls

    /**
     * Writes {@code call} followed by the rendered params, one per line, continuation lines
     * indented to the column after {@code call}.
     */
    public <T> IndentWriter writeAlignedCall(IndentWriter w, String call, List<T> params,
                                             String delim, String end, Function<T, String> render) {
        w.w(call);
        SkipFirst skipFirst = new SkipFirst();
        String padding = " ".repeat(call.length());
        for (T param : params) {
            skipFirst.apply(() -> {
                w.wl(delim);
                w.w(padding);
            });
            w.w(render.apply(param));
        }
        return w.w(end);
    }

    public <T> IndentWriter writeAlignedCall(IndentWriter w, String call, List<T> params,
                                             String end, Function<T, String> render) {
        return writeAlignedCall(w, call, params, ",", end, render);
    }

    /**
     * Keyword-style variant: every {@code name:value} line is padded so the colons line up under
     * the colon following {@code call}.
     */
    public <T> IndentWriter writeAlignedObjcCall(IndentWriter w, String call, List<T> params,
                                                 String end, Function<T, KeywordArg> render) {
        w.w(call);
        SkipFirst skipFirst = new SkipFirst();
        for (T param : params) {
            KeywordArg arg = render.apply(param);
            skipFirst.apply(() -> {
                w.wl();
                w.w(" ".repeat(Math.max(0, call.length() - arg.getName().length())));
                w.w(arg.getName());
            });
            w.w(":" + arg.getValue());
        }
        return w.w(end);
    }

    // --------------------------------------------------------------------------
    // Enums

    public void writeEnumOptionNone(IndentWriter w, EnumDef e, IdentConverter ident) {
        EnumOptionLayout.noFlagsOption(e).ifPresent(o -> {
            writeDoc(w, o.getDoc());
            w.wl(ident.convert(o.getIdent().getName()) + " = 0,");
        });
    }

    public void writeEnumOptions(IndentWriter w, EnumDef e, IdentConverter ident) {
        int shift = 0;
        for (EnumOption o : EnumOptionLayout.ordinaryOptions(e)) {
            writeDoc(w, o.getDoc());
            w.wl(ident.convert(o.getIdent().getName()) + (e.isFlags() ? " = 1 << " + shift : "") + ",");
            shift++;
        }
    }

    public void writeEnumOptionAll(IndentWriter w, EnumDef e, IdentConverter ident) {
        EnumOptionLayout.allFlagsOption(e).ifPresent(o -> {
            writeDoc(w, o.getDoc());
            // ordinary options of a plain enum carry no bit, so AllFlags stays 0 there
            List<EnumOption> members = e.isFlags() ? EnumOptionLayout.ordinaryOptions(e) : List.of();
            String combined = members.stream()
                    .map(n -> ident.convert(n.getIdent().getName()))
                    .reduce("0", (acc, n) -> acc + " | " + n);
            w.wl(ident.convert(o.getIdent().getName()) + " = " + combined + ",");
        });
    }

    /**
     * NoFlags option, ordinary options, AllFlags option, in that order.
     */
    public void writeEnumOptionsInOrder(IndentWriter w, EnumDef e, IdentConverter ident) {
        writeEnumOptionNone(w, e, ident);
        writeEnumOptions(w, e, ident);
        writeEnumOptionAll(w, e, ident);
    }

    // --------------------------------------------------------------------------
    // Doc comments

    public void writeDoc(IndentWriter w, Doc doc) {
        List<String> lines = doc.getLines();
        switch (lines.size()) {
            case 0:
                break;
            case 1:
                w.wl("/**" + lines.get(0) + " */");
                break;
            default:
                w.wl("/**");
                lines.forEach(l -> w.wl(" *" + l));
                w.wl(" */");
        }
    }

    /**
     * Writes the method's doc with every whole-word mention of a parameter renamed to
     * {@code ident} of it, so the prose matches the generated signature.
     */
    public void writeMethodDoc(IndentWriter w, Method method, IdentConverter ident) {
        writeDoc(w, renameParams(method.getDoc(), method.getParams(), ident));
    }

    Doc renameParams(Doc doc, List<Field> params, IdentConverter ident) {
        List<String> lines = doc.getLines().stream()
                .map(line -> {
                    String renamed = line;
                    for (Field param : params) {
                        String name = param.getIdent().getName();
                        renamed = Pattern.compile("\\b" + Pattern.quote(name) + "\\b")
                                .matcher(renamed)
                                .replaceAll(Matcher.quoteReplacement(ident.convert(name)));
                    }
                    return renamed;
                })
                .toList();
        return doc.toBuilder().lines(lines).build();
    }

    private static String joinEach(String[] parts, Function<String, String> render) {
        return Arrays.stream(parts).map(render).collect(Collectors.joining(" "));
    }
}
