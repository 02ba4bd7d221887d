package com.crossbridge.generator.codegen.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.crossbridge.generator.model.EnumDef;
import com.crossbridge.generator.model.EnumOption;
import com.crossbridge.generator.model.SpecialFlag;

import lombok.experimental.UtilityClass;

/**
 * Emission order and values of enum options.
 *
 * Independent of where they appear in the IDL, options are emitted as: the NoFlags option
 * (value 0), the ordinary options in IDL order (value {@code 1 << k} in a flags enum, no value
 * otherwise), then the AllFlags option (the OR of all ordinary values, 0 if there are none).
 * In a plain enum ordinary options have no value, so an AllFlags option there is always 0;
 * {@link CodeRenderer#writeEnumOptionAll} renders it the same way.
 */
@UtilityClass
public class EnumOptionLayout {

    public static List<EnumOptionEntry> of(EnumDef e) {
        List<EnumOptionEntry> entries = new ArrayList<>();

        noFlagsOption(e).ifPresent(o -> entries.add(new EnumOptionEntry(o, -1, 0L)));

        long all = 0;
        List<EnumOption> ordinary = ordinaryOptions(e);
        for (int k = 0; k < ordinary.size(); k++) {
            Long value = e.isFlags() ? 1L << k : null;
            if (value != null) {
                all |= value;
            }
            entries.add(new EnumOptionEntry(ordinary.get(k), k, value));
        }

        long allFlags = all;
        allFlagsOption(e).ifPresent(o -> entries.add(new EnumOptionEntry(o, -1, allFlags)));
        return entries;
    }

    public static List<EnumOption> ordinaryOptions(EnumDef e) {
        return e.getOptions().stream().filter(EnumOption::isOrdinary).toList();
    }

    public static Optional<EnumOption> noFlagsOption(EnumDef e) {
        return find(e, SpecialFlag.NO_FLAGS);
    }

    public static Optional<EnumOption> allFlagsOption(EnumDef e) {
        return find(e, SpecialFlag.ALL_FLAGS);
    }

    private static Optional<EnumOption> find(EnumDef e, SpecialFlag flag) {
        return e.getOptions().stream().filter(o -> o.is(flag)).findFirst();
    }
}
