package io.github.treetags.normalize;

import com.google.common.collect.ImmutableMap;
import io.github.treetags.config.ExtrasConfig;
import io.github.treetags.config.FieldsConfig;
import io.github.treetags.profile.AddressMode;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Run-wide settings of the normalizer.
 *
 * @param kindSpecs raw {@code --kinds} values keyed by language name
 * @param addressOverride address mode forced on every profile, null to let each profile decide
 */
public record NormalizeOptions(
        FieldsConfig fields,
        ExtrasConfig extras,
        ImmutableMap<String, String> kindSpecs,
        @Nullable AddressMode addressOverride) {

    public NormalizeOptions(
            FieldsConfig fields, ExtrasConfig extras, Map<String, String> kindSpecs, @Nullable AddressMode override) {
        this(fields, extras, ImmutableMap.copyOf(kindSpecs), override);
    }

    public static NormalizeOptions defaults() {
        return new NormalizeOptions(FieldsConfig.defaults(), ExtrasConfig.none(), ImmutableMap.of(), null);
    }
}
