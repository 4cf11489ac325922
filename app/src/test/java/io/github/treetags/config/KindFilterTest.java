package io.github.treetags.config;

import static org.junit.jupiter.api.Assertions.*;

import io.github.treetags.profile.Kind;
import io.github.treetags.profile.KindTable;
import io.github.treetags.profile.TagRole;
import java.util.Set;
import org.junit.jupiter.api.Test;

class KindFilterTest {

    private static final KindTable TABLE = KindTable.builder()
            .add("definition.struct", new Kind("s", "struct", TagRole.TYPE))
            .add("definition.function", new Kind("f", "func", TagRole.CALLABLE))
            .add("definition.member", new Kind("m", "member", TagRole.MEMBER))
            .add("definition.prototype", new Kind("p", "prototype", false, TagRole.MEMBER, null))
            .build();

    @Test
    void defaultsSkipKindsDisabledByDefault() {
        assertEquals(Set.of("s", "f", "m"), KindFilter.defaults(TABLE).enabledCodes());
        assertEquals(Set.of("s", "f", "m"), KindFilter.parse("", TABLE).enabledCodes());
    }

    @Test
    void overrideEnablesExactlyTheListedKinds() {
        assertEquals(Set.of("f", "s", "m"), KindFilter.parse("fsm", TABLE).enabledCodes());
        assertEquals(Set.of("f", "s"), KindFilter.parse("f,struct", TABLE).enabledCodes());
        assertEquals(Set.of("p"), KindFilter.parse("p", TABLE).enabledCodes());
    }

    @Test
    void modifiersStartFromDefaults() {
        assertEquals(Set.of("s", "f", "p"), KindFilter.parse("+p-m", TABLE).enabledCodes());
        assertEquals(Set.of("f", "m"), KindFilter.parse("-s", TABLE).enabledCodes());
        assertEquals(Set.of("f", "m", "p"), KindFilter.parse("+prototype, -struct", TABLE).enabledCodes());
    }

    @Test
    void starEnablesEverything() {
        var filter = KindFilter.parse("*", TABLE);
        assertTrue(filter.isEnabled(TABLE.byCode("p").orElseThrow()));
        assertEquals(4, filter.enabledCodes().size());
    }

    @Test
    void unknownKindsAreIgnored() {
        assertEquals(Set.of("f"), KindFilter.parse("fx", TABLE).enabledCodes());
        assertEquals(Set.of("s", "f", "m"), KindFilter.parse("+x", TABLE).enabledCodes());
    }
}
