package work.canopy.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValuesTest {
    @Test
    void freezeProducesDeepUnmodifiableSnapshot() {
        var nested = new ArrayList<Object>(List.of(1, 2));
        var source = new LinkedHashMap<String, Object>();
        source.put("distances", nested);
        source.put("missing", null);

        var frozen = Values.freezeMap(source);
        nested.add(3);

        assertEquals(List.of(1, 2), frozen.get("distances"));
        assertNull(frozen.get("missing"));
        assertThrows(UnsupportedOperationException.class, () -> frozen.put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> Values.asList(frozen.get("distances")).clear());
    }

    @Test
    void copyKeepsInsertionOrder() {
        var source = new LinkedHashMap<String, Object>();
        source.put("z", 1);
        source.put("a", Map.of("k", "v"));
        assertEquals(List.of("z", "a"), List.copyOf(Values.copyMap(source).keySet()));
    }

    @Test
    void numbersTakeTheFormJacksonReadsBack() {
        assertEquals(7, Values.number(7L));
        assertEquals(7, Values.number((byte) 7));
        assertEquals(5_000_000_000L, Values.number(5_000_000_000L));
        assertEquals(new BigInteger("18446744073709551616"), Values.number(new BigInteger("18446744073709551616")));
        assertEquals(3_000_000_000L, Values.number(BigInteger.valueOf(3_000_000_000L)));
        assertEquals(0.1, Values.number(0.1f));
        assertEquals(2.5, Values.number(new BigDecimal("2.5")));
        assertEquals(Map.of("n", 3, "xs", List.of(1.5)), Values.copy(Map.of("n", 3L, "xs", List.of(1.5f))));
    }

    @Test
    void rejectsValuesOutsideTheUniverse() {
        assertThrows(IllegalArgumentException.class, () -> Values.copy(new Object()));
    }
}
