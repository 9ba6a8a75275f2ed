package com.pbxguard.value;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DictValueTest {

    @Test
    void equalityIgnoresOrder() {
        DictValue a = new DictValue().put("isa", "PBXGroup").put("name", "App");
        DictValue b = new DictValue().put("name", "App").put("isa", "PBXGroup");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new DictValue().put("isa", "PBXGroup"));
    }

    @Test
    void arraysKeepOrderInEquality() {
        ArrayValue a = ArrayValue.of(new StringValue("x"), new StringValue("y"));
        ArrayValue b = ArrayValue.of(new StringValue("y"), new StringValue("x"));
        assertNotEquals(a, b);
    }

    @Test
    void identsCompareOnIdOnly() {
        assertEquals(IdentValue.of("1A0000000000000000000001", "Project object"),
            IdentValue.of("1A0000000000000000000001"));
        assertNotEquals(IdentValue.of("1A0000000000000000000001"), new StringValue("1A0000000000000000000001"));
    }

    @Test
    void putReplacesInPlace() {
        DictValue dict = new DictValue().put("a", "1").put("b", "2");
        dict.put("a", "3");
        assertEquals(List.of("a", "b"), List.copyOf(dict.keys()));
        assertEquals("3", dict.getString("a"));
    }

    @Test
    void appendKeepsDuplicatesAndRemoveDropsThemAll() {
        DictValue dict = new DictValue();
        dict.append("k", null, new StringValue("1"), null);
        dict.append("k", null, new StringValue("2"), null);
        assertEquals(2, dict.size());
        assertEquals("1", dict.getString("k"));
        assertTrue(dict.remove("k"));
        assertTrue(dict.isEmpty());
    }

    @Test
    void replaceKeyKeepsPositionAndMetadata() {
        DictValue dict = new DictValue();
        dict.append("first", null, new StringValue("1"), null);
        DictValue.Entry second = dict.append("second", "note", new StringValue("2"), "PBXGroup");
        dict.append("third", null, new StringValue("3"), null);

        DictValue.Entry renamed = dict.replaceKey(second, "moved");

        assertEquals(List.of("first", "moved", "third"), List.copyOf(dict.keys()));
        assertEquals("note", renamed.getKeyComment());
        assertEquals("PBXGroup", renamed.getSection());
        assertThrows(IllegalArgumentException.class, () -> dict.replaceKey(second, "again"));
    }

    @Test
    void deepCopyIsIndependent() {
        DictValue original = new DictValue().put("list", ArrayValue.of(new StringValue("a")));
        DictValue copy = original.deepCopy();
        copy.get("list").asArray().add(new StringValue("b"));
        assertEquals(1, original.get("list").asArray().size());
    }

    @Test
    void scalarTextOnlyForScalars() {
        DictValue dict = new DictValue()
            .put("s", "text")
            .put("i", IdentValue.of("1A0000000000000000000001"))
            .put("d", new DictValue());
        assertEquals("text", dict.getString("s"));
        assertEquals("1A0000000000000000000001", dict.getString("i"));
        assertNull(dict.getString("d"));
        assertNull(dict.getString("absent"));
    }

    @Test
    void identifierShape() {
        assertTrue(Identifiers.isWellFormed("0123456789abcdefABCDEF01"));
        assertFalse(Identifiers.isWellFormed("0123456789ABCDEF0123456"));
        assertFalse(Identifiers.isWellFormed("0123456789ABCDEF0123456G"));
        assertFalse(Identifiers.isWellFormed(null));
    }
}
