package org.sasslite.symbols;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Constant Table Tests")
class ConstantTableTest {

    @Test
    @DisplayName("A fresh table knows the important constant")
    void testDefaults() {
        ConstantTable table = ConstantTable.withDefaults();

        assertEquals(Optional.of("!important"), table.lookup("important"));
        assertEquals(1, table.size());
        assertTrue(ConstantTable.empty().names().isEmpty());
    }

    @Test
    @DisplayName("set overwrites while setIfAbsent keeps the first value")
    void testAssignment() {
        ConstantTable table = ConstantTable.empty();

        table.set("width", "10px");
        table.set("width", "20px");
        table.setIfAbsent("width", "30px");
        table.setIfAbsent("color", "red");

        assertEquals(Optional.of("20px"), table.lookup("width"));
        assertEquals(Optional.of("red"), table.lookup("color"));
        assertFalse(table.isDefined("height"));
        assertEquals(Optional.empty(), table.lookup("height"));
    }

    @Test
    @DisplayName("Copies are independent and putAll overwrites")
    void testCopyAndPutAll() {
        ConstantTable original = ConstantTable.withDefaults();
        original.set("a", "1");

        ConstantTable copy = original.copy();
        copy.set("a", "2");
        copy.set("b", "3");

        assertEquals(Optional.of("1"), original.lookup("a"));
        assertFalse(original.isDefined("b"));

        original.putAll(copy);
        assertEquals(Optional.of("2"), original.lookup("a"));
        assertEquals(Optional.of("3"), original.lookup("b"));
    }

    @Test
    @DisplayName("Names are a snapshot that cannot change the table")
    void testNamesSnapshot() {
        ConstantTable table = ConstantTable.empty();
        table.set("a", "1");

        Set<String> names = table.names();
        table.set("b", "2");

        assertEquals(Set.of("a"), names);
        assertThrows(UnsupportedOperationException.class, () -> names.remove("a"));
        assertTrue(table.isDefined("a"));
    }
}
