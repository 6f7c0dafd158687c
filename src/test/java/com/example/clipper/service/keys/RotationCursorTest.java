package com.example.clipper.service.keys;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RotationCursorTest {

    @Test
    void wrapsAroundAfterLastSlot() {
        RotationCursor cursor = new RotationCursor();

        assertEquals(0, cursor.next(3));
        assertEquals(1, cursor.next(3));
        assertEquals(2, cursor.next(3));
        assertEquals(0, cursor.next(3));
        assertEquals(1, cursor.peek());
    }

    @Test
    void singleSlotAlwaysReturnsZero() {
        RotationCursor cursor = new RotationCursor();

        for (int i = 0; i < 5; i++) {
            assertEquals(0, cursor.next(1));
        }
    }

    @Test
    void staysInRangeWhenSizeShrinks() {
        RotationCursor cursor = new RotationCursor();
        cursor.next(5);
        cursor.next(5);
        cursor.next(5);

        assertEquals(1, cursor.next(2));
        assertEquals(0, cursor.next(2));
    }

    @Test
    void rejectsEmptyPool() {
        assertThrows(IllegalArgumentException.class, () -> new RotationCursor().next(0));
    }
}
