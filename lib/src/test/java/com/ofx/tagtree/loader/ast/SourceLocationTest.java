package com.ofx.tagtree.loader.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SourceLocationTest {

    @Test
    void firstBodyLineIsShiftedByTheOriginColumn() {
        SourceLocation origin = new SourceLocation("f.ofx", 2, 39);

        assertEquals(new SourceLocation("f.ofx", 2, 39), origin.translate(1, 1));
        assertEquals(new SourceLocation("f.ofx", 2, 43), origin.translate(1, 5));
    }

    @Test
    void laterBodyLinesKeepTheirColumn() {
        SourceLocation origin = new SourceLocation("f.ofx", 11, 1);

        assertEquals(new SourceLocation("f.ofx", 13, 1), origin.translate(3, 1));
        assertEquals(new SourceLocation("f.ofx", 2, 7), new SourceLocation("f.ofx", 1, 30).translate(2, 7));
    }

    @Test
    void startOfIsTheIdentityOrigin() {
        SourceLocation origin = SourceLocation.startOf("inline");

        assertEquals(new SourceLocation("inline", 4, 9), origin.translate(4, 9));
        assertEquals("inline:1:1", origin.toString());
    }

    @Test
    void positionsAreOneBased() {
        assertThrows(IllegalArgumentException.class, () -> new SourceLocation("f.ofx", 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new SourceLocation("f.ofx", 1, 0));
    }
}
