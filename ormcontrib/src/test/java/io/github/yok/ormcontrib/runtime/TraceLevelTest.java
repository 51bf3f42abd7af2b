package io.github.yok.ormcontrib.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class TraceLevelTest {

    @Test
    void fromValue_正常ケース_範囲内の値を指定する_対応するレベルが返ること() {
        assertEquals(TraceLevel.OFF, TraceLevel.fromValue(0));
        assertEquals(TraceLevel.ERROR, TraceLevel.fromValue(1));
        assertEquals(TraceLevel.WARNING, TraceLevel.fromValue(2));
        assertEquals(TraceLevel.INFO, TraceLevel.fromValue(3));
        assertEquals(TraceLevel.VERBOSE, TraceLevel.fromValue(4));
    }

    @Test
    void fromValue_正常ケース_範囲外の値を指定する_端のレベルに丸められること() {
        assertEquals(TraceLevel.OFF, TraceLevel.fromValue(-5));
        assertEquals(TraceLevel.VERBOSE, TraceLevel.fromValue(99));
    }

    @Test
    void admits_正常ケース_スイッチ以下のレベルのみ許可されること() {
        assertTrue(TraceLevel.WARNING.admits(TraceLevel.ERROR));
        assertTrue(TraceLevel.WARNING.admits(TraceLevel.WARNING));
        assertFalse(TraceLevel.WARNING.admits(TraceLevel.INFO));
        assertFalse(TraceLevel.VERBOSE.admits(TraceLevel.OFF));
        assertEquals(3, TraceLevel.INFO.getValue());
    }
}
