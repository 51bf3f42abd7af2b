package io.github.yok.ormcontrib.runtime.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class TraceListenerCollectionTest {

    private final TraceListenerCollection listeners = new TraceListenerCollection();

    @Test
    void writeLine_正常ケース_追加順に全リスナーへ書き込まれること() {
        TraceListener first = mock(TraceListener.class);
        TraceListener second = mock(TraceListener.class);
        listeners.add(first);
        listeners.add(second);

        listeners.writeLine("message");

        InOrder order = inOrder(first, second);
        order.verify(first).writeLine("message");
        order.verify(second).writeLine("message");
    }

    @Test
    void clear_正常ケース_全リスナーが削除されること() {
        listeners.add(mock(TraceListener.class));
        listeners.clear();

        assertTrue(listeners.isEmpty());
        assertEquals(0, listeners.size());
    }

    @Test
    void getListeners_正常ケース_変更できないスナップショットが返ること() {
        TraceListener listener = mock(TraceListener.class);
        listeners.add(listener);

        List<TraceListener> snapshot = listeners.getListeners();

        assertEquals(List.of(listener), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(listener));
    }

    @Test
    void add_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> listeners.add(null));
    }
}
