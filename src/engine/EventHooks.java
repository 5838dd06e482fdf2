package engine;

import render.Window;
import render.WindowEvents;

/**
 * The seven optional window-event hooks. {@link #install} puts a forwarding shim on every
 * event kind; a shim whose hook is absent does nothing.
 */
final class EventHooks {
    WindowEvents.Resize resize;
    WindowEvents.Move move;
    WindowEvents.Close close;
    WindowEvents.Key key;
    WindowEvents.MouseButton mouseButton;
    WindowEvents.CursorMove cursorMove;
    WindowEvents.Scroll scroll;

    void install(Window window) {
        window.onResize((w, h) -> { if (resize != null) resize.onResize(w, h); });
        window.onMove((x, y) -> { if (move != null) move.onMove(x, y); });
        window.onClose(() -> { if (close != null) close.onClose(); });
        window.onKey((k, scancode, action, mods) -> { if (key != null) key.onKey(k, scancode, action, mods); });
        window.onMouseButton((button, action, mods) -> { if (mouseButton != null) mouseButton.onMouseButton(button, action, mods); });
        window.onCursorMove((x, y) -> { if (cursorMove != null) cursorMove.onCursorMove(x, y); });
        window.onScroll((dx, dy) -> { if (scroll != null) scroll.onScroll(dx, dy); });
    }

    int count() {
        int n = 0;
        for (Object h : new Object[] { resize, move, close, key, mouseButton, cursorMove, scroll }) {
            if (h != null) n++;
        }
        return n;
    }
}
