package engine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import render.Action;
import render.Window;
import render.WindowEvents;

final class EventHooksTest {

    @Test
    void installs_a_shim_for_every_event_kind() {
        Window window = mock(Window.class);
        new EventHooks().install(window);

        verify(window).onResize(any());
        verify(window).onMove(any());
        verify(window).onClose(any());
        verify(window).onKey(any());
        verify(window).onMouseButton(any());
        verify(window).onCursorMove(any());
        verify(window).onScroll(any());
        verifyNoMoreInteractions(window);
    }

    @Test
    void shims_without_hooks_do_nothing() {
        Window window = mock(Window.class);
        EventHooks hooks = new EventHooks();
        ArgumentCaptor<WindowEvents.Key> key = ArgumentCaptor.forClass(WindowEvents.Key.class);
        ArgumentCaptor<WindowEvents.Close> close = ArgumentCaptor.forClass(WindowEvents.Close.class);
        ArgumentCaptor<WindowEvents.Scroll> scroll = ArgumentCaptor.forClass(WindowEvents.Scroll.class);

        hooks.install(window);
        verify(window).onKey(key.capture());
        verify(window).onClose(close.capture());
        verify(window).onScroll(scroll.capture());

        assertEquals(0, hooks.count());
        assertDoesNotThrow(() -> key.getValue().onKey(65, 30, Action.PRESS, 0));
        assertDoesNotThrow(() -> close.getValue().onClose());
        assertDoesNotThrow(() -> scroll.getValue().onScroll(0, 1));
    }

    @Test
    void shims_forward_backend_arguments_to_the_hooks() {
        Window window = mock(Window.class);
        EventHooks hooks = new EventHooks();
        List<String> seen = new ArrayList<>();
        hooks.resize = (w, h) -> seen.add("resize " + w + "x" + h);
        hooks.move = (x, y) -> seen.add("move " + x + "," + y);
        hooks.mouseButton = (b, a, m) -> seen.add("button " + b + " " + a + " " + m);
        hooks.cursorMove = (x, y) -> seen.add("cursor " + x + "," + y);

        ArgumentCaptor<WindowEvents.Resize> resize = ArgumentCaptor.forClass(WindowEvents.Resize.class);
        ArgumentCaptor<WindowEvents.Move> move = ArgumentCaptor.forClass(WindowEvents.Move.class);
        ArgumentCaptor<WindowEvents.MouseButton> button = ArgumentCaptor.forClass(WindowEvents.MouseButton.class);
        ArgumentCaptor<WindowEvents.CursorMove> cursor = ArgumentCaptor.forClass(WindowEvents.CursorMove.class);
        hooks.install(window);
        verify(window).onResize(resize.capture());
        verify(window).onMove(move.capture());
        verify(window).onMouseButton(button.capture());
        verify(window).onCursorMove(cursor.capture());

        resize.getValue().onResize(1024, 768);
        move.getValue().onMove(10, 20);
        button.getValue().onMouseButton(1, Action.RELEASE, 2);
        cursor.getValue().onCursorMove(1.5, 2.5);

        assertEquals(List.of("resize 1024x768", "move 10,20", "button 1 RELEASE 2", "cursor 1.5,2.5"), seen);
        assertEquals(4, hooks.count());
    }
}
