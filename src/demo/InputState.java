package demo;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import render.Action;

/** Held keys, fed by the key hook on the control thread and read by the event loop. */
final class InputState {
    private final Set<Integer> down = ConcurrentHashMap.newKeySet();

    void onKey(int key, int scancode, Action action, int mods) {
        if (action == Action.RELEASE) down.remove(key);
        else down.add(key);
    }

    boolean isDown(int key) { return down.contains(key); }
}
