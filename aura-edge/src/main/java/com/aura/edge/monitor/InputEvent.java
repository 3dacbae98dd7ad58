package com.aura.edge.monitor;

import java.time.Instant;

public record InputEvent(Kind kind, Instant timestamp, int x, int y) {

    public enum Kind {
        MOUSE_MOVE,
        KEY_PRESS,
        CLICK,
        SCROLL
    }

    public static InputEvent mouseMove(Instant at, int x, int y) {
        return new InputEvent(Kind.MOUSE_MOVE, at, x, y);
    }

    public static InputEvent keyPress(Instant at) {
        return new InputEvent(Kind.KEY_PRESS, at, 0, 0);
    }

    public static InputEvent click(Instant at) {
        return new InputEvent(Kind.CLICK, at, 0, 0);
    }

    public static InputEvent scroll(Instant at) {
        return new InputEvent(Kind.SCROLL, at, 0, 0);
    }
}
