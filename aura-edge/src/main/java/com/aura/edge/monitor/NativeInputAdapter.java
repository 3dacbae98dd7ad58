package com.aura.edge.monitor;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.github.kwhat.jnativehook.mouse.NativeMouseEvent;
import com.github.kwhat.jnativehook.mouse.NativeMouseInputListener;
import com.github.kwhat.jnativehook.mouse.NativeMouseWheelEvent;
import com.github.kwhat.jnativehook.mouse.NativeMouseWheelListener;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Installs an OS-wide keyboard and mouse hook and forwards events to the sampler.
 * Runs on the hook's own dispatch thread; only the sampler's queue is touched here.
 */
@Slf4j
public class NativeInputAdapter implements NativeKeyListener, NativeMouseInputListener, NativeMouseWheelListener {

    private final MetricsSampler sampler;
    private final Clock clock;
    private boolean registered;

    public NativeInputAdapter(MetricsSampler sampler, Clock clock) {
        this.sampler = sampler;
        this.clock = clock;
    }

    /**
     * @return {@code false} when the platform refused the hook (no display, missing
     *         accessibility permission); the engine keeps running without input data
     */
    public boolean start() {
        Logger.getLogger(GlobalScreen.class.getPackage().getName()).setLevel(Level.WARNING);
        try {
            GlobalScreen.registerNativeHook();
        } catch (NativeHookException | UnsatisfiedLinkError e) {
            log.warn("Native input hook unavailable, activity will read as idle: {}", e.getMessage());
            return false;
        }
        GlobalScreen.addNativeKeyListener(this);
        GlobalScreen.addNativeMouseListener(this);
        GlobalScreen.addNativeMouseMotionListener(this);
        GlobalScreen.addNativeMouseWheelListener(this);
        registered = true;
        log.info("Native input hook registered");
        return true;
    }

    public void stop() {
        if (!registered) {
            return;
        }
        GlobalScreen.removeNativeKeyListener(this);
        GlobalScreen.removeNativeMouseListener(this);
        GlobalScreen.removeNativeMouseMotionListener(this);
        GlobalScreen.removeNativeMouseWheelListener(this);
        try {
            GlobalScreen.unregisterNativeHook();
        } catch (NativeHookException e) {
            log.warn("Failed to unregister native input hook: {}", e.getMessage());
        }
        registered = false;
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent event) {
        sampler.submit(InputEvent.keyPress(clock.instant()));
    }

    @Override
    public void nativeMouseMoved(NativeMouseEvent event) {
        sampler.submit(InputEvent.mouseMove(clock.instant(), event.getX(), event.getY()));
    }

    @Override
    public void nativeMouseDragged(NativeMouseEvent event) {
        sampler.submit(InputEvent.mouseMove(clock.instant(), event.getX(), event.getY()));
    }

    @Override
    public void nativeMousePressed(NativeMouseEvent event) {
        sampler.submit(InputEvent.click(clock.instant()));
    }

    @Override
    public void nativeMouseWheelMoved(NativeMouseWheelEvent event) {
        sampler.submit(InputEvent.scroll(clock.instant()));
    }
}
