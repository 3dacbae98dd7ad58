package com.aura.edge.monitor;

import com.sun.jna.platform.win32.Kernel32;
import com.sun.jna.platform.win32.User32;
import com.sun.jna.platform.win32.WinDef.HWND;
import com.sun.jna.platform.win32.WinDef.RECT;
import com.sun.jna.platform.win32.WinNT.HANDLE;
import com.sun.jna.platform.win32.WinUser;
import com.sun.jna.ptr.IntByReference;

/**
 * Reads the foreground window through User32: the owning process's executable name,
 * and whether the window rectangle covers the primary screen.
 */
public class WindowsForegroundProbe implements ForegroundWindowProbe {

    private static final int PROCESS_QUERY_LIMITED_INFORMATION = 0x1000;
    private static final int MAX_PATH = 1024;

    // taskbar and border slack
    static final int WIDTH_TOLERANCE = 10;
    static final int HEIGHT_TOLERANCE = 50;

    @Override
    public ForegroundWindow probe() {
        HWND hwnd = User32.INSTANCE.GetForegroundWindow();
        if (hwnd == null) {
            return ForegroundWindow.UNKNOWN;
        }
        return new ForegroundWindow(processName(hwnd), isFullscreen(hwnd));
    }

    private static String processName(HWND hwnd) {
        IntByReference pid = new IntByReference();
        User32.INSTANCE.GetWindowThreadProcessId(hwnd, pid);
        if (pid.getValue() == 0) {
            return "";
        }
        HANDLE process = Kernel32.INSTANCE.OpenProcess(PROCESS_QUERY_LIMITED_INFORMATION, false, pid.getValue());
        if (process == null) {
            return "";
        }
        try {
            char[] path = new char[MAX_PATH];
            IntByReference length = new IntByReference(path.length);
            if (!Kernel32.INSTANCE.QueryFullProcessImageName(process, 0, path, length)) {
                return "";
            }
            return baseName(new String(path, 0, length.getValue()));
        } finally {
            Kernel32.INSTANCE.CloseHandle(process);
        }
    }

    private static boolean isFullscreen(HWND hwnd) {
        RECT rect = new RECT();
        if (!User32.INSTANCE.GetWindowRect(hwnd, rect)) {
            return false;
        }
        return coversScreen(rect.right - rect.left, rect.bottom - rect.top,
            User32.INSTANCE.GetSystemMetrics(WinUser.SM_CXSCREEN),
            User32.INSTANCE.GetSystemMetrics(WinUser.SM_CYSCREEN));
    }

    static boolean coversScreen(int windowWidth, int windowHeight, int screenWidth, int screenHeight) {
        if (screenWidth <= 0 || screenHeight <= 0) {
            return false;
        }
        return windowWidth >= screenWidth - WIDTH_TOLERANCE
            && windowHeight >= screenHeight - HEIGHT_TOLERANCE;
    }

    /** {@code C:\Program Files\VLC\vlc.exe} -> {@code vlc.exe} */
    static String baseName(String imagePath) {
        int slash = Math.max(imagePath.lastIndexOf('\\'), imagePath.lastIndexOf('/'));
        return imagePath.substring(slash + 1).trim();
    }
}
