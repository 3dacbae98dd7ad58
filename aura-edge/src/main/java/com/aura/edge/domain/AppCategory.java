package com.aura.edge.domain;

import java.util.Locale;
import java.util.Map;

/**
 * Coarse grouping of the foreground application, used as a training feature.
 */
public enum AppCategory {
    CODE("Code"),
    WEB("Web"),
    VIDEO("Video"),
    GAME("Game"),
    PRODUCTIVITY("Productivity"),
    COMMUNICATION("Communication"),
    OTHER("Other");

    private static final Map<String, AppCategory> PROCESSES = Map.ofEntries(
        Map.entry("code.exe", CODE),
        Map.entry("code", CODE),
        Map.entry("devenv.exe", CODE),
        Map.entry("pycharm64.exe", CODE),
        Map.entry("idea64.exe", CODE),
        Map.entry("idea", CODE),
        Map.entry("sublime_text.exe", CODE),
        Map.entry("notepad++.exe", CODE),
        Map.entry("cursor.exe", CODE),

        Map.entry("chrome.exe", WEB),
        Map.entry("google chrome", WEB),
        Map.entry("firefox.exe", WEB),
        Map.entry("firefox", WEB),
        Map.entry("msedge.exe", WEB),
        Map.entry("brave.exe", WEB),
        Map.entry("opera.exe", WEB),
        Map.entry("safari", WEB),

        Map.entry("vlc.exe", VIDEO),
        Map.entry("vlc", VIDEO),
        Map.entry("mpc-hc64.exe", VIDEO),
        Map.entry("potplayer.exe", VIDEO),
        Map.entry("wmplayer.exe", VIDEO),

        Map.entry("league of legends.exe", GAME),
        Map.entry("leagueclient.exe", GAME),
        Map.entry("valorant.exe", GAME),
        Map.entry("csgo.exe", GAME),
        Map.entry("cs2.exe", GAME),
        Map.entry("dota2.exe", GAME),
        Map.entry("minecraft.exe", GAME),
        Map.entry("steam.exe", GAME),

        Map.entry("winword.exe", PRODUCTIVITY),
        Map.entry("excel.exe", PRODUCTIVITY),
        Map.entry("powerpnt.exe", PRODUCTIVITY),
        Map.entry("notion.exe", PRODUCTIVITY),
        Map.entry("obsidian.exe", PRODUCTIVITY),

        Map.entry("discord.exe", COMMUNICATION),
        Map.entry("slack.exe", COMMUNICATION),
        Map.entry("slack", COMMUNICATION),
        Map.entry("teams.exe", COMMUNICATION),
        Map.entry("zoom.exe", COMMUNICATION),
        Map.entry("telegram.exe", COMMUNICATION)
    );

    private final String label;

    AppCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AppCategory categorize(String processName) {
        if (processName == null || processName.isBlank()) {
            return OTHER;
        }
        return PROCESSES.getOrDefault(processName.trim().toLowerCase(Locale.ROOT), OTHER);
    }

    public static AppCategory fromLabel(String label) {
        for (AppCategory category : values()) {
            if (category.label.equalsIgnoreCase(label)) {
                return category;
            }
        }
        return OTHER;
    }
}
