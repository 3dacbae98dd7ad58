package com.aura.shared.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * A host command as it arrives on the wire: a {@code cmd} tag plus the optional
 * arguments used by that command. Fields a command does not use stay {@code null}.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Command {
    private String cmd;

    private Integer minutes;
    private Integer amountMl;

    private String key;
    private String value;

    private Long id;
    private String time;
    private String action;
    private List<String> days;
    private String title;
    private Boolean enabled;

    private String path;

    public Optional<CommandType> type() {
        return CommandType.fromWire(cmd);
    }

    public static Command of(CommandType type) {
        return Command.builder().cmd(type.wireName()).build();
    }
}
