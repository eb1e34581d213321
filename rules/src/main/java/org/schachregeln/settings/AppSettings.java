package org.schachregeln.settings;

import lombok.Data;

@Data
public class AppSettings {
    private DisplaySettings display = new DisplaySettings();
    private GameSettings game = new GameSettings();
    private OpponentSettings opponent = new OpponentSettings();
}
