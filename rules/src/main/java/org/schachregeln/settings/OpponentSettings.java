package org.schachregeln.settings;

import lombok.Data;

@Data
public class OpponentSettings {

    private boolean enabled = false;

    private String playAs = "Black";

    private Long seed;

    public OpponentSettings copy() {
        OpponentSettings copy = new OpponentSettings();
        copy.setEnabled(enabled);
        copy.setPlayAs(playAs);
        copy.setSeed(seed);
        return copy;
    }
}
