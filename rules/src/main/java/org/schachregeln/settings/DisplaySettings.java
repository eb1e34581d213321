package org.schachregeln.settings;

import lombok.Data;

@Data
public class DisplaySettings {
    private boolean unicodePieces = true;
    private boolean showCoordinates = true;
}
