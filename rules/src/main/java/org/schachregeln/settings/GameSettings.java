package org.schachregeln.settings;

import lombok.Data;
import org.schachregeln.model.Position;

@Data
public class GameSettings {

    /** Position a new game starts from. */
    private String startFen = Position.INITIAL_FEN;

    /** When set, a promotion typed without a piece letter becomes a queen. */
    private boolean autoQueen = true;
}
