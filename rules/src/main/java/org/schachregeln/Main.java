package org.schachregeln;

import org.schachregeln.console.ConsoleGame;
import org.schachregeln.opponent.OpponentController;
import org.schachregeln.settings.AppSettings;
import org.schachregeln.settings.SettingsManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws IOException {
        logger.info("Schachregeln console starting...");
        SettingsManager settingsManager = SettingsManager.getInstance();
        logger.info("Using settings from {}", settingsManager.getSettingsPath());
        AppSettings settings = settingsManager.getSettings();
        OpponentController opponent = new OpponentController();
        try {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new ConsoleGame(settings, opponent, in, System.out).run();
        } finally {
            opponent.shutdown();
        }
    }
}
