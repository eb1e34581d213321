package org.schachregeln.settings;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.schachregeln.codec.FenCodec;
import org.schachregeln.model.NotationFormatException;
import org.schachregeln.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class SettingsManager {
    private static final Logger logger = LoggerFactory.getLogger(SettingsManager.class);
    private static SettingsManager instance;

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Path settingsPath;
    private AppSettings settings;

    private SettingsManager() {
        this(Paths.get(System.getProperty("user.home"), ".schachregeln", "settings.json"));
    }

    SettingsManager(Path settingsPath) {
        this.settingsPath = settingsPath;
        load();
    }

    public static synchronized SettingsManager getInstance() {
        if (instance == null) {
            instance = new SettingsManager();
        }
        return instance;
    }

    public AppSettings getSettings() {
        return settings;
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    public void load() {
        if (Files.notExists(settingsPath)) {
            logger.info("No settings at {}, writing defaults", settingsPath);
            settings = new AppSettings();
            save();
            return;
        }
        settings = read();
        fillMissingSections();
        checkStartPosition();
    }

    public void save() {
        try {
            Path parent = settingsPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(settingsPath, gson.toJson(settings));
            logger.debug("Settings written to {}", settingsPath);
        } catch (IOException e) {
            logger.error("Could not write settings to {}", settingsPath, e);
        }
    }

    private AppSettings read() {
        try {
            AppSettings loaded = gson.fromJson(Files.readString(settingsPath), AppSettings.class);
            if (loaded == null) {
                logger.warn("Settings file {} is empty, using defaults", settingsPath);
                return new AppSettings();
            }
            logger.info("Settings loaded from {}", settingsPath);
            return loaded;
        } catch (IOException | JsonParseException e) {
            logger.error("Could not read settings from {}, using defaults", settingsPath, e);
            return new AppSettings();
        }
    }

    private void fillMissingSections() {
        if (settings.getDisplay() == null) {
            settings.setDisplay(new DisplaySettings());
        }
        if (settings.getGame() == null) {
            settings.setGame(new GameSettings());
        }
        if (settings.getOpponent() == null) {
            settings.setOpponent(new OpponentSettings());
        }
    }

    private void checkStartPosition() {
        GameSettings game = settings.getGame();
        try {
            FenCodec.decode(game.getStartFen());
        } catch (NotationFormatException e) {
            logger.warn("Ignoring invalid start position in settings: {}", e.getMessage());
            game.setStartFen(Position.INITIAL_FEN);
        }
    }
}
