package com.loh.domain.enums;

import com.loh.exception.ValidationException;
import java.util.Locale;

public enum PlayerType {
    PLAYER,
    AI;

    /**
     * Parses the wire value ({@code "player"} or {@code "ai"}), case-insensitively.
     *
     * @throws ValidationException for anything else
     */
    public static PlayerType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return PLAYER;
        }
        try {
            return PlayerType.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid player type: " + code + ". Must be 'player' or 'ai'");
        }
    }
}
