package com.frenchtoast.alert.core.model;

import com.frenchtoast.alert.core.error.UnknownLevelException;

import java.util.Locale;
import java.util.Optional;

/**
 * =====================================================================
 * AlertLevel
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Static display metadata for every status code the upstream feed can
 * publish. Constants are declared in order of increasing severity, so
 * {@link #ordinal()} doubles as the severity rank.
 *
 * LOOKUP
 * ------
 * The enum constant name IS the status code. Lookup is an exact match,
 * case-insensitive; anything else is unknown and must never be committed
 * as the current status.
 *
 * Content taken from the Universal Hub French Toast alert table.
 */
public enum AlertLevel {

    LOW("1 Slice / Low",
            "#97FF9B",
            "https://www.universalhub.com/images/2007/frenchtoastgreen.jpg",
            "No storm predicted. Harvey Leonard sighs and looks dour on the evening news. "
                    + "Go about your daily business but consider buying second refrigerator for "
                    + "basement, diesel generator. Good time to replenish stocks of maple syrup, cinnamon."),

    GUARDED("2 Slices / Guarded",
            "#9799FF",
            "https://www.universalhub.com/images/2007/frenchtoastblue.jpg",
            "Light snow predicted. Subtle grin appears on Harvey Leonard's face. Check car fuel "
                    + "gauge, memorize quickest route to emergency supermarket should conditions change."),

    ELEVATED("3 Slices / Elevated",
            "#FFFF40",
            "https://www.universalhub.com/images/2007/frenchtoastyellow.jpg",
            "Moderate, plowable snow predicted. Harvey Leonard openly smiles during report. Empty "
                    + "your trunk to make room for milk, eggs and bread. Clear space in refrigerator "
                    + "and head to store for an extra gallon of milk, a spare dozen eggs and a new loaf of bread."),

    HIGH("4 Slices / High",
            "#FF821D",
            "https://www.universalhub.com/images/2007/frenchtoastorange.jpg",
            "Heavy snow predicted. Harvey Leonard breaks into huge grin, can't keep his hands off "
                    + "the weather map. Proceed at speed limit _before snow starts_ to nearest supermarket "
                    + "to pick up two gallons of milk, a couple dozen eggs and two loaves of bread - per "
                    + "person in household."),

    SEVERE("5 Slices / Severe",
            "#F85D58",
            "https://www.universalhub.com/images/2007/frenchtoastred.jpg",
            "Nor'easter predicted. This is it, people, THE BIG ONE. Harvey Leonard makes repeated "
                    + "references to the Blizzard of '78. RUSH to emergency supermarket NOW for multiple "
                    + "gallons of milk, cartons of eggs and loaves of bread. IGNORE cries of little old "
                    + "lady you've just trampled in mad rush to get last gallon of milk. Place pets in "
                    + "basement for use as emergency food supply if needed.");

    private final String title;
    private final String color;
    private final String imageUrl;
    private final String text;

    AlertLevel(String title, String color, String imageUrl, String text) {
        this.title = title;
        this.color = color;
        this.imageUrl = imageUrl;
        this.text = text;
    }

    public String code() { return name(); }
    public String title() { return title; }
    public String color() { return color; }
    public String imageUrl() { return imageUrl; }
    public String text() { return text; }

    /**
     * Resolves a status code to its level.
     *
     * @param code raw status code, any case; surrounding whitespace is ignored
     * @return the level, or empty for null, blank or unknown codes
     */
    public static Optional<AlertLevel> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (AlertLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Same as {@link #fromCode(String)} but fails for unknown codes.
     *
     * @throws UnknownLevelException when the code is not one of the five levels
     */
    public static AlertLevel require(String code) {
        return fromCode(code).orElseThrow(() -> new UnknownLevelException(code));
    }
}
