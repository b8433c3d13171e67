package com.jobJumper.careerAi.normalization.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A model-supplied label matched against a small closed enumeration.
 *
 * Known literals map to their constant; anything else maps to the enumeration's
 * {@code OTHER} constant. The original (trimmed) text is always kept in {@code label}
 * so renderers can still show what the model said.
 *
 * @param <E> Enumeration type; must declare an {@code OTHER} constant
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SoftLabel<E extends Enum<E>> {

    static final String OTHER = "OTHER";

    private E value;

    private String label;

    /**
     * Matches raw text against the constants of the given enumeration, ignoring case
     * and surrounding whitespace.
     *
     * @param raw Raw label text, may be null
     * @param type Enumeration type declaring an OTHER constant
     * @return Matched label, or OTHER carrying the raw text ("" when raw is null)
     */
    public static <E extends Enum<E>> SoftLabel<E> parse(String raw, Class<E> type) {
        String trimmed = raw != null ? raw.trim() : "";
        String key = trimmed.replace(' ', '_').replace('-', '_');
        for (E constant : type.getEnumConstants()) {
            if (!OTHER.equals(constant.name()) && constant.name().equalsIgnoreCase(key)) {
                return new SoftLabel<>(constant, trimmed);
            }
        }
        return new SoftLabel<>(Enum.valueOf(type, OTHER), trimmed);
    }

    /**
     * @return Default label: OTHER with empty text
     */
    public static <E extends Enum<E>> SoftLabel<E> absent(Class<E> type) {
        return parse(null, type);
    }

    @JsonIgnore
    public boolean isOther() {
        return value != null && OTHER.equals(value.name());
    }
}
