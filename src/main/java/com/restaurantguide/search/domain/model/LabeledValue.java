package com.restaurantguide.search.domain.model;

import java.util.Optional;

/**
 * Closed enumeration whose members are addressed on the wire and in the
 * database by a fixed label.
 */
public interface LabeledValue {

    String getLabel();

    /**
     * Resolve a label against the members of an enumeration.
     *
     * @param type  enumeration class
     * @param label exact label, already trimmed
     * @return matching member, or empty when the label is not part of the set
     */
    static <E extends Enum<E> & LabeledValue> Optional<E> fromLabel(Class<E> type, String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (E value : type.getEnumConstants()) {
            if (value.getLabel().equals(label)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
