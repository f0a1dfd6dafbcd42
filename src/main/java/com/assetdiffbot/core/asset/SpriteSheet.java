package com.assetdiffbot.core.asset;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A decoded sprite sheet. Implementations are supplied by the codec and may carry the
 * image data the matching {@link SpriteRenderer} needs.
 */
public interface SpriteSheet {

    int width();

    int height();

    /** All states in declaration order, duplicates included. */
    List<SpriteState> states();

    /** Distinct state names in declaration order. */
    default Set<String> stateNames() {
        var names = new LinkedHashSet<String>();
        for (SpriteState state : states()) {
            names.add(state.name());
        }
        return names;
    }

    /** First state with the given name. */
    default Optional<SpriteState> state(String name) {
        return states().stream().filter(s -> s.name().equals(name)).findFirst();
    }
}
