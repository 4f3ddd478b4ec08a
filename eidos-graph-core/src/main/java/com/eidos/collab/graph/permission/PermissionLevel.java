package com.eidos.collab.graph.permission;

import java.util.EnumSet;
import java.util.Set;

/**
 * Level granted to a user on one ontology. Each level includes the previous ones.
 */
public enum PermissionLevel {
    VIEW(EnumSet.of(Action.VIEW)),
    VIEW_AND_ADD(EnumSet.of(Action.VIEW, Action.ADD)),
    VIEW_ADD_EDIT(EnumSet.of(Action.VIEW, Action.ADD, Action.EDIT)),
    FULL_ACCESS(EnumSet.allOf(Action.class));

    private final Set<Action> actions;

    PermissionLevel(Set<Action> actions) {
        this.actions = actions;
    }

    public boolean allows(Action action) {
        return actions.contains(action);
    }
}
