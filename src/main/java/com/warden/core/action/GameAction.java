package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interacts with a running game window.
 */
public record GameAction(String game, String action) implements AgentAction {

    public GameAction {
        AgentAction.requireText(game, "game");
        AgentAction.requireText(action, "action");
    }

    @Override
    public ActionKind kind() {
        return ActionKind.GAME_INTERACTION;
    }

    @Override
    public String name() {
        return "game_action";
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("game", game);
        details.put("action", action);
        return details;
    }
}
