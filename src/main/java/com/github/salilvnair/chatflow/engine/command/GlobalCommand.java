package com.github.salilvnair.chatflow.engine.command;

import java.util.Optional;
import java.util.Set;

/**
 * Reserved tokens recognised in every state. {@code keywordAliases} are word forms
 * that only apply outside free-input states, where typed text is not data.
 */
public enum GlobalCommand {

    HOME(Set.of("0"), Set.of("menu", "main menu")),
    BACK(Set.of("9"), Set.of("back")),
    NIL_FILING(Set.of("nil"), Set.of()),
    HELP(Set.of("help", "?"), Set.of()),
    RESTART(Set.of("restart"), Set.of()),
    TALK_TO_CA(Set.of("ca", "talk to ca"), Set.of());

    private final Set<String> tokens;
    private final Set<String> keywordAliases;

    GlobalCommand(Set<String> tokens, Set<String> keywordAliases) {
        this.tokens = tokens;
        this.keywordAliases = keywordAliases;
    }

    public Set<String> tokens() {
        return tokens;
    }

    public Set<String> keywordAliases() {
        return keywordAliases;
    }

    public boolean mutatesSession() {
        return this != HELP;
    }

    static Optional<GlobalCommand> match(String normalized, boolean allowAliases) {
        for (GlobalCommand command : values()) {
            if (command.tokens.contains(normalized)) {
                return Optional.of(command);
            }
        }
        if (allowAliases) {
            for (GlobalCommand command : values()) {
                if (command.keywordAliases.contains(normalized)) {
                    return Optional.of(command);
                }
            }
        }
        return Optional.empty();
    }
}
