package com.github.salilvnair.chatflow.engine.transition;

/**
 * Adds the rules of one area (menus, GST, ITR) to the transition table.
 */
public interface TransitionTableContributor {

    void contribute(TransitionTable.Builder table);
}
