package com.github.salilvnair.chatflow.engine.transition;

/**
 * @param token normalised form used for table lookup: the digits of a menu choice,
 *              {@code yes}/{@code no} for confirmations, lower-cased text otherwise,
 *              {@code null} for media
 * @param raw   the user's text, trimmed
 */
public record ClassifiedInput(InputKind kind, String token, String raw) {
}
