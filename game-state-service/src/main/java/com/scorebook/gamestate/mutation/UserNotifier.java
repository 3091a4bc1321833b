package com.scorebook.gamestate.mutation;

/**
 * Where user-facing mutation outcomes go (toast, banner, log).
 * Implementations must not block.
 */
public interface UserNotifier {

    void success(String message);

    void error(String message);
}
