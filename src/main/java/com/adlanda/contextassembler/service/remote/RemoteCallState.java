package com.adlanda.contextassembler.service.remote;

/**
 * Lifecycle of one logical remote call.
 *
 * READY → CALLING → SUCCEEDED | RETRYING | FAILED, and RETRYING → CALLING after the backoff.
 */
public enum RemoteCallState {
    READY,
    CALLING,
    RETRYING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    boolean canMoveTo(RemoteCallState next) {
        return switch (this) {
            case READY, RETRYING -> next == CALLING;
            case CALLING -> next == SUCCEEDED || next == RETRYING || next == FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }
}
