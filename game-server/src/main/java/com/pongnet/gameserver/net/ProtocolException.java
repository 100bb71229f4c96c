package com.pongnet.gameserver.net;

/**
 * A peer sent a line the protocol does not allow in its current state.
 */
public class ProtocolException extends RuntimeException {
    public ProtocolException(String message) {
        super(message);
    }
}
