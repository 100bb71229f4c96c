package com.pongnet.gameserver.game;

/**
 * The match state broke one of its invariants. Fatal to the current session.
 */
public class SimulationFaultException extends IllegalStateException {
    public SimulationFaultException(String message) {
        super(message);
    }
}
