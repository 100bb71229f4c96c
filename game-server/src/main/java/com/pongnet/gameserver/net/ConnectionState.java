package com.pongnet.gameserver.net;

public enum ConnectionState {
    CONNECTED,
    AUTHENTICATING,
    PLAYING,
    GAME_OVER_WAIT,
    READY,
    DISCONNECTED
}
