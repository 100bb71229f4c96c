package com.pongnet.gameserver.net;

import java.io.IOException;

public class ConnectionLostException extends IOException {
    public ConnectionLostException(String message) {
        super(message);
    }
}
