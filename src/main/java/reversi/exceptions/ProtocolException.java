package reversi.exceptions;

import java.io.IOException;

/** The referee broke the handshake. */
public final class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }
}
