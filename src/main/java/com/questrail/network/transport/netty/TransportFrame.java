package com.questrail.network.transport.netty;

import com.questrail.network.api.Reliability;

import java.util.Objects;

/**
 * One decoded frame of the Netty TCP wire format.
 *
 * <pre>
 *   +------------+--------+-------------------------------------+
 *   | length (4) | type 1 | body                                |
 *   +------------+--------+-------------------------------------+
 *   RELIABLE / UNRELIABLE  body = UTF-8 message text
 *   PING / PONG            body = 8-byte token (sender's nanoTime)
 * </pre>
 *
 * The length prefix is handled by the pipeline's frame decoder and prepender;
 * {@link TransportFrameCodec} deals with the type byte and body.
 *
 * @param type    frame type
 * @param payload message text, empty for heartbeat frames
 * @param token   heartbeat token, {@code 0} for message frames
 */
record TransportFrame(FrameType type, String payload, long token) {

    /** Length prefix plus type byte. */
    static final int HEADER_LENGTH = 5;

    TransportFrame {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
    }

    static TransportFrame message(String payload, Reliability reliability) {
        FrameType type = reliability == Reliability.RELIABLE ? FrameType.RELIABLE : FrameType.UNRELIABLE;
        return new TransportFrame(type, payload, 0L);
    }

    static TransportFrame ping(long token) {
        return new TransportFrame(FrameType.PING, "", token);
    }

    static TransportFrame pong(long token) {
        return new TransportFrame(FrameType.PONG, "", token);
    }

    boolean isMessage() {
        return type == FrameType.RELIABLE || type == FrameType.UNRELIABLE;
    }

    enum FrameType {
        RELIABLE(1),
        UNRELIABLE(2),
        PING(3),
        PONG(4);

        private final int code;

        FrameType(int code) {
            this.code = code;
        }

        int code() {
            return code;
        }

        /**
         * @return the type for {@code code}, or {@code null} if unknown
         */
        static FrameType fromCode(int code) {
            for (FrameType t : values()) {
                if (t.code == code) {
                    return t;
                }
            }
            return null;
        }
    }
}
