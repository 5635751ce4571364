package in.kiteticker.infrastructure.feed.codec;

import in.kiteticker.infrastructure.feed.common.FeedException;

/**
 * Thrown when a binary frame cannot be split or read without running past its end.
 * The frame is dropped; the session is not affected.
 */
public class MalformedFrameException extends FeedException {

    private final int frameLength;

    public MalformedFrameException(int frameLength, String message) {
        super(String.format("Malformed frame (%d bytes): %s", frameLength, message));
        this.frameLength = frameLength;
    }

    public int getFrameLength() {
        return frameLength;
    }
}
