package in.kiteticker.infrastructure.feed.codec;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.Arrays;

/**
 * Bounds-checked big-endian reader over a slice of a binary frame.
 *
 * Offsets are relative to the start of the slice. Every read checks that the
 * field lies inside the slice and fails with {@link MalformedFrameException}
 * otherwise, so a bad length prefix can never read into a neighbouring packet.
 */
public final class FieldReader {

    private final byte[] bytes;
    private final int start;
    private final int length;
    private final ByteBuffer buffer;

    public FieldReader(byte[] bytes) {
        this(bytes, 0, bytes.length);
    }

    public FieldReader(byte[] bytes, int start, int length) {
        if (start < 0 || length < 0 || start > bytes.length - length) {
            throw new MalformedFrameException(bytes.length,
                String.format("slice [%d, %d) is outside the frame", start, start + length));
        }
        this.bytes = bytes;
        this.start = start;
        this.length = length;
        this.buffer = ByteBuffer.wrap(bytes, start, length).slice().order(ByteOrder.BIG_ENDIAN);
    }

    public int length() {
        return length;
    }

    public int int32(int offset) {
        require(offset, Integer.BYTES);
        return buffer.getInt(offset);
    }

    public long uint32(int offset) {
        return Integer.toUnsignedLong(int32(offset));
    }

    public short int16(int offset) {
        require(offset, Short.BYTES);
        return buffer.getShort(offset);
    }

    public int uint16(int offset) {
        return Short.toUnsignedInt(int16(offset));
    }

    /**
     * Signed int32 price field scaled down by {@code 10^scale}.
     */
    public BigDecimal price(int offset, int scale) {
        return BigDecimal.valueOf(int32(offset), scale);
    }

    /**
     * Unsigned int32 field holding epoch seconds.
     */
    public Instant epochSeconds(int offset) {
        return Instant.ofEpochSecond(uint32(offset));
    }

    public FieldReader slice(int offset, int sliceLength) {
        require(offset, sliceLength);
        return new FieldReader(bytes, start + offset, sliceLength);
    }

    public byte[] copy(int offset, int copyLength) {
        require(offset, copyLength);
        return Arrays.copyOfRange(bytes, start + offset, start + offset + copyLength);
    }

    private void require(int offset, int size) {
        if (offset < 0 || size < 0 || offset > length - size) {
            throw new MalformedFrameException(length,
                String.format("field [%d, %d) runs past the end", offset, offset + size));
        }
    }
}
