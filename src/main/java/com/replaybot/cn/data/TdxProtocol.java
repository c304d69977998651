package com.replaybot.cn.data;

import com.replaybot.cn.model.TickRecord;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * 通达信行情协议的报文编解码（小端序）。
 * 响应由 16 字节头部和正文组成，头部末尾两个 uint16 为压缩长度与原始长度，二者不同时正文经 zlib 压缩。
 */
final class TdxProtocol {
    static final int RESPONSE_HEADER_SIZE = 16;
    static final int MAX_OFFSET = 0xFFFF;

    static final byte[] SETUP_1 = hex("0c 02 18 93 00 01 03 00 03 00 0d 00 01");
    static final byte[] SETUP_2 = hex("0c 02 18 94 00 01 03 00 03 00 0d 00 02");
    static final byte[] SETUP_3 = hex("0c 03 18 99 00 01 20 00 20 00 db 0f d5 d0 c9 cc d6 a4 a8 af 00 00 00 8f c2 25 40 13 00 00 d5 00 c9 cc bd f0 d7 ea 00 00 00 02");

    private static final byte[] SECURITY_COUNT_PREFIX = hex("0c 0c 18 6c 00 01 08 00 08 00 4e 04");
    private static final byte[] SECURITY_COUNT_SUFFIX = hex("75 c7 33 01");
    private static final byte[] HISTORY_TRANSACTION_PREFIX = hex("0c 01 30 01 00 01 12 00 12 00 b5 0f");
    private static final int CODE_WIDTH = 6;

    private TdxProtocol() {
    }

    static byte[] securityCountRequest(int market) {
        ByteBuffer buf = ByteBuffer.allocate(SECURITY_COUNT_PREFIX.length + 2 + SECURITY_COUNT_SUFFIX.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        buf.put(SECURITY_COUNT_PREFIX);
        buf.putShort((short) market);
        buf.put(SECURITY_COUNT_SUFFIX);
        return buf.array();
    }

    static byte[] historyTransactionRequest(int market, String code, int offset, int count, int date) {
        if (offset < 0 || offset > MAX_OFFSET) {
            throw new IllegalArgumentException("offset out of protocol range: " + offset);
        }
        if (count <= 0 || count > MAX_OFFSET) {
            throw new IllegalArgumentException("count out of protocol range: " + count);
        }
        ByteBuffer buf = ByteBuffer.allocate(HISTORY_TRANSACTION_PREFIX.length + 4 + 2 + CODE_WIDTH + 2 + 2)
                .order(ByteOrder.LITTLE_ENDIAN);
        buf.put(HISTORY_TRANSACTION_PREFIX);
        buf.putInt(date);
        buf.putShort((short) market);
        buf.put(codeBytes(code));
        buf.putShort((short) offset);
        buf.putShort((short) count);
        return buf.array();
    }

    /**
     * Reads one framed response and returns the (inflated) body.
     */
    static byte[] readResponse(InputStream in) throws IOException {
        byte[] header = readFully(in, RESPONSE_HEADER_SIZE);
        ByteBuffer buf = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        buf.position(12);
        int zipSize = Short.toUnsignedInt(buf.getShort());
        int unzipSize = Short.toUnsignedInt(buf.getShort());
        byte[] body = readFully(in, zipSize);
        if (zipSize == unzipSize) {
            return body;
        }
        return inflate(body, unzipSize);
    }

    static int parseSecurityCount(byte[] body) {
        if (body == null || body.length < 2) {
            throw new IllegalStateException("security count response too short");
        }
        return Short.toUnsignedInt(ByteBuffer.wrap(body, 0, 2).order(ByteOrder.LITTLE_ENDIAN).getShort());
    }

    /**
     * Decodes a history-transaction body: uint16 count, 4 reserved bytes, then per tick
     * uint16 minutes-of-day followed by four variable-length ints (price delta, volume, side, reserved).
     * Prices are cumulative deltas in cents.
     */
    static List<TickRecord> parseHistoryTransactions(byte[] body) {
        Cursor cursor = new Cursor(body);
        int num = cursor.u16();
        if (num == 0) {
            return List.of();
        }
        cursor.skip(4);
        List<TickRecord> out = new ArrayList<>(num);
        long lastPrice = 0L;
        for (int i = 0; i < num; i++) {
            int minutes = cursor.u16();
            long priceDelta = cursor.varInt();
            long vol = cursor.varInt();
            long side = cursor.varInt();
            cursor.varInt();
            lastPrice += priceDelta;
            String time = String.format(Locale.ROOT, "%02d:%02d", minutes / 60, minutes % 60);
            out.add(new TickRecord(time, lastPrice / 100.0, vol, (int) side));
        }
        return out;
    }

    private static byte[] codeBytes(String code) {
        byte[] raw = (code == null ? "" : code.trim()).getBytes(StandardCharsets.US_ASCII);
        if (raw.length > CODE_WIDTH) {
            throw new IllegalArgumentException("security code longer than " + CODE_WIDTH + " chars: " + code);
        }
        byte[] out = new byte[CODE_WIDTH];
        System.arraycopy(raw, 0, out, 0, raw.length);
        return out;
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] data = in.readNBytes(length);
        if (data.length < length) {
            throw new EOFException("truncated response: expected " + length + " bytes, got " + data.length);
        }
        return data;
    }

    private static byte[] inflate(byte[] compressed, int expectedSize) throws IOException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            byte[] out = new byte[expectedSize];
            int total = 0;
            while (!inflater.finished() && total < expectedSize) {
                int n = inflater.inflate(out, total, expectedSize - total);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                total += n;
            }
            if (total != expectedSize) {
                throw new IOException("inflated " + total + " bytes, header announced " + expectedSize);
            }
            return out;
        } catch (DataFormatException e) {
            throw new IOException("corrupt compressed body: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    static byte[] hex(String text) {
        String compact = text.replace(" ", "");
        byte[] out = new byte[compact.length() / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) Integer.parseInt(compact.substring(i * 2, i * 2 + 2), 16);
        }
        return out;
    }

    private static final class Cursor {
        private final byte[] data;
        private int pos;

        private Cursor(byte[] data) {
            this.data = data == null ? new byte[0] : data;
        }

        private int next() {
            if (pos >= data.length) {
                throw new IllegalStateException("truncated tick payload at byte " + pos);
            }
            return data[pos++] & 0xff;
        }

        private int u16() {
            int lo = next();
            int hi = next();
            return lo | (hi << 8);
        }

        private void skip(int n) {
            if (pos + n > data.length) {
                throw new IllegalStateException("truncated tick payload at byte " + pos);
            }
            pos += n;
        }

        // 6 value bits + sign bit in the first byte, 7 value bits per continuation byte.
        private long varInt() {
            int b = next();
            long value = b & 0x3f;
            boolean negative = (b & 0x40) != 0;
            int shift = 6;
            while ((b & 0x80) != 0) {
                b = next();
                value += (long) (b & 0x7f) << shift;
                shift += 7;
            }
            return negative ? -value : value;
        }
    }
}
