////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspdaemon.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes and decodes {@code Content-Length} framed messages.
 *
 * <p>A frame is an ASCII header block terminated by {@code \r\n\r\n},
 * followed by exactly {@code Content-Length} bytes of UTF-8 payload. The
 * framer knows nothing about the payload. Header blocks without a usable
 * {@code Content-Length} are skipped up to their delimiter so that corrupt
 * input can never stall decoding.</p>
 *
 * <p>Instances are stateful ({@link #append(byte[], int, int)} keeps the
 * bytes of an unfinished frame) and not thread-safe; the static
 * {@link #encode(String)} and {@link #decode(byte[])} are pure.</p>
 */
public class MessageFramer {

    private static final Logger logger = LoggerFactory.getLogger(MessageFramer.class);

    private static final byte[] DELIMITER = {'\r', '\n', '\r', '\n'};
    private static final Pattern CONTENT_LENGTH = Pattern.compile("Content-Length:\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE);

    private static final int INITIAL_CAPACITY = 8192;

    // unconsumed bytes live in buffer[start, end)
    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int start;
    private int end;
    // where the delimiter search resumes, so old bytes are not rescanned
    private int scanFrom;
    // body position and length of a frame whose header is already parsed, or -1
    private int bodyStart = -1;
    private int bodyLength = -1;

    /** Messages extracted by {@link #decode(byte[])} plus the untouched tail. */
    public static final class Result {
        private final List<String> messages;
        private final byte[] remaining;

        Result(List<String> messages, byte[] remaining) {
            this.messages = Collections.unmodifiableList(messages);
            this.remaining = remaining;
        }

        public List<String> getMessages() {
            return messages;
        }

        public byte[] getRemaining() {
            return remaining;
        }
    }

    public static byte[] encode(String payload) {
        byte[] body = payload.getBytes(StandardCharsets.UTF_8);
        byte[] header = ("Content-Length: " + body.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] frame = Arrays.copyOf(header, header.length + body.length);
        System.arraycopy(body, 0, frame, header.length, body.length);
        return frame;
    }

    public static Result decode(byte[] buffer) {
        return decode(buffer, buffer.length);
    }

    static Result decode(byte[] buffer, int length) {
        List<String> messages = new ArrayList<>();
        int offset = 0;
        while (true) {
            int headerEnd = indexOf(buffer, DELIMITER, offset, length);
            if (headerEnd < 0) {
                break;
            }
            String header = new String(buffer, offset, headerEnd - offset, StandardCharsets.US_ASCII);
            int contentLength = parseContentLength(header);
            int bodyStart = headerEnd + DELIMITER.length;
            if (contentLength < 0) {
                logger.debug("Skipping malformed header block: {}", header);
                offset = bodyStart;
                continue;
            }
            if ((long) bodyStart + contentLength > length) {
                break;
            }
            messages.add(new String(buffer, bodyStart, contentLength, StandardCharsets.UTF_8));
            offset = bodyStart + contentLength;
        }
        return new Result(messages, Arrays.copyOfRange(buffer, offset, length));
    }

    /**
     * Adds freshly received bytes and returns every message that is now
     * complete. Bytes of a trailing partial frame are kept for the next call.
     */
    public List<String> append(byte[] chunk, int offset, int length) {
        ensureCapacity(length);
        System.arraycopy(chunk, offset, buffer, end, length);
        end += length;

        List<String> messages = new ArrayList<>();
        while (true) {
            if (bodyLength < 0) {
                int headerEnd = indexOf(buffer, DELIMITER, Math.max(start, scanFrom), end);
                if (headerEnd < 0) {
                    // the delimiter may straddle this chunk and the next
                    scanFrom = Math.max(start, end - DELIMITER.length + 1);
                    break;
                }
                String header = new String(buffer, start, headerEnd - start, StandardCharsets.US_ASCII);
                int contentLength = parseContentLength(header);
                if (contentLength < 0) {
                    logger.debug("Skipping malformed header block: {}", header);
                    start = headerEnd + DELIMITER.length;
                    scanFrom = start;
                    continue;
                }
                bodyStart = headerEnd + DELIMITER.length;
                bodyLength = contentLength;
            }
            if ((long) bodyStart + bodyLength > end) {
                break;
            }
            messages.add(new String(buffer, bodyStart, bodyLength, StandardCharsets.UTF_8));
            start = bodyStart + bodyLength;
            scanFrom = start;
            bodyStart = -1;
            bodyLength = -1;
        }
        if (start == end) {
            start = 0;
            end = 0;
            scanFrom = 0;
        }
        return messages;
    }

    /** Makes room for {@code extra} more bytes, compacting before growing. */
    private void ensureCapacity(int extra) {
        if (end + extra <= buffer.length) {
            return;
        }
        int used = end - start;
        if (start > 0) {
            System.arraycopy(buffer, start, buffer, 0, used);
            scanFrom -= start;
            if (bodyStart >= 0) {
                bodyStart -= start;
            }
            end = used;
            start = 0;
        }
        if (used + extra > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, used + extra));
        }
    }

    public List<String> append(byte[] chunk) {
        return append(chunk, 0, chunk.length);
    }

    /** Number of buffered bytes that do not yet form a complete frame. */
    public int pendingBytes() {
        return end - start;
    }

    private static int parseContentLength(String header) {
        Matcher matcher = CONTENT_LENGTH.matcher(header);
        if (!matcher.find()) {
            return -1;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static int indexOf(byte[] buffer, byte[] needle, int from, int length) {
        outer:
        for (int i = from; i <= length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (buffer[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
