package com.questrail.amilink.protocol.ami.codec.impl;

import com.questrail.amilink.protocol.ami.internal.decode.AmiDecodeException;
import com.questrail.amilink.protocol.ami.model.AmiHeader;

/**
 * AmiLines
 * -----------------------------------------------------------------------------
 * Line-level rules of the manager protocol.
 *
 * <ul>
 *   <li>Lines end in CR LF. A bare LF is tolerated inbound.</li>
 *   <li>A header line is {@code Key: Value}; the first colon separates.</li>
 *   <li>An empty line terminates a message.</li>
 * </ul>
 */
final class AmiLines
{
    static final String CRLF = "\r\n";

    static final char SEPARATOR = ':';

    private AmiLines() {}

    /**
     * Removes a trailing CR left behind by a LF-only line splitter.
     */
    static String stripCr(String line)
    {
        int len = line.length();
        if (len > 0 && line.charAt(len - 1) == '\r') {
            return line.substring(0, len - 1);
        }
        return line;
    }

    static boolean isHeaderLine(String line)
    {
        return line.indexOf(SEPARATOR) > 0;
    }

    /**
     * Splits {@code Key: Value}. Whitespace around both parts is dropped; the
     * value may itself contain colons.
     */
    static AmiHeader splitHeader(String line)
    {
        int idx = line.indexOf(SEPARATOR);
        if (idx < 0) {
            throw new AmiDecodeException("Header line has no ':' separator: " + abbreviate(line));
        }
        String key = line.substring(0, idx).strip();
        if (key.isEmpty()) {
            throw new AmiDecodeException("Header line has an empty key: " + abbreviate(line));
        }
        return new AmiHeader(key, line.substring(idx + 1).strip());
    }

    /**
     * Rejects text that would end a line or a message early on the wire.
     */
    static String requireSingleLine(String what, String text)
    {
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException(what + " must not contain CR or LF");
        }
        return text;
    }

    static String abbreviate(String line)
    {
        return line.length() <= 80 ? line : line.substring(0, 77) + "...";
    }
}
