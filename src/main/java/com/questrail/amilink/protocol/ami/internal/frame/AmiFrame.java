package com.questrail.amilink.protocol.ami.internal.frame;

import java.util.List;
import java.util.Objects;

/**
 * AmiFrame
 * -----------------------------------------------------------------------------
 * Unit produced by the frame reader from the inbound line stream.
 *
 * <p>A connection starts with a single banner line (for example
 * {@code Asterisk Call Manager/5.0.1}) that is not a block. Everything after it
 * is a sequence of blocks: non-empty lines up to, and excluding, the first
 * empty line.</p>
 *
 * <p>Frames are uninterpreted. Splitting lines into keys and values is the
 * classifier's job.</p>
 */
public sealed interface AmiFrame permits AmiFrame.Greeting, AmiFrame.Block
{
    /** The one-line banner sent by the switch when the connection opens. */
    record Greeting(String banner) implements AmiFrame {
        public Greeting {
            Objects.requireNonNull(banner, "banner");
        }
    }

    /** One blank-line-terminated group of lines. Never empty. */
    record Block(List<String> lines) implements AmiFrame {
        public Block {
            lines = List.copyOf(lines);
            if (lines.isEmpty()) {
                throw new IllegalArgumentException("block must contain at least one line");
            }
        }
    }
}
