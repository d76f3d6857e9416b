package com.questrail.amilink.protocol.ami.codec.impl;

import com.questrail.amilink.protocol.ami.codec.AmiFrameReader;
import com.questrail.amilink.protocol.ami.internal.frame.AmiFrame;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DefaultAmiFrameReader
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AmiFrameReader}.
 *
 * <p>For every line, in order:</p>
 * <ol>
 *   <li>A trailing CR is removed.</li>
 *   <li>The first line of a connection that has no {@code :} is the banner.</li>
 *   <li>A non-empty line is appended to the current block.</li>
 *   <li>An empty line closes the current block, if it has any lines.
 *       Runs of empty lines produce no empty blocks.</li>
 * </ol>
 *
 * <p>A block left open when the stream ends is never delivered; {@link #reset()}
 * throws it away.</p>
 *
 * <p><strong>Not thread-safe.</strong> One instance per connection, fed from
 * that connection's inbound thread.</p>
 */
public final class DefaultAmiFrameReader implements AmiFrameReader
{
    private final List<String> current = new ArrayList<>();

    private boolean awaitingGreeting = true;
    private boolean skippingDamagedBlock;
    private int skippedLines;

    @Override
    public Optional<AmiFrame> onLine(String raw)
    {
        final String line = AmiLines.stripCr(raw);

        if (awaitingGreeting) {
            awaitingGreeting = false;
            // Switches that skip the banner go straight to a block.
            if (!line.isEmpty() && !AmiLines.isHeaderLine(line)) {
                return Optional.of(new AmiFrame.Greeting(line.strip()));
            }
        }

        if (line.isEmpty()) {
            if (skippingDamagedBlock) {
                skippingDamagedBlock = false;
                skippedLines = 0;
                return Optional.empty();
            }
            if (current.isEmpty()) {
                return Optional.empty();
            }
            AmiFrame.Block block = new AmiFrame.Block(current);
            current.clear();
            return Optional.of(block);
        }

        if (skippingDamagedBlock) {
            skippedLines++;
            return Optional.empty();
        }

        current.add(line);
        return Optional.empty();
    }

    @Override
    public int discardPartialBlock()
    {
        awaitingGreeting = false;
        skippedLines += current.size();
        current.clear();
        skippingDamagedBlock = true;
        return skippedLines;
    }

    @Override
    public int reset()
    {
        int discarded = current.size();
        current.clear();
        awaitingGreeting = true;
        skippingDamagedBlock = false;
        skippedLines = 0;
        return discarded;
    }
}
