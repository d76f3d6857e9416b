package com.questrail.amilink.protocol.ami.codec.impl;

import com.questrail.amilink.protocol.ami.codec.AmiMessageClassifier;
import com.questrail.amilink.protocol.ami.internal.decode.AmiDecodeException;
import com.questrail.amilink.protocol.ami.internal.frame.AmiFrame;
import com.questrail.amilink.protocol.ami.model.AmiHeader;
import com.questrail.amilink.protocol.ami.model.AmiMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * DefaultAmiMessageClassifier
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AmiMessageClassifier}.
 *
 * <p>Every line must be a {@code Key: Value} header, with one exception: a
 * block whose first line is {@code Response: Follows} is the reply to a
 * {@code Command} action, and its colon-less lines (the command's console
 * output and the {@code --END COMMAND--} marker) are kept as output lines.</p>
 */
public final class DefaultAmiMessageClassifier implements AmiMessageClassifier
{
    private static final String FOLLOWS = "Follows";

    @Override
    public AmiMessage classify(AmiFrame.Block block)
    {
        final List<String> lines = block.lines();
        final boolean commandOutput = isFollowsResponse(lines.get(0));

        final List<AmiHeader> headers = new ArrayList<>(lines.size());
        final List<String> output = new ArrayList<>();

        for (String line : lines) {
            if (commandOutput && !AmiLines.isHeaderLine(line)) {
                output.add(line);
                continue;
            }
            headers.add(AmiLines.splitHeader(line));
        }

        if (headers.isEmpty()) {
            throw new AmiDecodeException("Block contains no headers");
        }

        return new AmiMessage(kindOf(headers), headers, output);
    }

    private static AmiMessage.Kind kindOf(List<AmiHeader> headers)
    {
        boolean response = false;
        for (AmiHeader h : headers) {
            if (h.hasKey(AmiMessage.EVENT)) {
                return AmiMessage.Kind.EVENT;
            }
            if (h.hasKey(AmiMessage.RESPONSE)) {
                response = true;
            }
        }
        return response ? AmiMessage.Kind.RESPONSE : AmiMessage.Kind.UNKNOWN;
    }

    private static boolean isFollowsResponse(String firstLine)
    {
        if (!AmiLines.isHeaderLine(firstLine)) {
            return false;
        }
        AmiHeader h = AmiLines.splitHeader(firstLine);
        return h.hasKey(AmiMessage.RESPONSE) && FOLLOWS.equalsIgnoreCase(h.value());
    }
}
