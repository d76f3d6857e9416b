package com.questrail.amilink.protocol.ami.internal.state;

import com.questrail.amilink.api.CallDirection;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derivations from channel names and dialplan contexts.
 *
 * <p>These are heuristics for typical FreePBX-style dialplans, not PBX
 * configuration semantics.</p>
 */
public final class AmiChannels
{
    /** Leading digits after the technology, e.g. {@code SIP/1001-00000001} or {@code PJSIP/1001;2}. */
    private static final Pattern LOCAL_EXTENSION = Pattern.compile("(?:PJSIP|SIP|IAX2)/(\\d+)");

    private static final String[] EXTERNAL_MARKERS = {"from-external", "from-pstn", "from-trunk"};
    private static final String INTERNAL_MARKER = "from-internal";

    private AmiChannels() {}

    /**
     * @return the numeric extension a channel belongs to, or {@code ""} when
     *         the channel is not a local SIP-family endpoint
     */
    public static String extensionOf(String channel) {
        if (channel == null) {
            return "";
        }
        Matcher m = LOCAL_EXTENSION.matcher(channel);
        return m.find() ? m.group(1) : "";
    }

    /**
     * Contexts that receive calls from trunks are inbound; calls placed from
     * the internal context go outbound; everything else stays internal.
     */
    public static CallDirection directionOf(String context) {
        if (context == null) {
            return CallDirection.INTERNAL;
        }
        String c = context.toLowerCase(Locale.ROOT);
        for (String marker : EXTERNAL_MARKERS) {
            if (c.contains(marker)) {
                return CallDirection.INBOUND;
            }
        }
        if (c.contains(INTERNAL_MARKER)) {
            return CallDirection.OUTBOUND;
        }
        return CallDirection.INTERNAL;
    }
}
