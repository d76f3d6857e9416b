package com.questrail.amilink.protocol.ami.codec.impl;

import com.questrail.amilink.protocol.ami.codec.AmiActionEncoder;
import com.questrail.amilink.protocol.ami.model.AmiAction;
import com.questrail.amilink.protocol.ami.model.AmiHeader;
import com.questrail.amilink.protocol.ami.model.AmiMessage;

import java.util.Objects;

/**
 * Concrete implementation of {@link AmiActionEncoder}.
 *
 * <p>A caller-supplied {@code ActionID} parameter is dropped: the correlator
 * owns that field and two values would make matching ambiguous.</p>
 */
public final class DefaultAmiActionEncoder implements AmiActionEncoder
{
    @Override
    public String encode(AmiAction action, String actionId)
    {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(actionId, "actionId");

        StringBuilder sb = new StringBuilder(64 + action.parameters().size() * 32);
        appendLine(sb, "Action", action.name());
        appendLine(sb, AmiMessage.ACTION_ID, actionId);

        for (AmiHeader p : action.parameters()) {
            if (p.hasKey(AmiMessage.ACTION_ID) || p.hasKey("Action")) {
                continue;
            }
            appendLine(sb, p.key(), p.value());
        }

        sb.append(AmiLines.CRLF);
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String key, String value)
    {
        AmiLines.requireSingleLine("header name '" + key + "'", key);
        AmiLines.requireSingleLine("value of '" + key + "'", value);
        if (key.isBlank() || key.indexOf(AmiLines.SEPARATOR) >= 0) {
            throw new IllegalArgumentException("invalid header name '" + key + "'");
        }
        sb.append(key).append(": ").append(value).append(AmiLines.CRLF);
    }
}
