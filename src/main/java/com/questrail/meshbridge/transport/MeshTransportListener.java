package com.questrail.meshbridge.transport;

import com.questrail.meshbridge.api.MeshReport;

/**
 * Callback sink for {@link MeshTransport}.
 *
 * <p>The transport has already framed, decoded and de-duplicated the message;
 * the listener sees only semantic reports.</p>
 */
@FunctionalInterface
public interface MeshTransportListener
{
    void onReport(MeshReport report);
}
