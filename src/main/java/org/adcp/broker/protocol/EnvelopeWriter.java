package org.adcp.broker.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.adcp.broker.protocol.model.ProtocolEnvelope;
import org.adcp.broker.protocol.model.TransportKind;

/**
 * Renders a {@link ProtocolEnvelope} into the wire shape of one transport.
 */
public interface EnvelopeWriter {

    TransportKind transport();

    ObjectNode write(ProtocolEnvelope envelope);
}
