package org.adcp.broker.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.adcp.broker.json.JacksonMapper;
import org.adcp.broker.protocol.model.ProtocolEnvelope;
import org.adcp.broker.protocol.model.TaskStatus;
import org.adcp.broker.protocol.model.TransportKind;

import java.util.Objects;

/**
 * Writes tool-call results: the message as a text content block and the domain result as structured
 * content next to the envelope's status and identifiers.
 */
public class ToolCallEnvelopeWriter implements EnvelopeWriter {

    private final JacksonMapper mapper;

    public ToolCallEnvelopeWriter(JacksonMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    @Override
    public TransportKind transport() {
        return TransportKind.TOOL_CALL;
    }

    @Override
    public ObjectNode write(ProtocolEnvelope envelope) {
        final ObjectNode result = mapper.mapper().createObjectNode();
        result.putArray("content").addObject()
                .put("type", "text")
                .put("text", envelope.getMessage());

        final ObjectNode structuredContent = mapper.encodeToObjectNode(envelope.getPayload());
        structuredContent.put("status", envelope.getStatus().toString());
        if (envelope.getTaskId() != null) {
            structuredContent.put("task_id", envelope.getTaskId());
        }
        if (envelope.getContextId() != null) {
            structuredContent.put("context_id", envelope.getContextId());
        }
        result.set("structured_content", structuredContent);
        result.put("is_error", envelope.getStatus() == TaskStatus.FAILED);
        return result;
    }
}
