package org.adcp.broker.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.adcp.broker.json.JacksonMapper;
import org.adcp.broker.protocol.model.ProtocolEnvelope;
import org.adcp.broker.protocol.model.TransportKind;

import java.util.Objects;

/**
 * Writes tasks: status and message in the task status block, the domain result as the data part of a
 * single {@code result} artifact.
 */
public class TaskArtifactEnvelopeWriter implements EnvelopeWriter {

    private static final String ARTIFACT_ID = "result";

    private final JacksonMapper mapper;

    public TaskArtifactEnvelopeWriter(JacksonMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    @Override
    public TransportKind transport() {
        return TransportKind.TASK_ARTIFACT;
    }

    @Override
    public ObjectNode write(ProtocolEnvelope envelope) {
        final ObjectNode task = mapper.mapper().createObjectNode();
        if (envelope.getTaskId() != null) {
            task.put("id", envelope.getTaskId());
        }
        if (envelope.getContextId() != null) {
            task.put("context_id", envelope.getContextId());
        }

        final ObjectNode status = task.putObject("status")
                .put("state", envelope.getStatus().toString())
                .put("message", envelope.getMessage());
        if (envelope.getTimestamp() != null) {
            status.put("timestamp", envelope.getTimestamp().toString());
        }

        final ObjectNode artifact = task.putArray("artifacts").addObject()
                .put("artifact_id", ARTIFACT_ID)
                .put("name", envelope.getPayload().getOperation().toString());
        artifact.putArray("parts").addObject()
                .put("kind", "data")
                .set("data", mapper.encodeToObjectNode(envelope.getPayload()));
        return task;
    }
}
