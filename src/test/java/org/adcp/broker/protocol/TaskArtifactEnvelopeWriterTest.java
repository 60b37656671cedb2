package org.adcp.broker.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.adcp.broker.MapperTest;
import org.adcp.broker.model.DomainResult;
import org.adcp.broker.model.Operation;
import org.adcp.broker.model.PendingReason;
import org.adcp.broker.protocol.model.ProtocolEnvelope;
import org.adcp.broker.protocol.model.TaskStatus;
import org.adcp.broker.protocol.model.TransportKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class TaskArtifactEnvelopeWriterTest extends MapperTest {

    private TaskArtifactEnvelopeWriter target;

    @BeforeEach
    public void setUp() {
        target = new TaskArtifactEnvelopeWriter(jacksonMapper);
    }

    @Test
    public void writeShouldRenderStatusBlockAndResultArtifact() {
        // given
        final ProtocolEnvelope envelope = ProtocolEnvelope.builder()
                .transport(TransportKind.TASK_ARTIFACT)
                .status(TaskStatus.PENDING)
                .taskId("task-1")
                .contextId("ctx-1")
                .message("Creative sync pending for media buy order-1: awaiting creative review")
                .timestamp(Instant.parse("2026-03-01T10:15:30Z"))
                .payload(DomainResult.builder()
                        .operation(Operation.SYNC_CREATIVES)
                        .mediaBuyId("order-1")
                        .pendingReason(PendingReason.CREATIVE_REVIEW)
                        .build())
                .build();

        // when
        final ObjectNode result = target.write(envelope);

        // then
        assertThat(result).isEqualTo(json("""
                {
                  "id": "task-1",
                  "context_id": "ctx-1",
                  "status": {
                    "state": "pending",
                    "message": "Creative sync pending for media buy order-1: awaiting creative review",
                    "timestamp": "2026-03-01T10:15:30Z"
                  },
                  "artifacts": [{
                    "artifact_id": "result",
                    "name": "sync_creatives",
                    "parts": [{
                      "kind": "data",
                      "data": {
                        "operation": "sync_creatives",
                        "media_buy_id": "order-1",
                        "items": [],
                        "errors": [],
                        "pending_reason": "creative_review"
                      }
                    }]
                  }]
                }"""));
    }

    @Test
    public void writeShouldOmitAbsentIdentifiers() {
        // given
        final ProtocolEnvelope envelope = ProtocolEnvelope.builder()
                .transport(TransportKind.TASK_ARTIFACT)
                .status(TaskStatus.COMPLETED)
                .message("Creative sync completed")
                .payload(DomainResult.builder().operation(Operation.SYNC_CREATIVES).build())
                .build();

        // when
        final ObjectNode result = target.write(envelope);

        // then
        assertThat(result.has("id")).isFalse();
        assertThat(result.has("context_id")).isFalse();
        assertThat(result.at("/status").has("timestamp")).isFalse();
    }
}
