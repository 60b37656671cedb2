package org.adcp.broker.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.adcp.broker.model.BrokerError;
import org.adcp.broker.model.DomainResult;
import org.adcp.broker.model.ItemKind;
import org.adcp.broker.model.ItemOutcome;
import org.adcp.broker.model.ItemStatus;
import org.adcp.broker.protocol.model.ProtocolEnvelope;
import org.adcp.broker.protocol.model.TaskStatus;
import org.adcp.broker.protocol.model.TransportKind;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Wraps domain results into transport envelopes.
 * <p>
 * Status and message are computed from the domain result alone. The transport only selects the wire
 * shape, so the same result carries the same status and message on every transport. Transport handlers
 * must not compute either themselves.
 */
public class ProtocolEnvelopeMapper {

    private final Map<TransportKind, EnvelopeWriter> writers;
    private final Clock clock;

    public ProtocolEnvelopeMapper(List<EnvelopeWriter> writers, Clock clock) {
        this.writers = new EnumMap<>(TransportKind.class);
        for (EnvelopeWriter writer : Objects.requireNonNull(writers)) {
            this.writers.put(writer.transport(), writer);
        }
        for (TransportKind transport : TransportKind.values()) {
            if (!this.writers.containsKey(transport)) {
                throw new IllegalArgumentException("No envelope writer registered for transport " + transport);
            }
        }
        this.clock = Objects.requireNonNull(clock);
    }

    public ProtocolEnvelope wrap(DomainResult result, TransportKind transport, String correlationId) {
        return wrap(result, transport, correlationId, null);
    }

    public ProtocolEnvelope wrap(DomainResult result,
                                 TransportKind transport,
                                 String correlationId,
                                 String contextId) {

        Objects.requireNonNull(result);
        Objects.requireNonNull(result.getOperation(), "Domain result without operation");
        Objects.requireNonNull(transport);

        final TaskStatus status = deriveStatus(result);
        return ProtocolEnvelope.builder()
                .transport(transport)
                .status(status)
                .taskId(correlationId)
                .contextId(contextId)
                .message(deriveMessage(result, status))
                .timestamp(clock.instant())
                .payload(result)
                .build();
    }

    public ObjectNode toWire(ProtocolEnvelope envelope) {
        return writers.get(envelope.getTransport()).write(envelope);
    }

    /**
     * Order matters: unrecoverable errors fail the operation, rejected items with at least one surviving
     * item make it partial, pending work makes it pending.
     */
    public static TaskStatus deriveStatus(DomainResult result) {
        if (result.hasErrors()) {
            return TaskStatus.FAILED;
        }

        final long rejected = result.count(ItemStatus.REJECTED);
        final long surviving = result.count(ItemStatus.ACCEPTED) + result.count(ItemStatus.PENDING);
        if (rejected > 0) {
            return surviving > 0 ? TaskStatus.PARTIAL : TaskStatus.FAILED;
        }

        if (result.getPendingReason() != null || result.count(ItemStatus.PENDING) > 0) {
            return TaskStatus.PENDING;
        }
        return TaskStatus.COMPLETED;
    }

    public static String deriveMessage(DomainResult result, TaskStatus status) {
        final String operation = result.getOperation().displayName();
        final int total = result.getItems().size();
        final long rejected = result.count(ItemStatus.REJECTED);
        final String noun = itemNoun(result.getItems(), total);

        return switch (status) {
            case FAILED -> result.hasErrors()
                    ? "%s failed: %s".formatted(operation, describeErrors(result.getErrors()))
                    : "%s failed: %d of %d %s rejected".formatted(operation, rejected, total, noun);
            case PARTIAL -> "%s partially completed: %d of %d %s rejected"
                    .formatted(operation, rejected, total, noun);
            case PENDING -> result.getPendingReason() != null
                    ? "%s pending%s: %s".formatted(operation, mediaBuySuffix(result),
                    result.getPendingReason().description())
                    : "%s pending%s: %d of %d %s awaiting approval".formatted(operation, mediaBuySuffix(result),
                    result.count(ItemStatus.PENDING), total, noun);
            case COMPLETED -> total > 0
                    ? "%s completed%s: %d of %d %s accepted".formatted(operation, mediaBuySuffix(result),
                    result.count(ItemStatus.ACCEPTED), total, noun)
                    : "%s completed%s".formatted(operation, mediaBuySuffix(result));
        };
    }

    private static String describeErrors(List<BrokerError> errors) {
        final String first = errors.get(0).getMessage();
        return errors.size() > 1
                ? "%s (and %d more error(s))".formatted(first, errors.size() - 1)
                : first;
    }

    private static String mediaBuySuffix(DomainResult result) {
        return result.getMediaBuyId() != null ? " for media buy " + result.getMediaBuyId() : "";
    }

    private static String itemNoun(List<ItemOutcome> items, long count) {
        final ItemKind kind = items.isEmpty() ? null : items.get(0).getKind();
        final boolean uniform = kind != null && items.stream().allMatch(item -> item.getKind() == kind);
        if (uniform) {
            return kind.noun(count);
        }
        return count == 1 ? "item" : "items";
    }
}
