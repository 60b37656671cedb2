package org.adcp.broker.format;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.adcp.broker.exception.UnknownFormatException;
import org.adcp.broker.format.model.FormatDefinition;
import org.adcp.broker.format.model.FormatScope;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;
import org.adcp.broker.util.JsonMergeUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Resolves a format identifier through the product, tenant and standard scopes, in that order.
 * <p>
 * The first scope holding an entry wins. Entries of lower scopes that also hold the identifier are
 * deep-merged beneath it, so a product override may replace a single placement setting while the
 * standard requirements are inherited.
 */
public class FormatResolver {

    private static final Logger logger = LoggerFactory.getLogger(FormatResolver.class);

    private final JsonMergeUtil jsonMergeUtil;
    private final List<FormatLayer> layers;

    public FormatResolver(FormatStorage formatStorage, JsonMergeUtil jsonMergeUtil) {
        Objects.requireNonNull(formatStorage);
        this.jsonMergeUtil = Objects.requireNonNull(jsonMergeUtil);

        layers = List.of(
                FormatLayer.of(FormatScope.PRODUCT,
                        query -> query.getProductId() != null,
                        query -> formatStorage.lookupProductOverride(query.getProductId(), query.getFormatId())),
                FormatLayer.of(FormatScope.TENANT,
                        query -> query.getTenantId() != null,
                        query -> formatStorage.lookupTenantCustom(query.getTenantId(), query.getFormatId())),
                FormatLayer.of(FormatScope.STANDARD,
                        query -> true,
                        query -> formatStorage.lookupStandard(query.getFormatId())));
    }

    /**
     * Returns the effective definition of {@code formatId}. Tenant and product scopes are optional
     * and skipped when null.
     *
     * @throws UnknownFormatException when no consulted scope holds a complete definition
     */
    public FormatDefinition resolve(String formatId, String tenantId, String productId) {
        final FormatQuery query = FormatQuery.of(formatId, tenantId, productId);
        final List<FormatScope> searchedScopes = new ArrayList<>();
        final List<FormatDefinition> hits = new ArrayList<>();
        FormatScope winner = null;

        if (StringUtils.isNotBlank(formatId)) {
            for (FormatLayer layer : layers) {
                if (!layer.getApplicable().test(query)) {
                    continue;
                }
                searchedScopes.add(layer.getScope());
                final Optional<FormatDefinition> hit = layer.getLookup().apply(query);
                if (hit.isPresent()) {
                    hits.add(hit.get());
                    winner = winner != null ? winner : layer.getScope();
                }
            }
        }

        final FormatDefinition merged = mergeFromLowestScope(hits);
        if (merged == null || merged.getMediaKind() == null) {
            throw unknownFormat(query, searchedScopes, !hits.isEmpty());
        }

        logger.debug("Format '{}' resolved from {} scope ({} scope(s) merged)", formatId, winner, hits.size());
        return merged.toBuilder()
                .formatId(formatId)
                .scope(winner)
                .build();
    }

    private FormatDefinition mergeFromLowestScope(List<FormatDefinition> hits) {
        FormatDefinition result = null;
        for (int i = hits.size() - 1; i >= 0; i--) {
            result = jsonMergeUtil.merge(result, hits.get(i), FormatDefinition.class);
        }
        return result;
    }

    private static UnknownFormatException unknownFormat(FormatQuery query,
                                                        List<FormatScope> searchedScopes,
                                                        boolean partialOnly) {

        final String searched = searchedScopes.stream()
                .map(scope -> describe(scope, query))
                .collect(Collectors.joining(", "));
        final String message = partialOnly
                ? "Format '%s' has only partial overrides and no base definition (searched: %s)"
                .formatted(query.getFormatId(), searched)
                : "Unknown format_id '%s' (searched: %s)".formatted(query.getFormatId(), searched);

        return new UnknownFormatException(query.getFormatId(), searchedScopes, message);
    }

    private static String describe(FormatScope scope, FormatQuery query) {
        return switch (scope) {
            case PRODUCT -> "product " + query.getProductId();
            case TENANT -> "tenant " + query.getTenantId();
            case STANDARD -> "standard registry";
        };
    }

    @Value(staticConstructor = "of")
    private static class FormatQuery {

        String formatId;

        String tenantId;

        String productId;
    }

    @Value(staticConstructor = "of")
    private static class FormatLayer {

        FormatScope scope;

        Predicate<FormatQuery> applicable;

        Function<FormatQuery, Optional<FormatDefinition>> lookup;
    }
}
