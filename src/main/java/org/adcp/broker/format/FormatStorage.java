package org.adcp.broker.format;

import org.adcp.broker.format.model.FormatDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the three format scopes. Implementations own their storage and its concurrency;
 * every lookup returns a partial or full definition, or empty when the scope has no entry.
 */
public interface FormatStorage {

    Optional<FormatDefinition> lookupProductOverride(String productId, String formatId);

    Optional<FormatDefinition> lookupTenantCustom(String tenantId, String formatId);

    Optional<FormatDefinition> lookupStandard(String formatId);

    List<FormatDefinition> standardFormats();

    List<FormatDefinition> tenantFormats(String tenantId);
}
