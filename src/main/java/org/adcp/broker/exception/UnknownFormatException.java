package org.adcp.broker.exception;

import lombok.Getter;
import org.adcp.broker.format.model.FormatScope;

import java.util.List;

@Getter
@SuppressWarnings("serial")
public class UnknownFormatException extends BrokerException {

    private final String formatId;

    private final List<FormatScope> searchedScopes;

    public UnknownFormatException(String formatId, List<FormatScope> searchedScopes, String message) {
        super(message);
        this.formatId = formatId;
        this.searchedScopes = List.copyOf(searchedScopes);
    }
}
