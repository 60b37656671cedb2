package org.adcp.broker.adserver.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class AssociationResult {

    String creativeServerId;

    boolean pendingReview;
}
