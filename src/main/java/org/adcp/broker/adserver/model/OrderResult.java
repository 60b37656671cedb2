package org.adcp.broker.adserver.model;

import lombok.Value;

import java.util.Map;

@Value(staticConstructor = "of")
public class OrderResult {

    String orderId;

    /**
     * Line item id per package id.
     */
    Map<String, String> lineItemIds;
}
