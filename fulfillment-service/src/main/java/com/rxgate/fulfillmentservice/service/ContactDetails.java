package com.rxgate.fulfillmentservice.service;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Normalized patient contact. Either value may be null.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ContactDetails {
    private final String phone;
    private final String email;
}
