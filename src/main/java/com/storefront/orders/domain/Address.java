package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Address {

    String fullName;
    String line1;
    String line2;
    String city;
    String postalCode;
    String country;
    String phone;
}
