package com.storefront.orders.domain;

import lombok.Value;

/**
 * The caller as established by the upstream authentication layer.
 */
@Value
public class AuthenticatedPrincipal {

    public enum Role {
        CUSTOMER,
        ADMIN
    }

    String id;
    Role role;

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public static AuthenticatedPrincipal customer(String id) {
        return new AuthenticatedPrincipal(id, Role.CUSTOMER);
    }

    public static AuthenticatedPrincipal admin(String id) {
        return new AuthenticatedPrincipal(id, Role.ADMIN);
    }
}
