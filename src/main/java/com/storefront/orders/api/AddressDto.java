package com.storefront.orders.api;

import com.storefront.orders.domain.Address;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AddressDto {

    @NotBlank(message = "fullName is required")
    @Size(max = 100)
    private String fullName;

    @NotBlank(message = "line1 is required")
    @Size(max = 200)
    private String line1;

    @Size(max = 200)
    private String line2;

    @NotBlank(message = "city is required")
    private String city;

    @NotBlank(message = "postalCode is required")
    private String postalCode;

    /** ISO 3166-1 alpha-2. */
    @NotBlank(message = "country is required")
    @Size(min = 2, max = 2)
    private String country;

    private String phone;

    public Address toDomain() {
        return Address.builder()
                .fullName(fullName)
                .line1(line1)
                .line2(line2)
                .city(city)
                .postalCode(postalCode)
                .country(country)
                .phone(phone)
                .build();
    }
}
