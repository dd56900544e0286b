package se.bazaar_be.pojo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShippingAddress {

    @Column(name = "ship_name", nullable = false, length = 100)
    private String name;

    @Column(name = "ship_phone", nullable = false, length = 20)
    private String phone;

    @Column(name = "ship_street", nullable = false, length = 255)
    private String street;

    @Column(name = "ship_city", nullable = false, length = 100)
    private String city;

    @Column(name = "ship_division", nullable = false, length = 100)
    private String division;

    @Column(name = "ship_postal_code", nullable = false, length = 20)
    private String postalCode;

    @Column(name = "ship_country", nullable = false, length = 60)
    @Builder.Default
    private String country = "Bangladesh";
}
