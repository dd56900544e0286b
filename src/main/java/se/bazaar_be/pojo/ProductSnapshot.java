package se.bazaar_be.pojo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Display fields copied from the product when the order is placed, so later catalog edits
 * do not rewrite order history.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductSnapshot {

    @Column(name = "snapshot_name", nullable = false, length = 200)
    private String name;

    @Column(name = "snapshot_image", length = 512)
    private String image;

    @Column(name = "snapshot_sku", length = 64)
    private String sku;
}
