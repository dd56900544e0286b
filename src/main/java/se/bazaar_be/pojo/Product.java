package se.bazaar_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.bazaar_be.pojo.enums.ProductStatus;

import java.math.BigDecimal;

/**
 * Catalog entry. Products are never deleted because orders reference them by id; stock is only
 * changed through the inventory queries on {@link se.bazaar_be.repository.ProductRepository}.
 */
@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_products_seller_status", columnList = "seller_id, status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Product extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long productId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "seller_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Seller seller;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "text")
    private String description;

    @Column(unique = true, length = 64)
    private String sku;

    @Column(length = 512)
    private String imageUrl;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false)
    private Integer stock;

    @Column(nullable = false, length = 3)
    @Builder.Default
    private String currency = "BDT";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ProductStatus status = ProductStatus.ACTIVE;

    @Builder.Default
    private Integer totalSales = 0;
}
