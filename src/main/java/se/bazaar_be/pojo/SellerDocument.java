package se.bazaar_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.bazaar_be.pojo.enums.DocumentStatus;
import se.bazaar_be.pojo.enums.DocumentType;

import java.time.LocalDateTime;

@Entity
@Table(name = "seller_documents")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SellerDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "seller_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Seller seller;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false, length = 30)
    private DocumentType type;

    @Column(name = "document_url", nullable = false, length = 512)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DocumentStatus status = DocumentStatus.PENDING;

    @Column(name = "uploaded_at", nullable = false, updatable = false)
    private LocalDateTime uploadedAt;
}
