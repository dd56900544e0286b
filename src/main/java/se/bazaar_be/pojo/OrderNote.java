package se.bazaar_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.bazaar_be.pojo.enums.NoteAuthorType;

import java.time.LocalDateTime;

@Entity
@Table(name = "order_notes")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderNote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long noteId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    @ToString.Exclude
    private Order order;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private NoteAuthorType type;

    @Column(nullable = false, columnDefinition = "text", updatable = false)
    private String message;

    @Column(length = 50, updatable = false)
    private String createdBy;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
