package se.bazaar_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Marketplace account as far as this service needs it. Credentials and profile data are owned
 * by the account service.
 */
@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long userId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, unique = true, length = 100)
    private String email;

    @Builder.Default
    private Integer trustScore = 0;

    @Builder.Default
    private Boolean isVerified = false;

    @Column(length = 20)
    @Builder.Default
    private String accountStatus = "active";

    @CreationTimestamp
    private LocalDateTime joinedDate;
}
